package com.mysite.yamdb.web.form;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class ReviewForm {

    @NotBlank(message = "This field is required.")
    private String text;

    @NotNull(message = "This field is required.")
    @Min(value = 0, message = "Ensure this value is greater than or equal to 0.")
    @Max(value = 10, message = "Ensure this value is less than or equal to 10.")
    private Integer score;

    public ReviewForm(String text, Integer score) {
        this.text = text;
        this.score = score;
    }
}
