package com.mysite.yamdb.review;

import com.mysite.yamdb.util.OnCreate;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record ReviewRequest(
        @NotBlank(groups = OnCreate.class, message = "This field is required.")
        @Pattern(regexp = "(?s).*\\S.*", message = "This field may not be blank.")
        String text,

        @NotNull(groups = OnCreate.class, message = "This field is required.")
        @Min(value = 0, message = "Ensure this value is greater than or equal to 0.")
        @Max(value = 10, message = "Ensure this value is less than or equal to 10.")
        Integer score
) {
}
