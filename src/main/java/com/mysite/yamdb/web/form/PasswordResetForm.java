package com.mysite.yamdb.web.form;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PasswordResetForm {

    @NotBlank(message = "This field is required.")
    @Email(message = "Enter a valid email address.")
    private String email;
}
