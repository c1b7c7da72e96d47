package com.mysite.yamdb.web.form;

import com.mysite.yamdb.user.validation.ValidUsername;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SignupForm {

    @NotBlank(message = "This field is required.")
    @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
    @ValidUsername
    private String username;

    @NotBlank(message = "This field is required.")
    @Email(message = "Enter a valid email address.")
    @Size(max = 254, message = "Ensure this field has no more than 254 characters.")
    private String email;

    @NotBlank(message = "This field is required.")
    private String password1;

    @NotBlank(message = "This field is required.")
    private String password2;
}
