package com.mysite.yamdb.jwt.Auth;

import com.mysite.yamdb.user.validation.ValidUsername;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotBlank(message = "This field is required.")
        @Email(message = "Enter a valid email address.")
        @Size(max = 254, message = "Ensure this field has no more than 254 characters.")
        String email,

        @NotBlank(message = "This field is required.")
        @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
        @ValidUsername
        String username
) {
}
