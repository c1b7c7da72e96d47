package com.mysite.yamdb.jwt.Auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TokenRequest(
        @NotBlank(message = "This field is required.")
        @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
        String username,

        @JsonProperty("confirmation_code")
        @NotBlank(message = "This field is required.")
        String confirmationCode
) {
}
