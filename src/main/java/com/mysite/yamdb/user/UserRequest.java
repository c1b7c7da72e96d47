package com.mysite.yamdb.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mysite.yamdb.user.validation.ValidUsername;
import com.mysite.yamdb.util.OnCreate;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 사용자 생성/수정 요청. role 은 문자열로 받아 서비스에서 변환한다.
 */
public record UserRequest(
        @NotBlank(groups = OnCreate.class, message = "This field is required.")
        @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
        @ValidUsername
        String username,

        @NotBlank(groups = OnCreate.class, message = "This field is required.")
        @Pattern(regexp = "(?s).*\\S.*", message = "This field may not be blank.")
        @Email(message = "Enter a valid email address.")
        @Size(max = 254, message = "Ensure this field has no more than 254 characters.")
        String email,

        @JsonProperty("first_name")
        @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
        String firstName,

        @JsonProperty("last_name")
        @Size(max = 150, message = "Ensure this field has no more than 150 characters.")
        String lastName,

        String bio,

        String role
) {
}
