package com.mysite.yamdb.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mysite.yamdb.user.Role.Role;

public record UserResponse(
        String username,
        String email,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        String bio,
        Role role
) {
    public static UserResponse fromEntity(SiteUser user) {
        return new UserResponse(
                user.getUsername(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getBio(),
                user.getRole()
        );
    }
}
