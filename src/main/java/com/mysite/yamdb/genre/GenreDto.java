package com.mysite.yamdb.genre;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record GenreDto(
        @NotBlank(message = "This field is required.")
        @Size(max = 256, message = "Ensure this field has no more than 256 characters.")
        String name,

        @NotBlank(message = "This field is required.")
        @Size(max = 50, message = "Ensure this field has no more than 50 characters.")
        @Pattern(regexp = "^[-a-zA-Z0-9_]+$",
                message = "Enter a valid \"slug\" consisting of letters, numbers, underscores or hyphens.")
        String slug
) {
    public static GenreDto fromEntity(GenreEntity genre) {
        return new GenreDto(genre.getName(), genre.getSlug());
    }
}
