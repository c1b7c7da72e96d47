package com.mysite.yamdb.category;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 카테고리 요청/응답 공통 형태 {name, slug}
 */
public record CategoryDto(
        @NotBlank(message = "This field is required.")
        @Size(max = 256, message = "Ensure this field has no more than 256 characters.")
        String name,

        @NotBlank(message = "This field is required.")
        @Size(max = 50, message = "Ensure this field has no more than 50 characters.")
        @Pattern(regexp = "^[-a-zA-Z0-9_]+$",
                message = "Enter a valid \"slug\" consisting of letters, numbers, underscores or hyphens.")
        String slug
) {
    public static CategoryDto fromEntity(CategoryEntity category) {
        return new CategoryDto(category.getName(), category.getSlug());
    }
}
