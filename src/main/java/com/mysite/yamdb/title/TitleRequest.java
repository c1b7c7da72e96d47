package com.mysite.yamdb.title;

import com.mysite.yamdb.title.validation.NotFutureYear;
import com.mysite.yamdb.util.OnCreate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 작품 쓰기 형태. 카테고리/장르는 slug 로 받는다.
 * PATCH 에서는 보낸 필드만 반영한다.
 */
public record TitleRequest(
        @NotBlank(groups = OnCreate.class, message = "This field is required.")
        @Pattern(regexp = "(?s).*\\S.*", message = "This field may not be blank.")
        @Size(max = 256, message = "Ensure this field has no more than 256 characters.")
        String name,

        @NotNull(groups = OnCreate.class, message = "This field is required.")
        @NotFutureYear
        Integer year,

        String description,

        @NotNull(groups = OnCreate.class, message = "This field is required.")
        List<String> genre,

        @NotBlank(groups = OnCreate.class, message = "This field is required.")
        @Pattern(regexp = "(?s).*\\S.*", message = "This field may not be blank.")
        String category
) {
}
