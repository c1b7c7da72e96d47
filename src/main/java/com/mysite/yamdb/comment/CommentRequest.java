package com.mysite.yamdb.comment;

import com.mysite.yamdb.util.OnCreate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record CommentRequest(
        @NotBlank(groups = OnCreate.class, message = "This field is required.")
        @Pattern(regexp = "(?s).*\\S.*", message = "This field may not be blank.")
        String text
) {
}
