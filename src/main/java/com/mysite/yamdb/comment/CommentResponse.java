package com.mysite.yamdb.comment;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record CommentResponse(
        Long id,
        Long review,
        String author,
        String text,
        @JsonProperty("pub_date") LocalDateTime pubDate
) {
    public static CommentResponse fromEntity(CommentEntity comment) {
        return new CommentResponse(
                comment.getId(),
                comment.getReview().getId(),
                comment.getAuthor().getUsername(),
                comment.getText(),
                comment.getPubDate()
        );
    }
}
