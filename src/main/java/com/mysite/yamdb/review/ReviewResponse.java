package com.mysite.yamdb.review;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record ReviewResponse(
        Long id,
        String author,
        String text,
        Integer score,
        @JsonProperty("pub_date") LocalDateTime pubDate
) {
    public static ReviewResponse fromEntity(ReviewEntity review) {
        return new ReviewResponse(
                review.getId(),
                review.getAuthor().getUsername(),
                review.getText(),
                review.getScore(),
                review.getPubDate()
        );
    }
}
