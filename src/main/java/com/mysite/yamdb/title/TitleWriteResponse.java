package com.mysite.yamdb.title;

import com.mysite.yamdb.genre.GenreEntity;

import java.util.List;

/**
 * 생성/수정 응답. 요청과 같은 slug 기반 형태로 돌려준다.
 */
public record TitleWriteResponse(
        Long id,
        String name,
        Integer year,
        String description,
        List<String> genre,
        String category
) {
    public static TitleWriteResponse fromEntity(TitleEntity title) {
        return new TitleWriteResponse(
                title.getId(),
                title.getName(),
                title.getYear(),
                title.getDescription(),
                title.getGenres().stream().map(GenreEntity::getSlug).toList(),
                title.getCategory().getSlug()
        );
    }
}
