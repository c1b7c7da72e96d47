package com.mysite.yamdb.title;

import com.mysite.yamdb.category.CategoryDto;
import com.mysite.yamdb.genre.GenreDto;

import java.util.List;

/**
 * 작품 읽기 형태. 카테고리/장르를 객체로 펼쳐 보여주고 평균 평점을 포함한다.
 */
public record TitleResponse(
        Long id,
        String name,
        Integer year,
        Double rating,
        String description,
        List<GenreDto> genre,
        CategoryDto category
) {
    public static TitleResponse fromEntity(TitleEntity title, Double rating) {
        return new TitleResponse(
                title.getId(),
                title.getName(),
                title.getYear(),
                rating,
                title.getDescription(),
                title.getGenres().stream().map(GenreDto::fromEntity).toList(),
                CategoryDto.fromEntity(title.getCategory())
        );
    }

    static TitleResponse fromRow(Object[] row) {
        return fromEntity((TitleEntity) row[0], row[1] == null ? null : ((Number) row[1]).doubleValue());
    }
}
