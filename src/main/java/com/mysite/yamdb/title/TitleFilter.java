package com.mysite.yamdb.title;

import com.mysite.yamdb.handler.ApiException;

/**
 * 작품 목록 필터. 모두 선택이며 함께 적용된다.
 *
 * @param category 카테고리 slug (정확히 일치)
 * @param genre    장르 slug (정확히 일치)
 * @param name     이름 부분 일치 (대소문자 무시)
 * @param year     연도 (정확히 일치)
 */
public record TitleFilter(String category, String genre, String name, Integer year) {

    public static TitleFilter of(String category, String genre, String name, String year) {
        return new TitleFilter(blankToNull(category), blankToNull(genre), blankToNull(name), parseYear(year));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Integer parseYear(String year) {
        String value = blankToNull(year);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw ApiException.invalid("year", "Enter a number.");
        }
    }
}
