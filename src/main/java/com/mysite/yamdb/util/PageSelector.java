package com.mysite.yamdb.util;

import com.mysite.yamdb.handler.ApiException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.function.Function;

/**
 * page 파라미터 (1부터 시작하는 번호 또는 "last") 를 해석해 해당 페이지를 조회한다.
 * <p>
 * 범위를 벗어나거나 숫자가 아닌 값은 404 "Invalid page." 로 처리한다.
 * 결과가 하나도 없어도 첫 페이지는 항상 유효하다.
 */
public final class PageSelector {

    public static final String LAST = "last";
    public static final String INVALID_PAGE = "Invalid page.";

    private PageSelector() {
    }

    public static <T> Page<T> select(String rawPage, int pageSize, Function<Pageable, Page<T>> query) {
        if (LAST.equals(rawPage)) {
            Page<T> first = query.apply(PageRequest.of(0, pageSize));
            int lastIndex = Math.max(first.getTotalPages(), 1) - 1;
            return lastIndex == 0 ? first : query.apply(PageRequest.of(lastIndex, pageSize));
        }

        int number = parse(rawPage);
        Page<T> page = query.apply(PageRequest.of(number - 1, pageSize));
        if (number > Math.max(page.getTotalPages(), 1)) {
            throw ApiException.notFound(INVALID_PAGE);
        }
        return page;
    }

    static int parse(String rawPage) {
        if (rawPage == null || rawPage.isBlank()) {
            return 1;
        }
        try {
            int number = Integer.parseInt(rawPage.trim());
            if (number < 1) {
                throw ApiException.notFound(INVALID_PAGE);
            }
            return number;
        } catch (NumberFormatException e) {
            throw ApiException.notFound(INVALID_PAGE);
        }
    }
}
