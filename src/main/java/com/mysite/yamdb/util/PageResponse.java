package com.mysite.yamdb.util;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.function.Function;

/**
 * API 목록 응답 공통 형태: {count, next, previous, results}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {
    private long count;
    private String next;
    private String previous;
    private List<T> results;

    public static <E, T> PageResponse<T> of(Page<E> page, Function<E, T> mapper) {
        return PageResponse.<T>builder()
                .count(page.getTotalElements())
                .next(page.hasNext() ? pageLink(page.getNumber() + 2) : null)
                .previous(page.hasPrevious() ? pageLink(page.getNumber()) : null)
                .results(page.getContent().stream().map(mapper).toList())
                .build();
    }

    /**
     * 현재 요청 주소에서 page 파라미터만 바꾼 링크. 첫 페이지는 page 파라미터를 뺀다.
     */
    private static String pageLink(int pageNumber) {
        if (RequestContextHolder.getRequestAttributes() == null) {
            return pageNumber == 1 ? "" : "?page=" + pageNumber;
        }
        UriComponentsBuilder builder = ServletUriComponentsBuilder.fromCurrentRequest();
        if (pageNumber == 1) {
            builder.replaceQueryParam("page");
        } else {
            builder.replaceQueryParam("page", pageNumber);
        }
        return builder.toUriString();
    }
}
