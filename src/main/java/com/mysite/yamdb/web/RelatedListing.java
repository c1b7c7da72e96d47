package com.mysite.yamdb.web;

import org.springframework.data.domain.Page;

import java.util.function.Function;

/**
 * 상위 객체 하나와 그에 딸린 목록을 페이지 단위로 보여주는 화면 설정.
 *
 * @param viewName          템플릿 이름
 * @param parentAttribute   상위 객체 모델 이름 (title, category ...)
 * @param childrenAttribute 목록 모델 이름 (reviews, titles ...)
 * @param parentLookup      경로 값 (id, slug, username) 으로 상위 객체 조회. 없으면 404
 * @param children          상위 객체 + page 파라미터로 목록 페이지 조회
 */
public record RelatedListing<P, C>(
        String viewName,
        String parentAttribute,
        String childrenAttribute,
        Function<String, P> parentLookup,
        ChildPageQuery<P, C> children
) {

    @FunctionalInterface
    public interface ChildPageQuery<P, C> {
        Page<C> fetch(P parent, String page);
    }
}
