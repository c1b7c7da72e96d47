package com.mysite.yamdb.web;

import com.mysite.yamdb.user.SiteUser;

import java.util.function.Function;

/**
 * 상위 객체에 딸린 새 객체를 만드는 화면 흐름 설정 (리뷰, 댓글).
 * 작성자와 상위 객체는 요청 본문이 아니라 서버에서 채운다.
 *
 * @param parentLookup     경로의 상위 id 로 상위 객체 조회. 없으면 404
 * @param successLocation  저장 후 이동할 주소 (상위 id 기준)
 * @param fallbackLocation 입력이 잘못됐거나 저장이 거절됐을 때 이동할 주소
 * @param action           실제 저장
 */
public record CreateFlow<P, F>(
        Function<Long, P> parentLookup,
        Function<Long, String> successLocation,
        String fallbackLocation,
        CreateAction<P, F> action
) {

    @FunctionalInterface
    public interface CreateAction<P, F> {
        void create(P parent, SiteUser author, F form);
    }
}
