package com.mysite.yamdb.web;

import com.mysite.yamdb.permission.Authored;

import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 작성자가 있는 객체를 지우는 화면 흐름 설정.
 *
 * @param lookup          (상위 id, 대상 id) 로 대상 조회. 상위에 속하지 않으면 404
 * @param successLocation 삭제 후 이동할 주소 (상위 id 기준)
 * @param action          실제 삭제
 */
public record DeleteFlow<T extends Authored>(
        BiFunction<Long, Long, T> lookup,
        Function<Long, String> successLocation,
        Consumer<T> action
) {
}
