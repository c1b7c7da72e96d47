package com.mysite.yamdb.util;

/**
 * 생성 요청에서만 필수인 필드를 표시하는 검증 그룹 (PATCH 는 부분 수정)
 */
public interface OnCreate {
}
