package com.mysite.yamdb.permission;

import com.mysite.yamdb.user.SiteUser;
import org.springframework.http.HttpMethod;

import java.util.Set;

/**
 * 엔드포인트에 붙는 권한 규칙.
 * <p>
 * user 가 null 이면 익명 요청이다. 여러 규칙은 {@link #and(PermissionPolicy)} 로 묶으며
 * 모두 허용해야 통과한다.
 */
public interface PermissionPolicy {

    Set<HttpMethod> SAFE_METHODS = Set.of(HttpMethod.GET, HttpMethod.HEAD, HttpMethod.OPTIONS);

    static boolean isSafe(HttpMethod method) {
        return SAFE_METHODS.contains(method);
    }

    /**
     * 컬렉션 수준 (목록 조회, 생성 등) 판단
     */
    boolean hasPermission(SiteUser user, HttpMethod method);

    /**
     * 특정 인스턴스에 대한 판단. 기본은 허용 (컬렉션 수준 판단만 하는 규칙)
     */
    default boolean hasObjectPermission(SiteUser user, HttpMethod method, Authored target) {
        return true;
    }

    default PermissionPolicy and(PermissionPolicy other) {
        PermissionPolicy self = this;
        return new PermissionPolicy() {
            @Override
            public boolean hasPermission(SiteUser user, HttpMethod method) {
                return self.hasPermission(user, method) && other.hasPermission(user, method);
            }

            @Override
            public boolean hasObjectPermission(SiteUser user, HttpMethod method, Authored target) {
                return self.hasObjectPermission(user, method, target)
                        && other.hasObjectPermission(user, method, target);
            }
        };
    }
}
