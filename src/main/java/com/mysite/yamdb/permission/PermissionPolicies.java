package com.mysite.yamdb.permission;

import com.mysite.yamdb.user.SiteUser;
import org.springframework.http.HttpMethod;

public final class PermissionPolicies {

    private PermissionPolicies() {
    }

    /**
     * 로그인한 admin 등급 또는 staff 만 허용
     */
    public static final PermissionPolicy ADMIN_ONLY =
            (user, method) -> Authorization.isAdministrator(user);

    /**
     * 조회는 누구나, 그 외에는 로그인한 admin 만
     */
    public static final PermissionPolicy ADMIN_OR_READ_ONLY =
            (user, method) -> PermissionPolicy.isSafe(method) || Authorization.hasAdminRole(user);

    public static final PermissionPolicy AUTHENTICATED =
            (user, method) -> user != null;

    /**
     * 조회는 누구나. 생성은 로그인 사용자 누구나.
     * 기존 인스턴스의 수정·삭제는 작성자 본인이나 moderator/admin/staff 만.
     */
    public static final PermissionPolicy AUTHOR_OR_PRIVILEGED_OR_READ_ONLY = new PermissionPolicy() {
        @Override
        public boolean hasPermission(SiteUser user, HttpMethod method) {
            return PermissionPolicy.isSafe(method) || user != null;
        }

        @Override
        public boolean hasObjectPermission(SiteUser user, HttpMethod method, Authored target) {
            return PermissionPolicy.isSafe(method)
                    || user != null && Authorization.canModify(user, target);
        }
    };
}
