package com.mysite.yamdb.permission;

import com.mysite.yamdb.user.Role.Role;
import com.mysite.yamdb.user.SiteUser;

/**
 * 역할 기반 판단을 한 곳에 모은 유틸리티.
 * 컨트롤러/서비스/템플릿 어디서든 문자열 비교 대신 이 메서드만 사용한다.
 */
public final class Authorization {

    private Authorization() {
    }

    public static boolean hasAdminRole(SiteUser user) {
        return user != null && user.getRole() == Role.ADMIN;
    }

    /**
     * admin 등급이거나 staff 플래그가 있는 사용자
     */
    public static boolean isAdministrator(SiteUser user) {
        return user != null && (user.getRole() == Role.ADMIN || user.isStaff());
    }

    /**
     * moderator/admin 등급 또는 staff
     */
    public static boolean isPrivileged(SiteUser user) {
        return user != null && (user.getRole().isPrivileged() || user.isStaff());
    }

    public static boolean isAuthor(SiteUser user, Authored target) {
        if (user == null || target == null || target.getAuthor() == null) {
            return false;
        }
        SiteUser author = target.getAuthor();
        if (user.getId() != null && author.getId() != null) {
            return user.getId().equals(author.getId());
        }
        return user.getUsername() != null && user.getUsername().equals(author.getUsername());
    }

    /**
     * 작성자 본인 또는 특권 사용자만 수정·삭제할 수 있다
     */
    public static boolean canModify(SiteUser user, Authored target) {
        return isAuthor(user, target) || isPrivileged(user);
    }
}
