package com.mysite.yamdb.permission;

import com.mysite.yamdb.user.Role.Role;
import com.mysite.yamdb.user.SiteUser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import static org.assertj.core.api.Assertions.assertThat;

class PermissionPoliciesTest {

    private static SiteUser user(long id, Role role, boolean staff) {
        SiteUser user = SiteUser.builder()
                .username("user" + id)
                .email("user" + id + "@test.com")
                .role(role)
                .staff(staff)
                .build();
        user.setId(id);
        return user;
    }

    private static Authored writtenBy(SiteUser author) {
        return () -> author;
    }

    @Test
    @DisplayName("ADMIN_ONLY: admin 또는 staff 만 허용, moderator 거부")
    void adminOnly() {
        PermissionPolicy policy = PermissionPolicies.ADMIN_ONLY;

        assertThat(policy.hasPermission(user(1, Role.ADMIN, false), HttpMethod.GET)).isTrue();
        assertThat(policy.hasPermission(user(2, Role.USER, true), HttpMethod.DELETE)).isTrue();
        assertThat(policy.hasPermission(user(3, Role.MODERATOR, false), HttpMethod.GET)).isFalse();
        assertThat(policy.hasPermission(null, HttpMethod.GET)).isFalse();
    }

    @Test
    @DisplayName("ADMIN_OR_READ_ONLY: 조회는 익명도 허용, 쓰기는 admin 등급만")
    void adminOrReadOnly() {
        PermissionPolicy policy = PermissionPolicies.ADMIN_OR_READ_ONLY;

        assertThat(policy.hasPermission(null, HttpMethod.GET)).isTrue();
        assertThat(policy.hasPermission(null, HttpMethod.POST)).isFalse();
        assertThat(policy.hasPermission(user(1, Role.ADMIN, false), HttpMethod.POST)).isTrue();
        assertThat(policy.hasPermission(user(2, Role.MODERATOR, false), HttpMethod.DELETE)).isFalse();
    }

    @Test
    @DisplayName("AUTHOR_OR_PRIVILEGED_OR_READ_ONLY: 작성자/moderator/admin 만 수정")
    void authorOrPrivileged() {
        PermissionPolicy policy = PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY;
        SiteUser author = user(1, Role.USER, false);
        Authored review = writtenBy(author);

        assertThat(policy.hasPermission(null, HttpMethod.GET)).isTrue();
        assertThat(policy.hasPermission(null, HttpMethod.POST)).isFalse();
        assertThat(policy.hasPermission(user(9, Role.USER, false), HttpMethod.POST)).isTrue();

        assertThat(policy.hasObjectPermission(null, HttpMethod.GET, review)).isTrue();
        assertThat(policy.hasObjectPermission(author, HttpMethod.PATCH, review)).isTrue();
        assertThat(policy.hasObjectPermission(user(2, Role.USER, false), HttpMethod.PATCH, review)).isFalse();
        assertThat(policy.hasObjectPermission(user(3, Role.MODERATOR, false), HttpMethod.DELETE, review)).isTrue();
        assertThat(policy.hasObjectPermission(user(4, Role.ADMIN, false), HttpMethod.DELETE, review)).isTrue();
        assertThat(policy.hasObjectPermission(user(5, Role.USER, true), HttpMethod.DELETE, review)).isTrue();
    }

    @Test
    @DisplayName("and(): 두 규칙 모두 허용해야 통과")
    void andCombination() {
        PermissionPolicy policy = PermissionPolicies.AUTHENTICATED.and(PermissionPolicies.ADMIN_OR_READ_ONLY);

        assertThat(policy.hasPermission(null, HttpMethod.GET)).isFalse();
        assertThat(policy.hasPermission(user(1, Role.USER, false), HttpMethod.GET)).isTrue();
        assertThat(policy.hasPermission(user(1, Role.USER, false), HttpMethod.POST)).isFalse();
        assertThat(policy.hasPermission(user(2, Role.ADMIN, false), HttpMethod.POST)).isTrue();
    }
}
