package com.mysite.yamdb.permission;

import com.mysite.yamdb.jwt.Auth.PrincipalDetails;
import com.mysite.yamdb.user.Role.Role;
import com.mysite.yamdb.user.SiteUser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionCheckerTest {

    private final PermissionChecker checker = new PermissionChecker();

    private static Authentication login(SiteUser user) {
        PrincipalDetails principal = new PrincipalDetails(user);
        return new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities());
    }

    private static SiteUser user(long id, Role role) {
        SiteUser user = SiteUser.builder().username("u" + id).email("u" + id + "@test.com").role(role).build();
        user.setId(id);
        return user;
    }

    @Test
    @DisplayName("익명 사용자가 거부되면 401 계열 예외")
    void anonymousDenied() {
        Authentication anonymous = new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS"));

        assertThatThrownBy(() -> checker.check(PermissionPolicies.ADMIN_ONLY, anonymous, HttpMethod.GET))
                .isInstanceOf(AuthenticationCredentialsNotFoundException.class);
        assertThatThrownBy(() -> checker.check(PermissionPolicies.AUTHENTICATED, null, HttpMethod.GET))
                .isInstanceOf(AuthenticationCredentialsNotFoundException.class);
    }

    @Test
    @DisplayName("로그인했지만 권한이 없으면 403 계열 예외")
    void authenticatedDenied() {
        Authentication auth = login(user(1, Role.USER));

        assertThatThrownBy(() -> checker.check(PermissionPolicies.ADMIN_ONLY, auth, HttpMethod.GET))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    @DisplayName("허용되면 현재 사용자를 돌려준다 (익명 조회는 null)")
    void allowedReturnsUser() {
        SiteUser admin = user(1, Role.ADMIN);

        assertThat(checker.check(PermissionPolicies.ADMIN_ONLY, login(admin), HttpMethod.POST)).isSameAs(admin);
        assertThat(checker.check(PermissionPolicies.ADMIN_OR_READ_ONLY, null, HttpMethod.GET)).isNull();
    }

    @Test
    @DisplayName("다른 사람의 리뷰 수정 시도 → 403")
    void objectPermissionDenied() {
        SiteUser author = user(1, Role.USER);
        SiteUser stranger = user(2, Role.USER);
        Authored review = () -> author;

        assertThatThrownBy(() -> checker.checkObject(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, login(stranger), HttpMethod.PATCH, review))
                .isInstanceOf(AccessDeniedException.class);

        assertThat(checker.checkObject(
                PermissionPolicies.AUTHOR_OR_PRIVILEGED_OR_READ_ONLY, login(author), HttpMethod.PATCH, review))
                .isSameAs(author);
    }

    @Test
    @DisplayName("canModify(): 화면 버튼 노출 판단")
    void canModify() {
        SiteUser author = user(1, Role.USER);
        Authored comment = () -> author;

        assertThat(checker.canModify(author, comment)).isTrue();
        assertThat(checker.canModify(user(2, Role.MODERATOR), comment)).isTrue();
        assertThat(checker.canModify(user(3, Role.USER), comment)).isFalse();
        assertThat(checker.canModify(null, comment)).isFalse();
    }
}
