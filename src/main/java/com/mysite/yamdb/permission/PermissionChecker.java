package com.mysite.yamdb.permission;

import com.mysite.yamdb.jwt.Auth.PrincipalDetails;
import com.mysite.yamdb.user.SiteUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * 모든 권한 판단이 거쳐 가는 단일 진입점.
 * <p>
 * 익명 요청이 거부되면 401 (AuthenticationCredentialsNotFoundException),
 * 로그인했지만 권한이 없으면 403 (AccessDeniedException) 으로 구분한다.
 */
@Slf4j
@Component
public class PermissionChecker {

    public static SiteUser currentUser(Authentication auth) {
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            return null;
        }
        if (auth.getPrincipal() instanceof PrincipalDetails principal) {
            return principal.getSiteUser();
        }
        return null;
    }

    public SiteUser check(PermissionPolicy policy, Authentication auth, HttpMethod method) {
        SiteUser user = currentUser(auth);
        if (!policy.hasPermission(user, method)) {
            deny(user, method);
        }
        return user;
    }

    public SiteUser checkObject(PermissionPolicy policy, Authentication auth, HttpMethod method, Authored target) {
        SiteUser user = check(policy, auth, method);
        if (!policy.hasObjectPermission(user, method, target)) {
            deny(user, method);
        }
        return user;
    }

    /**
     * 화면에서 수정/삭제 버튼 노출 여부를 판단할 때 사용
     */
    public boolean canModify(SiteUser user, Authored target) {
        return Authorization.canModify(user, target);
    }

    private void deny(SiteUser user, HttpMethod method) {
        if (user == null) {
            throw new AuthenticationCredentialsNotFoundException(
                    "Authentication credentials were not provided.");
        }
        log.warn("권한 거부: user={}, method={}", user.getUsername(), method);
        throw new AccessDeniedException("You do not have permission to perform this action.");
    }
}
