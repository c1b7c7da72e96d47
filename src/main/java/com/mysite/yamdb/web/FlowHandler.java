package com.mysite.yamdb.web;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.permission.Authored;
import com.mysite.yamdb.permission.Authorization;
import com.mysite.yamdb.permission.PermissionChecker;
import com.mysite.yamdb.user.SiteUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import org.springframework.validation.BindingResult;

/**
 * 화면의 생성/삭제 흐름 공통 처리.
 * 로그인은 보안 설정에서 이미 강제되지만 principal 이 없으면 여기서도 거절한다.
 */
@Slf4j
@Component
public class FlowHandler {

    public <P, F> String create(CreateFlow<P, F> flow, Long parentId, F form, BindingResult bindingResult,
                                Authentication auth) {
        SiteUser author = requireUser(auth);
        if (bindingResult.hasErrors()) {
            return redirect(flow.fallbackLocation());
        }

        P parent = flow.parentLookup().apply(parentId);
        try {
            flow.action().create(parent, author, form);
        } catch (ApiException e) {
            if (!e.isValidationError()) {
                throw e;
            }
            // 같은 작품에 두 번째 리뷰 등 저장 규칙 위반
            log.info("화면 작성 거절: user={}, reason={}", author.getUsername(), e.getMessage());
            return redirect(flow.fallbackLocation());
        }
        return redirect(flow.successLocation().apply(parentId));
    }

    public <T extends Authored> String delete(DeleteFlow<T> flow, Long parentId, Long objectId,
                                              Authentication auth) {
        SiteUser user = requireUser(auth);
        T target = flow.lookup().apply(parentId, objectId);
        requireModifiable(user, target);
        flow.action().accept(target);
        return redirect(flow.successLocation().apply(parentId));
    }

    public void requireModifiable(SiteUser user, Authored target) {
        if (!Authorization.canModify(user, target)) {
            log.warn("화면 수정/삭제 권한 없음: user={}", user.getUsername());
            throw new AccessDeniedException("You do not have permission to perform this action.");
        }
    }

    public SiteUser requireUser(Authentication auth) {
        SiteUser user = PermissionChecker.currentUser(auth);
        if (user == null) {
            throw new AuthenticationCredentialsNotFoundException("Authentication credentials were not provided.");
        }
        return user;
    }

    private static String redirect(String location) {
        return "redirect:" + location;
    }
}
