package com.mysite.yamdb.web;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.permission.PermissionChecker;
import com.mysite.yamdb.user.SiteUser;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Year;

/**
 * 화면 컨트롤러 공통 모델 값과 오류 화면.
 * 권한이 없으면 조용히 이동시키지 않고 403 화면을 보여준다.
 */
@Slf4j
@ControllerAdvice(basePackages = "com.mysite.yamdb.web")
public class WebExceptionHandler {

    // 모든 화면의 푸터 연도
    @ModelAttribute("year")
    public int year() {
        return Year.now().getValue();
    }

    @ModelAttribute("currentUser")
    public SiteUser currentUser(Authentication auth) {
        return PermissionChecker.currentUser(auth);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public String handleDenied(AccessDeniedException ex, HttpServletResponse response, Model model) {
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        model.addAttribute("year", year());
        return "error/403";
    }

    @ExceptionHandler(ApiException.class)
    public String handleApiException(ApiException ex, HttpServletResponse response, Model model) {
        response.setStatus(ex.getStatus().value());
        model.addAttribute("year", year());
        model.addAttribute("message", ex.getMessage());
        return ex.getStatus().value() == HttpServletResponse.SC_NOT_FOUND ? "error/404" : "error/400";
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, NumberFormatException.class})
    public String handleBadPath(Exception ex, HttpServletResponse response, Model model) {
        response.setStatus(HttpServletResponse.SC_NOT_FOUND);
        model.addAttribute("year", year());
        model.addAttribute("message", ApiException.NOT_FOUND_MESSAGE);
        return "error/404";
    }
}
