package com.mysite.yamdb.web;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.user.AccountService;
import com.mysite.yamdb.web.form.PasswordResetForm;
import com.mysite.yamdb.web.form.SetPasswordForm;
import com.mysite.yamdb.web.form.SignupForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * 화면 계정 기능: 가입, 로그인 폼, 비밀번호 재설정/변경.
 * 로그인 처리 자체와 로그아웃은 Spring Security 폼 로그인이 담당한다.
 */
@Controller
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AccountController {

    private final AccountService accountService;
    private final FlowHandler flowHandler;

    @GetMapping("/signup")
    public String signupForm(@ModelAttribute("form") SignupForm form) {
        return "users/signup";
    }

    @PostMapping("/signup")
    public String signup(@Valid @ModelAttribute("form") SignupForm form, BindingResult bindingResult) {
        if (bindingResult.hasErrors()) {
            return "users/signup";
        }
        try {
            accountService.signup(form.getUsername(), form.getEmail(), form.getPassword1(), form.getPassword2());
        } catch (ApiException e) {
            reject(bindingResult, e);
            return "users/signup";
        }
        return "redirect:/";
    }

    @GetMapping("/login")
    public String login() {
        return "users/login";
    }

    @GetMapping("/password_reset")
    public String passwordResetForm(@ModelAttribute("form") PasswordResetForm form) {
        return "users/password_reset";
    }

    @PostMapping("/password_reset")
    public String passwordReset(@Valid @ModelAttribute("form") PasswordResetForm form, BindingResult bindingResult) {
        if (bindingResult.hasErrors()) {
            return "users/password_reset";
        }
        try {
            accountService.requestPasswordReset(form.getEmail());
        } catch (ApiException e) {
            reject(bindingResult, e);
            return "users/password_reset";
        }
        return "redirect:/auth/password_reset/done";
    }

    @GetMapping("/password_reset/done")
    public String passwordResetDone() {
        return "users/password_reset_done";
    }

    @GetMapping("/reset/{token}")
    public String resetForm(@PathVariable String token, @ModelAttribute("form") SetPasswordForm form, Model model) {
        model.addAttribute("token", token);
        model.addAttribute("validLink", accountService.findByResetToken(token).isPresent());
        return "users/password_reset_confirm";
    }

    @PostMapping("/reset/{token}")
    public String reset(@PathVariable String token, @Valid @ModelAttribute("form") SetPasswordForm form,
                        BindingResult bindingResult, Model model) {
        model.addAttribute("token", token);
        if (accountService.findByResetToken(token).isEmpty()) {
            model.addAttribute("validLink", false);
            return "users/password_reset_confirm";
        }
        model.addAttribute("validLink", true);
        if (bindingResult.hasErrors()) {
            return "users/password_reset_confirm";
        }
        try {
            accountService.resetPassword(token, form.getNewPassword1(), form.getNewPassword2());
        } catch (ApiException e) {
            reject(bindingResult, e);
            return "users/password_reset_confirm";
        }
        return "redirect:/auth/reset/done";
    }

    @GetMapping("/reset/done")
    public String resetDone() {
        return "users/password_reset_complete";
    }

    @GetMapping("/password_change")
    public String passwordChangeForm(@ModelAttribute("form") SetPasswordForm form) {
        return "users/password_change";
    }

    @PostMapping("/password_change")
    public String passwordChange(@Valid @ModelAttribute("form") SetPasswordForm form, BindingResult bindingResult,
                                 Authentication auth) {
        if (bindingResult.hasErrors()) {
            return "users/password_change";
        }
        try {
            accountService.changePassword(flowHandler.requireUser(auth),
                    form.getOldPassword(), form.getNewPassword1(), form.getNewPassword2());
        } catch (ApiException e) {
            reject(bindingResult, e);
            return "users/password_change";
        }
        return "redirect:/auth/password_change/done";
    }

    @GetMapping("/password_change/done")
    public String passwordChangeDone() {
        return "users/password_change_done";
    }

    private static void reject(BindingResult bindingResult, ApiException e) {
        if (!e.isValidationError()) {
            throw e;
        }
        if (e.getField() != null) {
            bindingResult.rejectValue(e.getField(), e.getErrorCode(), e.getMessage());
        } else {
            bindingResult.reject(e.getErrorCode(), e.getMessage());
        }
    }
}
