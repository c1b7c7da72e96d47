package com.mysite.yamdb.user;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.jwt.JwtTokenProvider;
import com.mysite.yamdb.mail.MailService;
import com.mysite.yamdb.util.PasswordPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 화면 계정 관리: 비밀번호 가입, 재설정 메일, 재설정, 변경.
 * <p>
 * 실패는 폼 필드 이름을 담은 ApiException 으로 알린다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final MailService mailService;
    private final JwtTokenProvider jwtTokenProvider;

    @Transactional
    public SiteUser signup(String username, String email, String password1, String password2) {
        if (userRepository.existsByUsername(username)) {
            throw ApiException.invalid("username", "A user with that username already exists.");
        }
        if (userRepository.existsByEmail(email)) {
            throw ApiException.invalid("email", "A user with that email already exists.");
        }
        checkNewPassword(password1, password2, username, email, "password2");

        SiteUser user = SiteUser.builder()
                .username(username)
                .email(email)
                .password(passwordEncoder.encode(password1))
                .build();
        SiteUser saved = userRepository.save(user);
        log.info("화면 회원 가입: {}", saved.getUsername());
        return saved;
    }

    /**
     * 가입된 이메일이면 재설정 링크를 메일로 보낸다.
     */
    @Transactional(readOnly = true)
    public void requestPasswordReset(String email) {
        SiteUser user = userRepository.findByEmail(email)
                .orElseThrow(() -> ApiException.invalid("email", "No user with this email address was found."));
        mailService.sendPasswordReset(user, jwtTokenProvider.createPasswordResetToken(user));
    }

    /**
     * 재설정 링크의 토큰이 아직 유효한지 (만료, 이미 사용됨)
     */
    public Optional<SiteUser> findByResetToken(String token) {
        return jwtTokenProvider.verifyPasswordResetToken(token, userRepository::findByUsername)
                .flatMap(userRepository::findByUsername);
    }

    @Transactional
    public void resetPassword(String token, String password1, String password2) {
        SiteUser user = findByResetToken(token)
                .orElseThrow(() -> ApiException.invalid("The password reset link was invalid."));
        checkNewPassword(password1, password2, user.getUsername(), user.getEmail(), "newPassword2");
        user.setPassword(passwordEncoder.encode(password1));
        userRepository.save(user);
        log.info("비밀번호 재설정: {}", user.getUsername());
    }

    @Transactional
    public void changePassword(SiteUser current, String oldPassword, String password1, String password2) {
        SiteUser user = userRepository.findById(current.getId()).orElseThrow(ApiException::notFound);
        if (oldPassword == null || user.getPassword() == null
                || !passwordEncoder.matches(oldPassword, user.getPassword())) {
            throw ApiException.invalid("oldPassword",
                    "Your old password was entered incorrectly. Please enter it again.");
        }
        checkNewPassword(password1, password2, user.getUsername(), user.getEmail(), "newPassword2");
        user.setPassword(passwordEncoder.encode(password1));
        userRepository.save(user);
        log.info("비밀번호 변경: {}", user.getUsername());
    }

    private static void checkNewPassword(String password1, String password2, String username, String email,
                                         String field) {
        if (password1 == null || !password1.equals(password2)) {
            throw ApiException.invalid(field, "The two password fields didn't match.");
        }
        try {
            PasswordPolicy.validate(password1, username, email);
        } catch (IllegalArgumentException e) {
            throw ApiException.invalid(field, e.getMessage());
        }
    }
}
