package com.mysite.yamdb.user;

import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.jwt.JwtTokenProvider;
import com.mysite.yamdb.mail.MailService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AccountServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private MailService mailService;

    @Mock
    private JwtTokenProvider jwtTokenProvider;

    @InjectMocks
    private AccountService accountService;

    private SiteUser user;

    @BeforeEach
    void init() {
        MockitoAnnotations.openMocks(this);

        user = SiteUser.builder().username("tester").email("tester@test.com").password("ENC_OLD").build();
        user.setId(1L);
        when(userRepository.save(any(SiteUser.class))).thenAnswer(inv -> inv.getArgument(0));
        when(passwordEncoder.encode(any())).thenAnswer(inv -> "ENC_" + inv.getArgument(0));
    }

    @Test
    @DisplayName("회원 가입 성공: 비밀번호 인코딩 + 기본 권한 user")
    void signupSuccess() {
        SiteUser saved = accountService.signup("newbie", "newbie@test.com", "Blue-River-42", "Blue-River-42");

        assertThat(saved.getPassword()).isEqualTo("ENC_Blue-River-42");
        assertThat(saved.isAdmin()).isFalse();
    }

    @Test
    @DisplayName("비밀번호 확인 불일치 → password2 오류")
    void signupMismatch() {
        assertThatThrownBy(() -> accountService.signup("newbie", "n@test.com", "Blue-River-42", "Blue-River-43"))
                .isInstanceOf(ApiException.class)
                .hasMessage("The two password fields didn't match.")
                .satisfies(e -> assertThat(((ApiException) e).getField()).isEqualTo("password2"));
    }

    @Test
    @DisplayName("비밀번호 정책 위반 → password2 오류")
    void signupWeakPassword() {
        assertThatThrownBy(() -> accountService.signup("newbie", "n@test.com", "12345678", "12345678"))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getField()).isEqualTo("password2"));
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("재설정 메일: 가입된 이메일이면 토큰 링크 발송")
    void requestPasswordReset() {
        when(userRepository.findByEmail("tester@test.com")).thenReturn(Optional.of(user));
        when(jwtTokenProvider.createPasswordResetToken(user)).thenReturn("RESET");

        accountService.requestPasswordReset("tester@test.com");

        verify(mailService).sendPasswordReset(user, "RESET");
    }

    @Test
    @DisplayName("재설정 메일: 없는 이메일 → email 오류")
    void requestPasswordResetUnknownEmail() {
        when(userRepository.findByEmail("none@test.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accountService.requestPasswordReset("none@test.com"))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getField()).isEqualTo("email"));
        verifyNoInteractions(mailService);
    }

    @Test
    @DisplayName("유효한 재설정 토큰으로 비밀번호 변경")
    void resetPassword() {
        when(jwtTokenProvider.verifyPasswordResetToken(eq("TOKEN"), any())).thenReturn(Optional.of("tester"));
        when(userRepository.findByUsername("tester")).thenReturn(Optional.of(user));

        accountService.resetPassword("TOKEN", "Green-Field-7", "Green-Field-7");

        assertThat(user.getPassword()).isEqualTo("ENC_Green-Field-7");
    }

    @Test
    @DisplayName("무효한 재설정 토큰 → 오류")
    void resetPasswordInvalidToken() {
        when(jwtTokenProvider.verifyPasswordResetToken(eq("TOKEN"), any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accountService.resetPassword("TOKEN", "Green-Field-7", "Green-Field-7"))
                .isInstanceOf(ApiException.class)
                .hasMessage("The password reset link was invalid.");
    }

    @Test
    @DisplayName("비밀번호 변경: 기존 비밀번호가 틀리면 oldPassword 오류")
    void changePasswordWrongOld() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "ENC_OLD")).thenReturn(false);

        assertThatThrownBy(() -> accountService.changePassword(user, "wrong", "Green-Field-7", "Green-Field-7"))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getField()).isEqualTo("oldPassword"));
    }

    @Test
    @DisplayName("비밀번호 변경 성공")
    void changePasswordSuccess() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("old", "ENC_OLD")).thenReturn(true);

        accountService.changePassword(user, "old", "Green-Field-7", "Green-Field-7");

        assertThat(user.getPassword()).isEqualTo("ENC_Green-Field-7");
        verify(userRepository).save(user);
    }
}
