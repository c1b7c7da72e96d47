package com.mysite.yamdb.jwt;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.mysite.yamdb.user.Role.Role;
import com.mysite.yamdb.user.SiteUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JwtTokenProviderTest {

    private JwtTokenProvider jwtTokenProvider;
    private SiteUser user;

    @BeforeEach
    void setup() {
        jwtTokenProvider = new JwtTokenProvider();

        user = SiteUser.builder()
                .username("testUser")
                .email("test@test.com")
                .role(Role.MODERATOR)
                .password("$2a$10$abcdefghijklmnopqrstuv")
                .build();
    }

    @Test
    @DisplayName("AccessToken 생성 성공")
    void createAccessToken_success() {
        String token = jwtTokenProvider.createAccessToken(user);

        assertThat(token).isNotNull();

        // JWT 내부 claim 검증
        var decoded = JWT.require(Algorithm.HMAC512(JwtConstants.SECRET_KEY))
                .withIssuer(JwtConstants.ISSUER)
                .build()
                .verify(token);

        assertThat(decoded.getClaim("username").asString()).isEqualTo("testUser");
        assertThat(decoded.getClaim("role").asString()).isEqualTo("moderator");
        assertThat(decoded.getSubject()).isEqualTo("testUser");
    }

    @Test
    @DisplayName("validateToken() → 유효한 토큰 true")
    void validateToken_validToken() {
        String token = jwtTokenProvider.createAccessToken(user);

        assertThat(jwtTokenProvider.validateToken(token)).isTrue();
        assertThat(jwtTokenProvider.extractUsername(token)).isEqualTo("testUser");
    }

    @Test
    @DisplayName("validateToken() → 잘못된 서명 false")
    void validateToken_invalidSignature() {
        String fakeToken = JWT.create()
                .withSubject("testUser")
                .withIssuer(JwtConstants.ISSUER)
                .sign(Algorithm.HMAC512("WRONG_KEY"));

        assertThat(jwtTokenProvider.validateToken(fakeToken)).isFalse();
    }

    @Test
    @DisplayName("validateToken() → 만료된 토큰 false")
    void validateToken_expired() {
        String expired = JWT.create()
                .withSubject("testUser")
                .withIssuer(JwtConstants.ISSUER)
                .withExpiresAt(new Date(System.currentTimeMillis() - 60_000))
                .withClaim("username", "testUser")
                .sign(Algorithm.HMAC512(JwtConstants.SECRET_KEY));

        assertThat(jwtTokenProvider.validateToken(expired)).isFalse();
    }

    @Test
    @DisplayName("validateToken() → 형식이 깨진 토큰 false")
    void validateToken_garbage() {
        assertThat(jwtTokenProvider.validateToken("not.a.jwt")).isFalse();
    }

    @Test
    @DisplayName("비밀번호 재설정 토큰은 API 인증에 사용할 수 없다")
    void passwordResetToken_rejectedForApi() {
        String token = jwtTokenProvider.createPasswordResetToken(user);

        assertThat(jwtTokenProvider.validateToken(token)).isFalse();
    }

    @Test
    @DisplayName("비밀번호 재설정 토큰 검증 성공 → username 반환")
    void verifyPasswordResetToken_success() {
        String token = jwtTokenProvider.createPasswordResetToken(user);

        Optional<String> result = jwtTokenProvider.verifyPasswordResetToken(token, name -> Optional.of(user));

        assertThat(result).contains("testUser");
    }

    @Test
    @DisplayName("비밀번호가 바뀌면 이전 재설정 토큰은 무효")
    void verifyPasswordResetToken_passwordChanged() {
        String token = jwtTokenProvider.createPasswordResetToken(user);
        user.setPassword("$2a$10$zyxwvutsrqponmlkjihgfe");

        Optional<String> result = jwtTokenProvider.verifyPasswordResetToken(token, name -> Optional.of(user));

        assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("AccessToken 은 재설정 토큰으로 쓸 수 없다")
    void verifyPasswordResetToken_accessTokenRejected() {
        String token = jwtTokenProvider.createAccessToken(user);

        assertThat(jwtTokenProvider.verifyPasswordResetToken(token, name -> Optional.of(user))).isEmpty();
    }

    @Test
    @DisplayName("사용자가 삭제되었으면 재설정 토큰은 무효")
    void verifyPasswordResetToken_userGone() {
        String token = jwtTokenProvider.createPasswordResetToken(user);

        assertThat(jwtTokenProvider.verifyPasswordResetToken(token, name -> Optional.empty())).isEmpty();
    }
}
