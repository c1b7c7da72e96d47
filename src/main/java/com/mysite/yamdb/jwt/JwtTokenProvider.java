package com.mysite.yamdb.jwt;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.mysite.yamdb.user.SiteUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Date;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * JWT 발급 및 검증을 전담하는 컴포넌트
 * <p>
 * 주요 역할:
 * - 확인 코드 교환 시 Access Token 생성
 * - 토큰 위조/만료 검증
 * - 토큰에서 사용자 정보 추출
 * - 비밀번호 재설정 링크용 단기 토큰 발급
 */
@Slf4j
@Component
public class JwtTokenProvider {

    private final Algorithm algorithm = Algorithm.HMAC512(JwtConstants.SECRET_KEY);

    /**
     * 실제 API 호출에 사용될 Access Token 을 발급한다.
     * <p>
     * role 은 참고용 클레임일 뿐이고, 권한 판단은 매 요청마다 DB 에서 다시 읽은 사용자로 한다.
     */
    public String createAccessToken(SiteUser user) {
        long now = System.currentTimeMillis();
        return JWT.create()
                .withSubject(user.getUsername())
                .withIssuer(JwtConstants.ISSUER)
                .withIssuedAt(new Date(now))
                .withExpiresAt(new Date(now + JwtConstants.ACCESS_TOKEN_EXPIRATION_MILLIS))
                .withJWTId(UUID.randomUUID().toString())
                .withClaim("username", user.getUsername())
                .withClaim("role", user.getRole().value())
                .sign(algorithm);
    }

    /**
     * 전달받은 JWT 가 유효한지 검증한다. 만료와 위조를 구분해 로그로 남긴다.
     */
    public boolean validateToken(String token) {
        try {
            DecodedJWT jwt = verify(token);
            // 비밀번호 재설정 토큰은 API 인증에 쓸 수 없다
            if (!jwt.getClaim(JwtConstants.PURPOSE_CLAIM).isMissing()) {
                log.warn("용도가 다른 토큰으로 API 접근 시도: {}", jwt.getSubject());
                return false;
            }
            return true;
        } catch (TokenExpiredException e) {
            log.warn("JWT 만료: {}", e.getMessage());
        } catch (JWTVerificationException e) {
            log.warn("JWT 검증 실패: {}", e.getMessage());
        }
        return false;
    }

    public String extractUsername(String token) {
        return verify(token)
                .getClaim("username")
                .asString();
    }

    /**
     * 비밀번호 재설정 링크용 단기 토큰.
     * 현재 비밀번호 해시 일부를 넣어 두어 비밀번호가 바뀌면 이전 링크는 무효가 된다.
     */
    public String createPasswordResetToken(SiteUser user) {
        long now = System.currentTimeMillis();
        return JWT.create()
                .withSubject(user.getUsername())
                .withIssuer(JwtConstants.ISSUER)
                .withIssuedAt(new Date(now))
                .withExpiresAt(new Date(now + JwtConstants.PASSWORD_RESET_EXPIRATION_MILLIS))
                .withClaim("username", user.getUsername())
                .withClaim(JwtConstants.PURPOSE_CLAIM, JwtConstants.PASSWORD_RESET_PURPOSE)
                .withClaim("fingerprint", passwordFingerprint(user))
                .sign(algorithm);
    }

    /**
     * 재설정 토큰이 유효하면 username 을 돌려준다.
     */
    public Optional<String> verifyPasswordResetToken(String token, Function<String, Optional<SiteUser>> userLookup) {
        try {
            DecodedJWT jwt = verify(token);
            if (!JwtConstants.PASSWORD_RESET_PURPOSE.equals(jwt.getClaim(JwtConstants.PURPOSE_CLAIM).asString())) {
                return Optional.empty();
            }
            String username = jwt.getClaim("username").asString();
            String fingerprint = jwt.getClaim("fingerprint").asString();
            return userLookup.apply(username)
                    .filter(user -> passwordFingerprint(user).equals(fingerprint))
                    .map(SiteUser::getUsername);
        } catch (JWTVerificationException e) {
            log.warn("비밀번호 재설정 토큰 검증 실패: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private DecodedJWT verify(String token) {
        return JWT.require(algorithm)
                .withIssuer(JwtConstants.ISSUER)
                .build()
                .verify(token);
    }

    private static String passwordFingerprint(SiteUser user) {
        String password = user.getPassword();
        if (password == null || password.length() < 10) {
            return "";
        }
        return password.substring(password.length() - 10);
    }
}
