package com.mysite.yamdb.jwt.Auth;

import com.mysite.yamdb.config.YamdbProperties;
import com.mysite.yamdb.handler.ApiException;
import com.mysite.yamdb.jwt.JwtTokenProvider;
import com.mysite.yamdb.mail.MailService;
import com.mysite.yamdb.user.SiteUser;
import com.mysite.yamdb.user.UserRepository;
import com.mysite.yamdb.util.RandomCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * API 가입 흐름.
 * <p>
 * 가입 요청 → 확인 코드 발급 (메일) → 코드와 username 으로 토큰 교환.
 * 같은 username + email 로 다시 요청하면 새 코드를 재발급한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final MailService mailService;
    private final JwtTokenProvider jwtTokenProvider;
    private final YamdbProperties properties;

    @Transactional
    public SignupRequest signup(SignupRequest request) {
        Optional<SiteUser> existing = userRepository.findByUsername(request.username());

        SiteUser user;
        if (existing.isPresent()) {
            user = existing.get();
            // 같은 username 이 다른 email 로 이미 쓰이고 있으면 거절
            if (!user.getEmail().equals(request.email())) {
                throw ApiException.invalid("username", "A user with that username already exists.");
            }
            user.setConfirmationCode(newCode());
            log.info("확인 코드 재발급: {}", user.getUsername());
        } else {
            if (userRepository.existsByEmail(request.email())) {
                throw ApiException.invalid("email", "A user with that email already exists.");
            }
            user = SiteUser.builder()
                    .username(request.username())
                    .email(request.email())
                    .confirmationCode(newCode())
                    .build();
            log.info("가입 요청, 확인 코드 발급: {}", user.getUsername());
        }

        try {
            userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // 동시에 같은 username/email 로 가입한 경우
            log.warn("가입 중 유일성 제약 위반: {}", request.username());
            throw ApiException.invalid("A user with that username or email already exists.");
        }

        mailService.sendConfirmationCode(user);
        return request;
    }

    @Transactional
    public TokenResponse obtainToken(TokenRequest request) {
        SiteUser user = userRepository.findByUsername(request.username())
                .orElseThrow(ApiException::notFound);

        if (user.getConfirmationCode() == null || !user.getConfirmationCode().equals(request.confirmationCode())) {
            log.warn("잘못된 확인 코드로 토큰 요청: {}", user.getUsername());
            throw ApiException.invalid("confirmation_code", "Invalid confirmation code.");
        }

        if (properties.getAuth().isSingleUseConfirmationCode()) {
            user.setConfirmationCode(null);
            userRepository.save(user);
        }

        log.info("토큰 발급: {}", user.getUsername());
        return new TokenResponse(jwtTokenProvider.createAccessToken(user));
    }

    private String newCode() {
        return RandomCode.generate(properties.getAuth().getConfirmationCodeLength());
    }
}
