package com.mysite.yamdb.jwt;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.web.authentication.www.BasicAuthenticationFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

// API 필터 체인에 Bearer JWT 인증 단계를 삽입하기 위한 커스텀 인가 필터
@Slf4j
public class JwtAuthorizationFilter extends BasicAuthenticationFilter {

    private final UserDetailsService userDetailsService;
    private final JwtTokenProvider jwtTokenProvider;

    public JwtAuthorizationFilter(AuthenticationManager authenticationManager,
                                  UserDetailsService userDetailsService,
                                  JwtTokenProvider jwtTokenProvider) {
        super(authenticationManager);
        this.userDetailsService = userDetailsService;
        this.jwtTokenProvider = jwtTokenProvider;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        // Authorization 헤더가 없는 요청은 익명 요청으로 처리 (가입, 토큰 발급, 공개 조회)
        String header = req.getHeader(JwtConstants.AUTH_HEADER);
        if (header == null || !header.startsWith(JwtConstants.AUTH_PREFIX)) {
            chain.doFilter(req, res);
            return;
        }

        String token = header.substring(JwtConstants.AUTH_PREFIX.length());

        // 만료·위조·서명 오류가 있는 토큰은 즉시 차단
        if (!jwtTokenProvider.validateToken(token)) {
            reject(res, "Given token not valid for any token type");
            return;
        }

        String username = jwtTokenProvider.extractUsername(token);
        UserDetails userDetails;
        try {
            // 토큰 발급 이후 권한이 바뀌었을 수 있으므로 매번 다시 로드
            userDetails = userDetailsService.loadUserByUsername(username);
        } catch (UsernameNotFoundException e) {
            log.warn("토큰의 사용자가 존재하지 않음: {}", username);
            reject(res, "User not found");
            return;
        }

        Authentication auth =
                new UsernamePasswordAuthenticationToken(userDetails, null, userDetails.getAuthorities());
        SecurityContextHolder.getContext().setAuthentication(auth);

        chain.doFilter(req, res);
    }

    private void reject(HttpServletResponse res, String detail) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setCharacterEncoding(StandardCharsets.UTF_8.name());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.getWriter().write("{\"detail\":\"" + detail + "\"}");
    }
}
