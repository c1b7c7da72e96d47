package com.mysite.yamdb.jwt;

public final class JwtConstants {
    private JwtConstants() {}

    public static final String SECRET_KEY = System.getenv().getOrDefault("JWT_SECRET", "yamdbDevelopmentSecret");
    public static final long ACCESS_TOKEN_EXPIRATION_MILLIS = 30L * 24 * 60 * 60 * 1000; // 30일
    public static final long PASSWORD_RESET_EXPIRATION_MILLIS = 60 * 60 * 1000L; // 1시간
    public static final String ISSUER = "yamdb";
    public static final String AUTH_HEADER = "Authorization";
    public static final String AUTH_PREFIX = "Bearer ";
    public static final String PURPOSE_CLAIM = "purpose";
    public static final String PASSWORD_RESET_PURPOSE = "password_reset";
}
