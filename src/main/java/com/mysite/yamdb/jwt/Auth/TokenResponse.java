package com.mysite.yamdb.jwt.Auth;

public record TokenResponse(String token) {
}
