package com.mysite.yamdb.handler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    @DisplayName("필드 검증 오류 → {필드: [메시지]}")
    void fieldError() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleApiException(ApiException.invalid("score", "Ensure this value is less than or equal to 10."));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody())
                .containsEntry("score", List.of("Ensure this value is less than or equal to 10."));
    }

    @Test
    @DisplayName("필드 없는 검증 오류 → non_field_errors")
    void nonFieldError() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleApiException(ApiException.invalid("You have already reviewed this title."));

        assertThat(response.getBody())
                .containsEntry(ApiExceptionHandler.NON_FIELD_ERRORS, List.of("You have already reviewed this title."));
    }

    @Test
    @DisplayName("여러 필드 오류를 한 번에 돌려준다")
    void multipleErrors() {
        ResponseEntity<Map<String, Object>> response = handler.handleApiException(ApiException.invalid(Map.of(
                "email", List.of("This field is required."),
                "username", List.of("This field is required."))));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsOnlyKeys("email", "username");
    }

    @Test
    @DisplayName("404 → detail")
    void notFound() {
        ResponseEntity<Map<String, Object>> response = handler.handleApiException(ApiException.notFound());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsEntry("detail", ApiException.NOT_FOUND_MESSAGE);
    }

    @Test
    @DisplayName("인증 없음 → 401, 권한 없음 → 403")
    void authAndDenied() {
        assertThat(handler.handleAuth(new AuthenticationCredentialsNotFoundException("no credentials"))
                .getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(handler.handleDenied(new AccessDeniedException("denied"))
                .getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    @DisplayName("예상하지 못한 예외 → 500, 내부 메시지 노출 안 함")
    void unexpected() {
        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("detail", "A server error occurred.");
    }
}
