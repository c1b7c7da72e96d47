package com.mysite.yamdb.handler;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

/**
 * 서비스 계층에서 던지는 도메인 예외.
 * field 가 있으면 해당 필드의 검증 오류로, 없으면 non_field_errors 로 응답한다.
 */
@Getter
public class ApiException extends RuntimeException {

    public static final String NOT_FOUND_MESSAGE = "Not found.";

    private final HttpStatus status;   // 400, 404 등
    private final String errorCode;    // VALIDATION_ERROR, NOT_FOUND ...
    private final String field;        // "username" 등
    private final Map<String, List<String>> errors; // 여러 필드 오류를 한 번에 돌려줄 때

    public ApiException(HttpStatus status, String message, String errorCode, String field) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
        this.field = field;
        this.errors = null;
    }

    private ApiException(Map<String, List<String>> errors) {
        super("Invalid input.");
        this.status = HttpStatus.BAD_REQUEST;
        this.errorCode = "VALIDATION_ERROR";
        this.field = null;
        this.errors = Map.copyOf(errors);
    }

    public static ApiException invalid(Map<String, List<String>> errors) {
        return new ApiException(errors);
    }

    public static ApiException invalid(String field, String message) {
        return new ApiException(HttpStatus.BAD_REQUEST, message, "VALIDATION_ERROR", field);
    }

    public static ApiException invalid(String message) {
        return invalid(null, message);
    }

    public static ApiException notFound() {
        return notFound(NOT_FOUND_MESSAGE);
    }

    public static ApiException notFound(String message) {
        return new ApiException(HttpStatus.NOT_FOUND, message, "NOT_FOUND", null);
    }

    public boolean isValidationError() {
        return status == HttpStatus.BAD_REQUEST;
    }
}
