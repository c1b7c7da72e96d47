package com.mysite.yamdb.handler;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.mysite.yamdb.util.RequestValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON API 전용 예외 변환기.
 * <p>
 * 검증 오류는 {"필드": ["메시지"]}, 그 외는 {"detail": "메시지"} 형태로 내려준다.
 * 화면(Thymeleaf) 컨트롤러에는 적용되지 않는다.
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    public static final String NON_FIELD_ERRORS = "non_field_errors";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApiException(ApiException ex) {
        if (ex.getErrors() != null) {
            return ResponseEntity.badRequest().body(new LinkedHashMap<>(ex.getErrors()));
        }
        if (ex.isValidationError()) {
            String key = ex.getField() != null ? ex.getField() : NON_FIELD_ERRORS;
            return ResponseEntity.badRequest().body(Map.of(key, List.of(ex.getMessage())));
        }
        return ResponseEntity.status(ex.getStatus()).body(detail(ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.computeIfAbsent(RequestValidator.toSnakeCase(error.getField()), k -> new ArrayList<>())
                    .add(error.getDefaultMessage());
        }
        for (ObjectError error : ex.getBindingResult().getGlobalErrors()) {
            errors.computeIfAbsent(NON_FIELD_ERRORS, k -> new ArrayList<>()).add(error.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(new LinkedHashMap<>(errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        // 타입이 맞지 않는 값 ("year": "abc" 등) 은 해당 필드 오류로 돌려준다
        if (ex.getCause() instanceof JsonMappingException cause && !cause.getPath().isEmpty()) {
            String field = cause.getPath().get(cause.getPath().size() - 1).getFieldName();
            if (field != null) {
                return ResponseEntity.badRequest().body(Map.of(field, List.of("Invalid value.")));
            }
        }
        return ResponseEntity.badRequest().body(Map.of(NON_FIELD_ERRORS, List.of("Malformed request body.")));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        // /titles/abc 처럼 경로 변수 형식이 맞지 않으면 존재하지 않는 리소스로 본다
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(detail(ApiException.NOT_FOUND_MESSAGE));
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<Map<String, Object>> handleAuth(AuthenticationException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(detail(ex.getMessage()));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleDenied(AccessDeniedException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(detail(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("처리되지 않은 예외", ex);
        return ResponseEntity.internalServerError().body(detail("A server error occurred."));
    }

    private static Map<String, Object> detail(String message) {
        return Map.of("detail", message);
    }
}
