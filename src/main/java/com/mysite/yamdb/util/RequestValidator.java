package com.mysite.yamdb.util;

import com.mysite.yamdb.handler.ApiException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 권한 확인 뒤에 요청 본문을 검증하기 위한 도우미.
 * 오류 키는 JSON 필드 이름 (snake_case) 을 쓴다.
 */
@Component
@RequiredArgsConstructor
public class RequestValidator {

    private final Validator validator;

    public <T> T validate(T request, Class<?>... groups) {
        if (request == null) {
            throw ApiException.invalid("No data provided.");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request, groups);
        if (violations.isEmpty()) {
            return request;
        }
        Map<String, List<String>> errors = new TreeMap<>();
        for (ConstraintViolation<T> violation : violations) {
            String path = violation.getPropertyPath().toString();
            String key = path.isEmpty() ? "non_field_errors" : toSnakeCase(path);
            errors.computeIfAbsent(key, k -> new ArrayList<>()).add(violation.getMessage());
        }
        throw ApiException.invalid(errors);
    }

    public static String toSnakeCase(String name) {
        return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
