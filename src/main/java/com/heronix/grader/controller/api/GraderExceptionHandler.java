package com.heronix.grader.controller.api;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.heronix.grader.exception.GradeValidationException;
import com.heronix.grader.exception.GradingConfigException;
import com.heronix.grader.exception.SchemaException;
import com.heronix.grader.exception.UnknownLetterException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps grading failures to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GraderExceptionHandler {

    @ExceptionHandler({SchemaException.class, GradeValidationException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidData(RuntimeException ex) {
        log.warn("Rejected gradebook data: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_gradebook", ex);
    }

    @ExceptionHandler({GradingConfigException.class, UnknownLetterException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidConfig(RuntimeException ex) {
        log.warn("Rejected grading configuration: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_grading_config", ex);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, RuntimeException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", ex.getMessage());
        return new ResponseEntity<>(body, status);
    }
}
