package com.nei10u.panchanga.controller;

import com.nei10u.panchanga.exception.ClosedResourceException;
import com.nei10u.panchanga.exception.ComputationException;
import com.nei10u.panchanga.exception.InvalidTimezoneException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把排盘异常映射为 HTTP 状态码：参数/时区错误 400，星历计算失败 500，引擎已关闭 503。
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidTimezoneException.class)
    public ResponseEntity<Map<String, Object>> invalidTimezone(InvalidTimezoneException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_TIMEZONE", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(ComputationException.class)
    public ResponseEntity<Map<String, Object>> computationFailed(ComputationException e) {
        log.error("ephemeris computation failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "COMPUTATION_FAILED", e.getMessage());
    }

    @ExceptionHandler(ClosedResourceException.class)
    public ResponseEntity<Map<String, Object>> closed(ClosedResourceException e) {
        log.warn("request rejected: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "ENGINE_CLOSED", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
