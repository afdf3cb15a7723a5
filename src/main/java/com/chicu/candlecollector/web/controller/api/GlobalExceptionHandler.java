package com.chicu.candlecollector.web.controller.api;

import com.chicu.candlecollector.market.store.CandlePersistenceException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e,
                                                                      HttpServletRequest req) {
        log.warn("405 Method Not Allowed at {}: {}", req.getRequestURI(), e.getMethod());
        return build(HttpStatus.METHOD_NOT_ALLOWED, e);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException e) {
        return build(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({DataAccessException.class, CandlePersistenceException.class})
    public ResponseEntity<Map<String, Object>> handleStorage(RuntimeException e, HttpServletRequest req) {
        log.error("🗄 Ошибка хранилища at {}: {}", req.getRequestURI(), e.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleAny(Exception e, HttpServletRequest req) {
        log.error("❌ 500 at {}: {}", req.getRequestURI(), e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, Object>> build(HttpStatus status, Exception e) {
        String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("message", msg);
        body.put("timestamp", Instant.now().toEpochMilli());
        return ResponseEntity.status(status).body(body);
    }
}
