package com.example.ticketmatch.controller;

import com.example.ticketmatch.exception.IndexStateException;
import com.example.ticketmatch.exception.InvalidArgumentException;
import com.example.ticketmatch.exception.NotInitializedException;
import com.example.ticketmatch.exception.ProviderException;
import com.example.ticketmatch.exception.TicketMatchingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps matching-engine failures to HTTP responses with a stable error code.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(TicketMatchingException.class)
    public ResponseEntity<Map<String, Object>> handleMatchingFailure(TicketMatchingException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", ex.getCode(), ex.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getCode());
        body.put("message", ex.getMessage());
        return new ResponseEntity<>(body, status);
    }

    static HttpStatus statusFor(TicketMatchingException ex) {
        if (ex instanceof InvalidArgumentException) return HttpStatus.BAD_REQUEST;
        if (ex instanceof NotInitializedException) return HttpStatus.SERVICE_UNAVAILABLE;
        if (ex instanceof IndexStateException) return HttpStatus.CONFLICT;
        if (ex instanceof ProviderException) return HttpStatus.BAD_GATEWAY;
        // persistence failures and corpus/index mismatches
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
