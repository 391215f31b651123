package com.whereq.transcribe.controller;

import com.whereq.transcribe.dto.CreateTranscriptionJobResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.stream.Collectors;

/**
 * Maps request body validation failures to 400 responses
 */
@Slf4j
@RestControllerAdvice
public class RequestValidationAdvice {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<CreateTranscriptionJobResponse> handleValidation(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
            .map(error -> error.getDefaultMessage())
            .collect(Collectors.joining("; "));
        log.warn("Validation error: {}", message);
        return ResponseEntity.badRequest().body(CreateTranscriptionJobResponse.error(message));
    }
}
