package com.gt.practice.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

// Exceptions carrying @ResponseStatus are mapped by Spring directly; this only covers plain caller errors
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    public record ErrorResponse(Instant timestamp, int status, String error, String message) { }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadRequest(IllegalArgumentException ex) {
        log.info("Rejected request: {}", ex.getMessage());

        return new ErrorResponse(Instant.now(), HttpStatus.BAD_REQUEST.value(), "Bad request", ex.getMessage());
    }
}
