package net.findmyaisle.controller;

import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.controller.support.ErrorResponseUtils;
import net.findmyaisle.exception.InvalidAggregationRequestException;
import net.findmyaisle.exception.SourceNotConfiguredException;
import net.findmyaisle.util.LoggingUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps API failures onto JSON error bodies: bad input is 400, a missing source
 * credential is 503, anything unexpected is 500.
 */
@Slf4j
@RestControllerAdvice(basePackages = "net.findmyaisle.controller")
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidAggregationRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidAggregationRequestException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ErrorResponseUtils.badRequest("Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ErrorResponseUtils.badRequest("Invalid request", ex.getParameterName() + " is required");
    }

    @ExceptionHandler(SourceNotConfiguredException.class)
    public ResponseEntity<Map<String, String>> handleNotConfigured(SourceNotConfiguredException ex) {
        log.warn("Request refused: {}", ex.getMessage());
        return ErrorResponseUtils.serviceUnavailable("Source not configured", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception ex) {
        LoggingUtils.error(log, ex, "Unhandled API error");
        return ErrorResponseUtils.internalServerError("Internal server error", ex.getMessage());
    }
}
