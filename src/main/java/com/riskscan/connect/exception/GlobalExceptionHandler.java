package com.riskscan.connect.exception;

import com.riskscan.connect.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
        logger.error("{} {} -> server misconfigured: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, new ErrorResponse(ex.getMessage()), request);
    }

    @ExceptionHandler(OAuthAuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleOAuth(OAuthAuthenticationException ex, HttpServletRequest request) {
        return build(HttpStatus.UNAUTHORIZED, new ErrorResponse(ex.getMessage()), request);
    }

    @ExceptionHandler(ExchangeException.class)
    public ResponseEntity<ErrorResponse> handleExchange(ExchangeException ex, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(ex.getMessage(), ex.getStage().name(),
                ex.getUpstreamStatus(), ex.getUpstreamBody());
        return build(HttpStatus.BAD_GATEWAY, body, request);
    }

    @ExceptionHandler(RemoteApiException.class)
    public ResponseEntity<ErrorResponse> handleRemoteApi(RemoteApiException ex, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(ex.getMessage(), null, ex.getUpstreamStatus(), ex.getUpstreamBody());
        return build(HttpStatus.BAD_GATEWAY, body, request);
    }

    @ExceptionHandler(NoIdentityException.class)
    public ResponseEntity<ErrorResponse> handleNoIdentity(NoIdentityException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, new ErrorResponse(ex.getMessage()), request);
    }

    @ExceptionHandler(ContentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ContentNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, new ErrorResponse(ex.getMessage()), request);
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, new ErrorResponse(ex.getMessage()), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining("; "));
        return build(HttpStatus.BAD_REQUEST, new ErrorResponse(message.isEmpty() ? "Validation failed" : message), request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, new ErrorResponse("Malformed request: " + ex.getMessage()), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        logger.error("{} {} failed", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse("Unexpected error"));
    }

    private String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, ErrorResponse body, HttpServletRequest request) {
        logger.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), body.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
