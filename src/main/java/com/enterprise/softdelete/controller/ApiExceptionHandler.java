package com.enterprise.softdelete.controller;

import com.enterprise.softdelete.cqrs.query.DeleteOperationQueryService;
import com.enterprise.softdelete.service.DeleteOperationService;
import com.enterprise.softdelete.service.DeleteRateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps service exceptions to HTTP status codes and error bodies
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(DeleteOperationService.ContainerNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleContainerNotFound(DeleteOperationService.ContainerNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "CONTAINER_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(DeleteOperationService.EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(DeleteOperationService.EntityNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "ENTITY_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler({
        DeleteOperationService.OperationNotFoundException.class,
        DeleteOperationQueryService.OperationNotFoundException.class
    })
    public ResponseEntity<ErrorResponse> handleOperationNotFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, "OPERATION_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(DeleteOperationService.ContainerAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(DeleteOperationService.ContainerAccessDeniedException e) {
        return error(HttpStatus.FORBIDDEN, "FORBIDDEN", e.getMessage());
    }

    @ExceptionHandler(DeleteOperationService.EntityHasChildrenException.class)
    public ResponseEntity<ErrorResponse> handleHasChildren(DeleteOperationService.EntityHasChildrenException e) {
        return error(HttpStatus.BAD_REQUEST, "ENTITY_HAS_CHILDREN", e.getMessage());
    }

    @ExceptionHandler(DeleteOperationService.DeleteAlreadyInProgressException.class)
    public ResponseEntity<ErrorResponse> handleInProgress(DeleteOperationService.DeleteAlreadyInProgressException e) {
        return error(HttpStatus.CONFLICT, "DELETE_IN_PROGRESS", e.getMessage());
    }

    @ExceptionHandler(DeleteOperationService.InvalidOperationStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(DeleteOperationService.InvalidOperationStateException e) {
        return error(HttpStatus.CONFLICT, "INVALID_OPERATION_STATE", e.getMessage());
    }

    @ExceptionHandler(DeleteRateLimiter.RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(DeleteRateLimiter.RateLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
            .body(new ErrorResponse("RATE_LIMITED", e.getMessage()));
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ErrorResponse> handleRequestNotPermitted(RequestNotPermitted e) {
        log.warn("Request throttled: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, "1")
            .body(new ErrorResponse("RATE_LIMITED", "Too many requests"));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Missing required header: " + e.getHeaderName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Invalid value for " + e.getName());
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(HandlerMethodValidationException e) {
        String message = e.getAllValidationResults().stream()
            .flatMap(result -> result.getResolvableErrors().stream())
            .map(MessageSourceResolvable::getDefaultMessage)
            .findFirst()
            .orElse("Invalid request");
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message);
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }

    @Data
    @AllArgsConstructor
    public static class ErrorResponse {
        private String errorCode;
        private String message;
    }
}
