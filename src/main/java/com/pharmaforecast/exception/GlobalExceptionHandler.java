package com.pharmaforecast.exception;

import com.pharmaforecast.config.RequestGuardFilter;
import com.pharmaforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        List<ApiError.Violation> violations = ex.getConstraintViolations()
            .stream()
            .map(cv -> ApiError.Violation.builder()
                .parameter(lastNode(cv.getPropertyPath().toString()))
                .message(cv.getMessage())
                .build())
            .toList();

        return build(HttpStatus.BAD_REQUEST, "Validation Failed",
                     "One or more parameters failed validation", request, "INVALID_ARGUMENT", violations);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {

        List<ApiError.Violation> violations = ex.getAllValidationResults()
            .stream()
            .flatMap(result -> result.getResolvableErrors().stream()
                .map(err -> ApiError.Violation.builder()
                    .parameter(result.getMethodParameter().getParameterName())
                    .message(err.getDefaultMessage())
                    .build()))
            .toList();

        return build(HttpStatus.BAD_REQUEST, "Validation Failed",
                     "One or more parameters failed validation", request, "INVALID_ARGUMENT", violations);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, "INVALID_ARGUMENT", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(),
                     request, "INVALID_ARGUMENT", null);
    }

    @ExceptionHandler({ModelNotFoundException.class, JobNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            PharmaForecastException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStoreUnavailable(
            StoreUnavailableException ex, HttpServletRequest request) {
        log.error("Inventory store unavailable: {}", ex.getMessage(), ex.getCause());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Store Unavailable",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(TrainerUnavailableException.class)
    public ResponseEntity<ApiError> handleTrainerUnavailable(
            TrainerUnavailableException ex, HttpServletRequest request) {
        log.error("Trainer unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Trainer Unavailable",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(TrainerApiException.class)
    public ResponseEntity<ApiError> handleTrainerError(
            TrainerApiException ex, HttpServletRequest request) {
        log.error("Trainer error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Trainer Error",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(ModelLoadException.class)
    public ResponseEntity<ApiError> handleModelLoad(
            ModelLoadException ex, HttpServletRequest request) {
        log.error("Model load failed | artifact={} | {}", ex.getArtifactName(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Model Load Failed",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null);
    }

    private static String requestId(HttpServletRequest request) {
        Object assigned = request.getAttribute(RequestGuardFilter.REQUEST_ID_ATTRIBUTE);
        return assigned != null ? assigned.toString() : request.getHeader(RequestGuardFilter.REQUEST_ID_HEADER);
    }

    private static String lastNode(String path) {
        int dot = path.lastIndexOf('.');
        return dot >= 0 ? path.substring(dot + 1) : path;
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String code,
            List<ApiError.Violation> violations) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .code(code)
            .message(message)
            .path(request.getRequestURI())
            .requestId(requestId(request))
            .timestamp(Instant.now())
            .violations(violations)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
