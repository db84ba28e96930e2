package com.handoff.backend.exception;

import com.handoff.backend.dto.ApiError;
import com.handoff.backend.dto.ApiErrorDetail;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .value(violation.getInvalidValue())
                        .issue(violation.getMessage())
                        .build())
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Validation failed", details, request, ex);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request: " + rootMessage(ex),
                List.of(), request, ex);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleDomainValidation(ValidationException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), ex.getDetails(), request, ex);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ApiError> handleUnauthorized(UnauthorizedException ex, HttpServletRequest request) {
        return buildError(HttpStatus.UNAUTHORIZED, ex.getReason(), ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiError> handleRateLimit(RateLimitExceededException ex, HttpServletRequest request) {
        ApiError body = buildError(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMIT_EXCEEDED", ex.getMessage(), List.of(),
                request, ex).getBody();
        body.setRetryAfterSeconds(ex.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header("Retry-After", String.valueOf(ex.getRetryAfterSeconds()))
                .body(body);
    }

    @ExceptionHandler(IdempotencyConflictException.class)
    public ResponseEntity<ApiError> handleConflict(IdempotencyConflictException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = List.of(ApiErrorDetail.builder()
                .field("Idempotency-Key")
                .value(ex.getIdempotencyKey())
                .issue(ex.getMessage())
                .build());
        return buildError(HttpStatus.CONFLICT, "IDEMPOTENCY_CONFLICT", ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = List.of(ApiErrorDetail.builder()
                .field(ex.getResource())
                .value(ex.getId())
                .issue("not found")
                .build());
        return buildError(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(NoteAppendException.class)
    public ResponseEntity<ApiError> handleNoteAppend(NoteAppendException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = new ArrayList<>();
        details.add(ApiErrorDetail.builder().field("ticketId").value(ex.getTicketId())
                .issue("ticket exists, retry append-note only").build());
        details.add(ApiErrorDetail.builder().field("ticketUrl").value(ex.getTicketUrl()).issue("ticket link").build());
        details.add(ApiErrorDetail.builder().field("created").value(ex.isCreated())
                .issue("whether this request created the ticket").build());
        return buildError(HttpStatus.BAD_GATEWAY, "NOTE_APPEND_FAILED", ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(HelpdeskException.class)
    public ResponseEntity<ApiError> handleHelpdesk(HelpdeskException ex, HttpServletRequest request) {
        HttpStatus status = ex.isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        List<ApiErrorDetail> details = List.of(ApiErrorDetail.builder()
                .field("operation")
                .value(ex.getOperation())
                .issue(ex.getStatusCode() > 0 ? "helpdesk returned " + ex.getStatusCode() : "helpdesk call failed")
                .build());
        return buildError(status, "HELPDESK_ERROR", ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", List.of(),
                request, ex);
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .value(error.getRejectedValue())
                .issue(error.getDefaultMessage())
                .build();
    }

    private String rootMessage(Throwable ex) {
        Throwable current = ex;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String errorCode, String message,
                                                List<ApiErrorDetail> details, HttpServletRequest request,
                                                Exception ex) {
        String requestId = MDC.get("requestId");
        String correlationId = MDC.get("correlationId");
        ApiError error = ApiError.builder()
                .timestamp(clock.instant())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .requestId(requestId)
                .correlationId(correlationId)
                .details(details)
                .build();
        log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        return ResponseEntity.status(status).body(error);
    }
}
