package com.flagship.fraud_decisions.ingestion.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fraud_decisions.ingestion.StoreFailureClassifier;
import com.flagship.fraud_decisions.observability.CorrelationContext;
import com.flagship.fraud_decisions.validation.IngestionRejectedException;
import com.flagship.fraud_decisions.validation.RejectionCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps ingestion failures to the structured error body.
 *
 * Messages name fields and constraints only; submitted values are never echoed.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";

    private final StoreFailureClassifier failureClassifier;

    @ExceptionHandler(IngestionRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejection(IngestionRejectedException e) {
        HttpStatus status = e.getCode() == RejectionCode.PAN_DETECTED
            ? HttpStatus.UNPROCESSABLE_ENTITY
            : HttpStatus.BAD_REQUEST;
        return respond(status, e.getCode().name(), e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        // the parser message may quote the body
        log.warn("Unreadable ingestion request body");
        return respond(HttpStatus.BAD_REQUEST, RejectionCode.SCHEMA_INVALID.name(), "$: request body is not valid JSON");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException e) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, RejectionCode.SCHEMA_INVALID.name(),
            "Content-Type must be application/json");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoResourceFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "No endpoint " + e.getResourcePath());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", "Method " + e.getMethod() + " is not supported");
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleStoreFailure(RuntimeException e) {
        if (failureClassifier.isTransient(e)) {
            log.warn("Store unavailable: {}", e.getClass().getSimpleName());
            return respond(HttpStatus.SERVICE_UNAVAILABLE, STORE_UNAVAILABLE, "Event store is temporarily unavailable");
        }
        log.error("Store failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, RejectionCode.UNHANDLED.name(), "An unexpected error occurred");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, RejectionCode.UNHANDLED.name(), "An unexpected error occurred");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message) {
        ErrorResponse error = ErrorResponse.builder()
            .errorCode(errorCode)
            .message(message)
            .businessId(MDC.get(CorrelationContext.TRANSACTION_ID_MDC_KEY))
            .traceId(MDC.get(CorrelationContext.TRACE_ID_MDC_KEY))
            .build();
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        @JsonProperty("error_code")
        String errorCode;
        @JsonProperty("message")
        String message;
        @JsonProperty("business_id")
        String businessId;
        @JsonProperty("trace_id")
        String traceId;
    }
}
