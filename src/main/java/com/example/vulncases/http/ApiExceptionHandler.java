package com.example.vulncases.http;

import com.example.vulncases.service.TestCaseException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Maps failures to JSON bodies of the form {@code {"code": ..., "error": ..., "message": ...}}.
 * Storage failures never expose connection details.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(TestCaseException.class)
    public ResponseEntity<Map<String, Object>> domainError(TestCaseException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case VALIDATION_FAILED, INVALID_PAYLOAD, INVALID_PLATFORM -> status = HttpStatus.BAD_REQUEST;
            case DUPLICATE_VULN_ID -> status = HttpStatus.CONFLICT;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (status.is5xxServerError()) {
            log.error("Storage failure handling request", ex);
        }
        return ResponseEntity.status(status)
                .body(body(ex.getCode().name(), ex.getMessage(), ex.getDetails()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(body(TestCaseException.Code.INVALID_PAYLOAD.name(), "Invalid or missing JSON", null));
    }

    @ExceptionHandler(SdkException.class)
    public ResponseEntity<Map<String, Object>> storage(SdkException ex) {
        log.error("Unhandled storage error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(TestCaseException.Code.STORAGE_UNAVAILABLE.name(), "Database error", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            return frameworkError(errorResponse);
        }
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "Internal server error", null));
    }

    /**
     * Client errors raised by Spring MVC itself (unknown path, wrong method, wrong content type)
     * keep their own status.
     */
    private ResponseEntity<Map<String, Object>> frameworkError(ErrorResponse ex) {
        HttpStatusCode status = ex.getStatusCode();
        HttpStatus known = HttpStatus.resolve(status.value());
        String code = known != null ? known.name() : "HTTP_" + status.value();
        String error = known != null ? known.getReasonPhrase() : "HTTP error";
        if (status.is5xxServerError()) {
            log.error("Request failed with status {}", status.value(), (Throwable) ex);
        } else {
            log.debug("Request rejected with status {}: {}", status.value(), ex.getBody().getDetail());
        }
        return ResponseEntity.status(status)
                .headers(ex.getHeaders())
                .body(body(code, error, null));
    }

    private static Map<String, Object> body(String code, String error, Object message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("error", error);
        if (message != null) {
            body.put("message", message);
        }
        return body;
    }
}
