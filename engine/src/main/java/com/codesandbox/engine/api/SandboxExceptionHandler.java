package com.codesandbox.engine.api;

import com.codesandbox.engine.admission.AdmissionRejectedException;
import com.codesandbox.engine.api.dto.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps refusals to the response envelope.
 *
 * AdmissionRejectedException        503, code -503
 * unreadable or incomplete payload  422, code -422
 * anything else                     500, code -500
 */
@RestControllerAdvice
public class SandboxExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SandboxExceptionHandler.class);

    @ExceptionHandler(AdmissionRejectedException.class)
    public ResponseEntity<ApiResponse<Void>> rejected(AdmissionRejectedException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(-503, "Too many requests"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> unreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ApiResponse.error(-422, "Invalid request body"));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiResponse<Void>> invalid(InvalidRequestException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ApiResponse.error(-422, e.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResponse<Void>> unexpected(RuntimeException e) {
        log.error("Unhandled error while serving request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(-500, "Internal error"));
    }
}
