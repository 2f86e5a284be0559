package com.centralbot.exception;

import com.centralbot.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Turns request failures into {@code {"success": false, "error": ...}} bodies.
 * A failure stays confined to its own request.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, WebRequest request) {
        log.error("Request {} failed", request.getDescription(false), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(String.valueOf(e.getMessage())));
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex,
                                                                  HttpHeaders headers,
                                                                  HttpStatusCode status,
                                                                  WebRequest request) {
        log.warn("Unreadable request body on {}: {}", request.getDescription(false), ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("Malformed JSON body"));
    }

    // Framework failures (unsupported media type, wrong method, ...) keep their status but not the ProblemDetail body
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex,
                                                             @Nullable Object body,
                                                             HttpHeaders headers,
                                                             HttpStatusCode statusCode,
                                                             WebRequest request) {
        log.warn("Rejected request {} with {}: {}", request.getDescription(false), statusCode.value(), ex.getMessage());
        return ResponseEntity.status(statusCode)
                .headers(headers)
                .body(ErrorResponse.of(String.valueOf(ex.getMessage())));
    }
}
