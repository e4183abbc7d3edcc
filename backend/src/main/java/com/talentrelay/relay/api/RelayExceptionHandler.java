package com.talentrelay.relay.api;

import com.talentrelay.relay.http.UpstreamApiException;
import com.talentrelay.relay.http.WriteBlockedException;
import com.talentrelay.relay.service.RelayValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class RelayExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(RelayExceptionHandler.class);

    @ExceptionHandler(RelayValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(RelayValidationException ex, HttpServletRequest request) {
        logFailure(request, HttpStatus.BAD_REQUEST.value(), ex);
        return envelope(HttpStatus.BAD_REQUEST.value(), ex.getMessage(), null, null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        logFailure(request, HttpStatus.BAD_REQUEST.value(), ex);
        return envelope(HttpStatus.BAD_REQUEST.value(), "Request body must be a JSON object.", null, null, request);
    }

    @ExceptionHandler(WriteBlockedException.class)
    public ResponseEntity<Map<String, Object>> handleWriteBlocked(WriteBlockedException ex, HttpServletRequest request) {
        logFailure(request, HttpStatus.FORBIDDEN.value(), ex);
        return envelope(HttpStatus.FORBIDDEN.value(), ex.getMessage(), ex.getReason(), null, request);
    }

    @ExceptionHandler(UpstreamApiException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamApiException ex, HttpServletRequest request) {
        int status = ex.getStatus() >= 400 && ex.getStatus() <= 599 ? ex.getStatus() : HttpStatus.BAD_REQUEST.value();
        logFailure(request, status, ex);
        return envelope(status, ex.getMessage(), null, ex.getBody(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("request.failed requestId={} route={} status=500", requestId(request), request.getRequestURI(), ex);
        String message = ex.getMessage() == null ? "Request failed" : ex.getMessage();
        return envelope(HttpStatus.INTERNAL_SERVER_ERROR.value(), message, null, null, request);
    }

    private static ResponseEntity<Map<String, Object>> envelope(
        int status,
        String message,
        String reason,
        Object details,
        HttpServletRequest request
    ) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", message == null || message.isBlank() ? "Request failed" : message);
        if (reason != null) {
            body.put("reason", reason);
        }
        body.put("details", details);
        body.put("requestId", requestId(request));
        return ResponseEntity.status(status).body(body);
    }

    private static void logFailure(HttpServletRequest request, int status, Exception ex) {
        log.error(
            "request.failed requestId={} route={} status={} error={}",
            requestId(request),
            request.getRequestURI(),
            status,
            ex.getMessage()
        );
    }

    private static String requestId(HttpServletRequest request) {
        Object value = request.getAttribute(RelayRequestFilter.REQUEST_ID_ATTRIBUTE);
        return value == null ? "" : value.toString();
    }
}
