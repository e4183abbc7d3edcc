package com.talentrelay.relay.http;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class WriteBlockedException extends RuntimeException {
    private final String method;
    private final String reason;

    public WriteBlockedException(String method, String reason, String message) {
        super(message);
        this.method = method;
        this.reason = reason;
    }

    public String getMethod() {
        return method;
    }

    public String getReason() {
        return reason;
    }
}
