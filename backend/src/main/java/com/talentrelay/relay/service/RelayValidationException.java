package com.talentrelay.relay.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class RelayValidationException extends RuntimeException {
    public RelayValidationException(String message) {
        super(message);
    }
}
