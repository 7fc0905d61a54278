package com.impact.tracker.citations.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveCitationRunException extends RuntimeException {
    public ActiveCitationRunException(String message) {
        super(message);
    }
}
