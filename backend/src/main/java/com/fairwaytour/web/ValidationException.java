package com.fairwaytour.web;

import org.springframework.http.HttpStatus;

public class ValidationException extends FairwayException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, "validation_failed", message);
    }
}
