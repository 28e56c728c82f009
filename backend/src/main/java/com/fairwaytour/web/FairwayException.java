package com.fairwaytour.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base for every domain failure that maps to a 4xx response with a machine-readable code.
 */
@Getter
public class FairwayException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public FairwayException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
