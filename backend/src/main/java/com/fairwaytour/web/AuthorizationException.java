package com.fairwaytour.web;

import org.springframework.http.HttpStatus;

public class AuthorizationException extends FairwayException {

    public AuthorizationException(String message) {
        super(HttpStatus.FORBIDDEN, "forbidden", message);
    }

    public static AuthorizationException adminRequired() {
        return new AuthorizationException("Administrator privileges are required");
    }

    public static AuthorizationException notGroupCreator(String detail) {
        return new AuthorizationException(detail);
    }

    public static AuthorizationException identityRequired() {
        return new AuthorizationException("Player identity is required");
    }
}
