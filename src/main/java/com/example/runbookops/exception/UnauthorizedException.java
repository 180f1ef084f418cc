package com.example.runbookops.exception;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends RunbookOpsException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
