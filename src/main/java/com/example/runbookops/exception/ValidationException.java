package com.example.runbookops.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends RunbookOpsException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
