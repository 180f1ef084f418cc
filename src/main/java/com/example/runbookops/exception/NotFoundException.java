package com.example.runbookops.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends RunbookOpsException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
