package com.example.runbookops.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying the HTTP status it maps to.
 */
@Getter
public class RunbookOpsException extends RuntimeException {

    private final HttpStatus status;

    public RunbookOpsException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public RunbookOpsException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
