package com.example.runbookops.exception;

import org.springframework.http.HttpStatus;

/**
 * The job could not be handed to a worker. Callers record an error and escalate.
 */
public class DispatchException extends RunbookOpsException {

    public DispatchException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public DispatchException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
