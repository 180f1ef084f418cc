package com.example.runbookops.exception;

import org.springframework.http.HttpStatus;

/**
 * Signature mismatch, expiry or execId mismatch. The message never says which.
 */
public class InvalidApprovalTokenException extends RunbookOpsException {

    public static final String MESSAGE = "Invalid or expired payload";

    public InvalidApprovalTokenException() {
        super(HttpStatus.UNAUTHORIZED, MESSAGE);
    }
}
