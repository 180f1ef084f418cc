package com.example.runbookops.exception;

public class NoWorkerAvailableException extends DispatchException {

    public NoWorkerAvailableException(String capability) {
        super("No active worker for capability '" + capability + "'");
    }
}
