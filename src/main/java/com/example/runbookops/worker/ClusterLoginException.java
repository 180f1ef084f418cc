package com.example.runbookops.worker;

/**
 * The cluster credential script could not run or exited non-zero.
 */
public class ClusterLoginException extends RuntimeException {

    public ClusterLoginException(String message) {
        super(message);
    }

    public ClusterLoginException(String message, Throwable cause) {
        super(message, cause);
    }
}
