package com.nevis.dataroom.exception;

/**
 * Raised instead of issuing an external call once the run has been cancelled.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String message) {
        super(message);
    }
}
