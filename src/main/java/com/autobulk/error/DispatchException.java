package com.autobulk.error;

/**
 * Failure of one of the collaborators invoked while running a job. Every subtype is handled the
 * same way by the dispatch loop: the execution fails and the retry policy decides what happens next.
 */
public abstract class DispatchException extends Exception {

    protected DispatchException(String message) {
        super(message);
    }

    protected DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
