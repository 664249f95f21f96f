package com.autobulk.error;

public class RecipientResolutionException extends DispatchException {

    public RecipientResolutionException(String message) {
        super(message);
    }

    public RecipientResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
