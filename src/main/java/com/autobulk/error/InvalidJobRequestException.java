package com.autobulk.error;

/**
 * A job creation or query request that can never succeed as given. Not retried.
 */
public class InvalidJobRequestException extends IllegalArgumentException {

    public InvalidJobRequestException(String message) {
        super(message);
    }
}
