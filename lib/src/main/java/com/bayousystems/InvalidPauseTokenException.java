package com.bayousystems;

/**
 * Thrown by {@link Worker#resume(PauseToken)} when the token does not match the
 * outstanding pause, or was already used.
 */
public class InvalidPauseTokenException extends IllegalArgumentException {

    public InvalidPauseTokenException(String message) {
        super(message);
    }
}
