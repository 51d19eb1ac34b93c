package org.mides.pooling.exception;

/** Input that cannot describe a pooling instance: bad parameters or duplicate requests. */
public class InvalidProblemException extends RuntimeException {
    public InvalidProblemException(String message) {
        super(message);
    }
}
