package com.phillippitts.newwork.exception;

/**
 * Base exception for all NewWork host application errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class NewWorkException extends RuntimeException {

    public NewWorkException(String message) {
        super(message);
    }

    public NewWorkException(String message, Throwable cause) {
        super(message, cause);
    }

    public NewWorkException(Throwable cause) {
        super(cause);
    }
}
