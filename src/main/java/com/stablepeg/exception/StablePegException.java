package com.stablepeg.exception;

public class StablePegException extends RuntimeException {

    public StablePegException(String message) {
        super(message);
    }

    public StablePegException(String message, Throwable cause) {
        super(message, cause);
    }
}
