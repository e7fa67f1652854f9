package com.stablepeg.exception;

public class CooldownStoreException extends StablePegException {

    public CooldownStoreException(String message) {
        super(message);
    }

    public CooldownStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
