package com.stablepeg.exception;

import lombok.Getter;

@Getter
public class MarketDataException extends StablePegException {

    private final boolean transientFailure;
    private final int statusCode;

    public MarketDataException(String message, boolean transientFailure, int statusCode) {
        super(message);
        this.transientFailure = transientFailure;
        this.statusCode = statusCode;
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
        this.transientFailure = true;
        this.statusCode = -1;
    }

    public static MarketDataException forStatus(int statusCode) {
        boolean persistent = statusCode == 401 || statusCode == 403;
        return new MarketDataException("Provider responded with HTTP " + statusCode, !persistent, statusCode);
    }
}
