package com.drawforecast.common.exception;

public class ForecastException extends RuntimeException {
    private final String component;

    public ForecastException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public ForecastException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
