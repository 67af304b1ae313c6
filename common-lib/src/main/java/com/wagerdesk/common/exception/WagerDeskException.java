package com.wagerdesk.common.exception;

public class WagerDeskException extends RuntimeException {
    private final String component;

    public WagerDeskException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public WagerDeskException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
