package com.wagerdesk.common.exception;

/**
 * A warehouse call failed. Callers convert it into a missing-artifact marker.
 */
public class DataUnavailableException extends WagerDeskException {

    private final ErrorKind kind;

    public DataUnavailableException(String component, ErrorKind kind, String message) {
        super(component, message);
        this.kind = kind;
    }

    public DataUnavailableException(String component, ErrorKind kind, String message, Throwable cause) {
        super(component, message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
