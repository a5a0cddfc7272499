package com.lunarview.error;

/**
 * Root of the checked failures raised by the session engine.
 */
public class RemoteSessionException extends Exception {

    private final ErrorKind kind;

    public RemoteSessionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RemoteSessionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
