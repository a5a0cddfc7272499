package com.lunarview.error;

public class SessionTimeoutException extends RemoteSessionException {

    public SessionTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public SessionTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
