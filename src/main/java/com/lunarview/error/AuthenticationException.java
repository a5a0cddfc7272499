package com.lunarview.error;

public class AuthenticationException extends RemoteSessionException {

    public AuthenticationException(String message) {
        super(ErrorKind.AUTHENTICATION, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, message, cause);
    }
}
