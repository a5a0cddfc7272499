package com.lunarview.error;

public class TransportException extends RemoteSessionException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
