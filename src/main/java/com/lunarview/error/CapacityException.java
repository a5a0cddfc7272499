package com.lunarview.error;

public class CapacityException extends RemoteSessionException {

    public CapacityException(String message) {
        super(ErrorKind.CAPACITY, message);
    }

    public CapacityException(String message, Throwable cause) {
        super(ErrorKind.CAPACITY, message, cause);
    }
}
