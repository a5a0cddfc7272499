package com.lunarview.error;

public class ChecksumMismatchException extends RemoteSessionException {

    public ChecksumMismatchException(String message) {
        super(ErrorKind.CHECKSUM_MISMATCH, message);
    }

    public ChecksumMismatchException(String message, Throwable cause) {
        super(ErrorKind.CHECKSUM_MISMATCH, message, cause);
    }
}
