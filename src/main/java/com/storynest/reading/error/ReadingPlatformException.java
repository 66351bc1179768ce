package com.storynest.reading.error;

public class ReadingPlatformException extends RuntimeException {

    private final String errorCode;

    public ReadingPlatformException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
