package com.storynest.reading.error;

public class InvalidStatusException extends ReadingPlatformException {

    public InvalidStatusException(String requestedStatus) {
        super("INVALID_STATUS", "Unsupported activity status: " + requestedStatus);
    }
}
