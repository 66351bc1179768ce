package com.storynest.reading.error;

public class InvalidRequestException extends ReadingPlatformException {

    public InvalidRequestException(String message) {
        super("INVALID_REQUEST", message);
    }

    public static InvalidRequestException missingField(String field) {
        return new InvalidRequestException("Missing required field: " + field);
    }
}
