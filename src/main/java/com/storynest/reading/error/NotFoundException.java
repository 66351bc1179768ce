package com.storynest.reading.error;

public class NotFoundException extends ReadingPlatformException {

    public NotFoundException(String entity, long id) {
        super("NOT_FOUND", entity + " not found: " + id);
    }
}
