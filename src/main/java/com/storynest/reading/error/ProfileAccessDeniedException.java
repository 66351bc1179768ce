package com.storynest.reading.error;

public class ProfileAccessDeniedException extends ReadingPlatformException {

    public ProfileAccessDeniedException(long userId, long profileId) {
        super("FORBIDDEN", "User " + userId + " has no access to profile " + profileId);
    }
}
