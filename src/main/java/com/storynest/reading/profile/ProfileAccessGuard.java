package com.storynest.reading.profile;

import com.storynest.reading.domain.DomainModels.ChildProfile;
import com.storynest.reading.error.NotFoundException;
import com.storynest.reading.error.ProfileAccessDeniedException;
import com.storynest.reading.repository.ProfileJdbcRepository;
import org.springframework.stereotype.Component;

@Component
public class ProfileAccessGuard {
    private final ProfileJdbcRepository profiles;

    public ProfileAccessGuard(ProfileJdbcRepository profiles) {
        this.profiles = profiles;
    }

    public ChildProfile requireOwned(long userId, long profileId) {
        ChildProfile profile = profiles.findById(profileId)
                .orElseThrow(() -> new NotFoundException("Child profile", profileId));
        if (profile.ownerUserId() != userId) {
            throw new ProfileAccessDeniedException(userId, profileId);
        }
        return profile;
    }
}
