package com.storynest.reading.profile;

import com.storynest.reading.domain.DomainModels.ChildProfile;
import com.storynest.reading.error.InvalidRequestException;
import com.storynest.reading.path.LearningPathGenerator;
import com.storynest.reading.path.LearningPathModels.LearningPathView;
import com.storynest.reading.profile.ProfileModels.CreateProfileRequest;
import com.storynest.reading.profile.ProfileModels.ProfileCreatedResponse;
import com.storynest.reading.repository.ProfileJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

@Service
public class ChildProfileService {
    private static final Logger log = LoggerFactory.getLogger(ChildProfileService.class);

    private final ProfileJdbcRepository repository;
    private final ProfileAccessGuard accessGuard;
    private final LearningPathGenerator pathGenerator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ChildProfileService(ProfileJdbcRepository repository,
                               ProfileAccessGuard accessGuard,
                               LearningPathGenerator pathGenerator,
                               TransactionTemplate transactionTemplate,
                               Clock clock) {
        this.repository = repository;
        this.accessGuard = accessGuard;
        this.pathGenerator = pathGenerator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public ProfileCreatedResponse createProfile(long userId, CreateProfileRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw InvalidRequestException.missingField("name");
        }
        if (request.age() == null) throw InvalidRequestException.missingField("age");
        if (request.readingLevel() == null || request.readingLevel().isBlank()) {
            throw InvalidRequestException.missingField("readingLevel");
        }

        ProfileCreatedResponse created = transactionTemplate.execute(tx -> {
            ChildProfile profile = repository.insert(new ChildProfile(null, userId, request.name().trim(), request.age(),
                    request.readingLevel().trim(), request.avatarUrl(), clock.instant()));
            LearningPathView path = pathGenerator.generate(profile);
            return new ProfileCreatedResponse(ProfileModels.ProfileView.of(profile), path);
        });
        log.info("Created child profile {} for user {}", created.profile().id(), userId);
        return created;
    }

    public List<ChildProfile> listProfiles(long userId) {
        return repository.findByOwner(userId);
    }

    public ChildProfile getProfile(long userId, long profileId) {
        return accessGuard.requireOwned(userId, profileId);
    }
}
