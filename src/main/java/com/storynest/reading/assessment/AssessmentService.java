package com.storynest.reading.assessment;

import com.storynest.reading.assessment.AssessmentModels.AssessmentCreatedResponse;
import com.storynest.reading.assessment.AssessmentModels.AssessmentRequest;
import com.storynest.reading.domain.DomainModels.ChildProfile;
import com.storynest.reading.domain.DomainModels.ProgressAssessment;
import com.storynest.reading.error.InvalidRequestException;
import com.storynest.reading.path.LearningPathGenerator;
import com.storynest.reading.path.LearningPathModels.LearningPathView;
import com.storynest.reading.profile.ProfileAccessGuard;
import com.storynest.reading.repository.AssessmentJdbcRepository;
import com.storynest.reading.repository.ProfileJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

@Service
public class AssessmentService {
    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final AssessmentJdbcRepository repository;
    private final ProfileJdbcRepository profiles;
    private final ProfileAccessGuard accessGuard;
    private final LearningPathGenerator pathGenerator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AssessmentService(AssessmentJdbcRepository repository,
                             ProfileJdbcRepository profiles,
                             ProfileAccessGuard accessGuard,
                             LearningPathGenerator pathGenerator,
                             TransactionTemplate transactionTemplate,
                             Clock clock) {
        this.repository = repository;
        this.profiles = profiles;
        this.accessGuard = accessGuard;
        this.pathGenerator = pathGenerator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    // adds a path for the new level, earlier paths are kept
    public AssessmentCreatedResponse recordAssessment(long userId, AssessmentRequest request) {
        if (request == null || request.childProfileId() == null) {
            throw InvalidRequestException.missingField("childProfileId");
        }
        if (request.readingLevel() == null || request.readingLevel().isBlank()) {
            throw InvalidRequestException.missingField("readingLevel");
        }
        ChildProfile profile = accessGuard.requireOwned(userId, request.childProfileId());
        String level = request.readingLevel().trim();

        AssessmentCreatedResponse created = transactionTemplate.execute(tx -> {
            ProgressAssessment assessment = repository.insert(new ProgressAssessment(null, profile.id(), clock.instant(), level,
                    request.readingFluencyScore(), request.comprehensionScore(), request.vocabularyScore(), request.notes()));
            profiles.updateReadingLevel(profile.id(), level);

            ChildProfile reassessed = new ChildProfile(profile.id(), profile.ownerUserId(), profile.name(), profile.age(),
                    level, profile.avatarUrl(), profile.createdAt());
            LearningPathView path = pathGenerator.generate(reassessed);
            return new AssessmentCreatedResponse(assessment, path);
        });
        log.info("Recorded assessment {} for profile {} at level {}", created.assessment().id(), profile.id(), level);
        return created;
    }

    public List<ProgressAssessment> listAssessments(long userId, long profileId) {
        accessGuard.requireOwned(userId, profileId);
        return repository.findByProfile(profileId);
    }
}
