package com.storynest.reading.path;

import com.storynest.reading.domain.DomainModels.PathActivity;
import com.storynest.reading.error.NotFoundException;
import com.storynest.reading.path.LearningPathModels.ActivityUpdateResult;
import com.storynest.reading.path.LearningPathModels.LearningPathView;
import com.storynest.reading.profile.ProfileAccessGuard;
import com.storynest.reading.repository.LearningPathJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class LearningPathService {
    private final LearningPathJdbcRepository repository;
    private final ProfileAccessGuard accessGuard;
    private final ProgressTracker tracker;

    public LearningPathService(LearningPathJdbcRepository repository, ProfileAccessGuard accessGuard, ProgressTracker tracker) {
        this.repository = repository;
        this.accessGuard = accessGuard;
        this.tracker = tracker;
    }

    public List<LearningPathView> listPaths(long userId, long profileId) {
        accessGuard.requireOwned(userId, profileId);
        return repository.findPathsByProfile(profileId).stream()
                .map(p -> new LearningPathView(p, repository.findActivitiesByPath(p.id())))
                .toList();
    }

    public ActivityUpdateResult updateActivity(long userId, long activityId, String requestedStatus) {
        PathActivity activity = repository.findActivity(activityId)
                .orElseThrow(() -> new NotFoundException("Path activity", activityId));
        long profileId = repository.findPath(activity.learningPathId())
                .orElseThrow(() -> new NotFoundException("Learning path", activity.learningPathId()))
                .childProfileId();
        accessGuard.requireOwned(userId, profileId);
        return tracker.applyActivityStatus(activityId, requestedStatus);
    }
}
