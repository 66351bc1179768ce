package com.storynest.reading.path;

import com.storynest.reading.domain.DomainModels.ActivityStatus;
import com.storynest.reading.domain.DomainModels.LearningPath;
import com.storynest.reading.domain.DomainModels.PathActivity;
import com.storynest.reading.error.InvalidStatusException;
import com.storynest.reading.error.NotFoundException;
import com.storynest.reading.path.LearningPathModels.ActivityUpdateResult;
import com.storynest.reading.repository.LearningPathJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class ProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final LearningPathJdbcRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    static final int LOCK_STRIPES = 64;

    // striped by path id, held across the whole read-modify-write transaction
    private final ReentrantLock[] pathLocks = new ReentrantLock[LOCK_STRIPES];

    public ProgressTracker(LearningPathJdbcRepository repository, TransactionTemplate transactionTemplate, Clock clock) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        for (int i = 0; i < pathLocks.length; i++) {
            pathLocks[i] = new ReentrantLock();
        }
    }

    public ActivityUpdateResult applyActivityStatus(long activityId, String requestedStatus) {
        ActivityStatus newStatus = ActivityStatus.fromWire(requestedStatus)
                .orElseThrow(() -> new InvalidStatusException(requestedStatus));

        long pathId = repository.findActivity(activityId)
                .orElseThrow(() -> new NotFoundException("Path activity", activityId))
                .learningPathId();

        ReentrantLock lock = lockFor(pathId);
        lock.lock();
        try {
            return transactionTemplate.execute(tx -> apply(activityId, newStatus));
        } finally {
            lock.unlock();
        }
    }

    // floor of 100 * completed / total, empty for a path without activities
    public static OptionalInt progressPercentage(long completed, long total) {
        if (total <= 0) return OptionalInt.empty();
        return OptionalInt.of((int) (100 * completed / total));
    }

    ReentrantLock lockFor(long pathId) {
        return pathLocks[Math.floorMod(Long.hashCode(pathId), LOCK_STRIPES)];
    }

    private ActivityUpdateResult apply(long activityId, ActivityStatus newStatus) {
        PathActivity activity = repository.findActivity(activityId)
                .orElseThrow(() -> new NotFoundException("Path activity", activityId));
        LearningPath path = repository.findPath(activity.learningPathId())
                .orElseThrow(() -> new NotFoundException("Learning path", activity.learningPathId()));

        boolean completed = activity.completed() || newStatus == ActivityStatus.COMPLETED;
        repository.updateActivityState(activity.id(), newStatus, completed);
        PathActivity updated = new PathActivity(activity.id(), activity.learningPathId(), activity.title(),
                activity.description(), activity.activityType(), activity.contentUrl(), activity.stageNumber(),
                newStatus, completed, activity.createdAt());
        log.debug("Activity {} on stage {} moved {} -> {}", activity.id(), activity.stageNumber(),
                activity.status().wireName(), newStatus.wireName());

        if (newStatus != ActivityStatus.COMPLETED || !path.isFrontier(activity.stageNumber())) {
            return new ActivityUpdateResult(updated, path, false);
        }
        return new ActivityUpdateResult(updated, advance(path), true);
    }

    private LearningPath advance(LearningPath path) {
        int stage = path.atLastStage() ? path.currentStage() : path.currentStage() + 1;
        int percentage = progressPercentage(repository.countCompletedActivities(path.id()), repository.countActivities(path.id()))
                .orElse(path.progressPercentage());
        Instant now = clock.instant();

        repository.updatePathProgress(path.id(), stage, percentage, now);
        log.debug("Path {} frontier {} -> {}, progress {}%", path.id(), path.currentStage(), stage, percentage);

        return new LearningPath(path.id(), path.childProfileId(), path.title(), path.description(),
                stage, path.totalStages(), percentage, path.createdAt(), now);
    }
}
