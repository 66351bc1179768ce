package com.storynest.reading.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public class DomainModels {
    public record ChildProfile(Long id, long ownerUserId, String name, int age, String readingLevel,
                               String avatarUrl, Instant createdAt) {}

    public record LearningPath(Long id,
                               long childProfileId,
                               String title,
                               String description,
                               int currentStage,
                               int totalStages,
                               int progressPercentage,
                               Instant createdAt,
                               Instant lastUpdated) {

        public boolean isFrontier(int stageNumber) {
            return stageNumber == currentStage;
        }

        public boolean atLastStage() {
            return currentStage >= totalStages;
        }
    }

    public record PathActivity(Long id,
                               long learningPathId,
                               String title,
                               String description,
                               ActivityType activityType,
                               String contentUrl,
                               int stageNumber,
                               ActivityStatus status,
                               boolean completed,
                               Instant createdAt) {}

    public record ProgressAssessment(Long id,
                                     long childProfileId,
                                     Instant assessmentDate,
                                     String readingLevel,
                                     Integer readingFluencyScore,
                                     Integer comprehensionScore,
                                     Integer vocabularyScore,
                                     String notes) {}

    public enum ActivityType {
        ASSESSMENT, EXERCISE, READING, QUIZ, CREATIVE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static ActivityType fromWire(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum ActivityStatus {
        PENDING("pending"), IN_PROGRESS("in-progress"), COMPLETED("completed");

        private final String wireName;

        ActivityStatus(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        public static Optional<ActivityStatus> fromWire(String value) {
            if (value == null) return Optional.empty();
            return Arrays.stream(values()).filter(s -> s.wireName.equals(value)).findFirst();
        }
    }
}
