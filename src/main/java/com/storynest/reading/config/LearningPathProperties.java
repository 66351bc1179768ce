package com.storynest.reading.config;

import com.storynest.reading.domain.DomainModels.ActivityType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "reading.path")
public record LearningPathProperties(String titlePattern,
                                     String descriptionPattern,
                                     List<Stage> stages) {

    public static final List<Stage> DEFAULT_STAGES = List.of(
            new Stage(ActivityType.ASSESSMENT, "Reading Assessment",
                    "Complete an initial reading assessment to identify your strengths and areas for improvement."),
            new Stage(ActivityType.EXERCISE, "Vocabulary Building",
                    "Practice with new words to expand your vocabulary."),
            new Stage(ActivityType.READING, "Guided Reading",
                    "Read a story with interactive guidance to help with comprehension."),
            new Stage(ActivityType.QUIZ, "Comprehension Quiz",
                    "Answer questions about the story to check your understanding."),
            new Stage(ActivityType.CREATIVE, "Creative Response",
                    "Create your own story or drawing inspired by what you read.")
    );

    public LearningPathProperties {
        if (titlePattern == null || titlePattern.isBlank()) {
            titlePattern = "Personalized Reading Journey for %s";
        }
        if (descriptionPattern == null || descriptionPattern.isBlank()) {
            descriptionPattern = "A customized learning path designed for a %d-year-old reader at %s level.";
        }
        stages = (stages == null || stages.isEmpty()) ? DEFAULT_STAGES : List.copyOf(stages);
    }

    public record Stage(ActivityType type, String title, String description) {}
}
