package com.storynest.reading.assessment;

import com.storynest.reading.domain.DomainModels.ProgressAssessment;
import com.storynest.reading.path.LearningPathModels.LearningPathView;

import java.util.List;

public class AssessmentModels {
    public record AssessmentRequest(Long childProfileId,
                                    String readingLevel,
                                    Integer readingFluencyScore,
                                    Integer comprehensionScore,
                                    Integer vocabularyScore,
                                    String notes) {}

    public record AssessmentCreatedResponse(ProgressAssessment assessment, LearningPathView learningPath) {}

    public record AssessmentsResponse(List<ProgressAssessment> assessments) {}
}
