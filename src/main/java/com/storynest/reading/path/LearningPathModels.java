package com.storynest.reading.path;

import com.storynest.reading.domain.DomainModels.LearningPath;
import com.storynest.reading.domain.DomainModels.PathActivity;

import java.util.List;

public class LearningPathModels {
    public record LearningPathView(LearningPath path, List<PathActivity> activities) {}

    public record ActivityStatusRequest(String status) {}

    public record ActivityUpdateResult(PathActivity activity, LearningPath path, boolean frontierCompleted) {}

    public record LearningPathsResponse(long childProfileId, List<LearningPathView> learningPaths) {}
}
