package com.storynest.reading.api;

import com.storynest.reading.path.LearningPathModels;
import com.storynest.reading.path.LearningPathService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.storynest.reading.api.ChildProfileController.USER_HEADER;

@RestController
@RequestMapping("/api/learning-paths")
public class LearningPathController {
    private final LearningPathService pathService;

    public LearningPathController(LearningPathService pathService) {
        this.pathService = pathService;
    }

    @GetMapping("/{profileId}")
    public ResponseEntity<LearningPathModels.LearningPathsResponse> list(@RequestHeader(USER_HEADER) long userId,
                                                                         @PathVariable long profileId) {
        return ResponseEntity.ok(new LearningPathModels.LearningPathsResponse(profileId, pathService.listPaths(userId, profileId)));
    }

    @PutMapping("/activities/{activityId}")
    public ResponseEntity<LearningPathModels.ActivityUpdateResult> updateActivity(@RequestHeader(USER_HEADER) long userId,
                                                                                  @PathVariable long activityId,
                                                                                  @RequestBody LearningPathModels.ActivityStatusRequest request) {
        return ResponseEntity.ok(pathService.updateActivity(userId, activityId, request.status()));
    }
}
