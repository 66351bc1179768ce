package com.storynest.reading.api;

import com.storynest.reading.assessment.AssessmentModels;
import com.storynest.reading.assessment.AssessmentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.storynest.reading.api.ChildProfileController.USER_HEADER;

@RestController
@RequestMapping("/api/assessments")
public class AssessmentController {
    private final AssessmentService assessmentService;

    public AssessmentController(AssessmentService assessmentService) {
        this.assessmentService = assessmentService;
    }

    @PostMapping
    public ResponseEntity<AssessmentModels.AssessmentCreatedResponse> record(@RequestHeader(USER_HEADER) long userId,
                                                                             @RequestBody AssessmentModels.AssessmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(assessmentService.recordAssessment(userId, request));
    }

    @GetMapping("/{profileId}")
    public ResponseEntity<AssessmentModels.AssessmentsResponse> list(@RequestHeader(USER_HEADER) long userId,
                                                                     @PathVariable long profileId) {
        return ResponseEntity.ok(new AssessmentModels.AssessmentsResponse(assessmentService.listAssessments(userId, profileId)));
    }
}
