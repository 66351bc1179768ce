package com.storynest.reading;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class LearningPathApiTest {
    private static final String USER = "X-User-Id";

    @Autowired
    private MockMvc mvc;
    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void createsProfileAndCompletesFrontierActivity() throws Exception {
        JsonNode created = createProfile("21", "Ivy");
        assertTrue(created.at("/profile/ownerUserId").isMissingNode());
        assertEquals(1, created.at("/learningPath/path/currentStage").asInt());
        assertEquals("assessment", created.at("/learningPath/activities/0/activityType").asText());
        assertEquals("pending", created.at("/learningPath/activities/0/status").asText());
        long activityId = created.at("/learningPath/activities/0/id").asLong();

        mvc.perform(put("/api/learning-paths/activities/" + activityId)
                        .header(USER, "21")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"completed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activity.status").value("completed"))
                .andExpect(jsonPath("$.activity.completed").value(true))
                .andExpect(jsonPath("$.path.currentStage").value(2))
                .andExpect(jsonPath("$.path.progressPercentage").value(20));

        mvc.perform(put("/api/learning-paths/activities/" + created.at("/learningPath/activities/1/id").asLong())
                        .header(USER, "21")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"in-progress\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activity.status").value("in-progress"))
                .andExpect(jsonPath("$.path.currentStage").value(2));
    }

    @Test
    void rejectsUnsupportedStatus() throws Exception {
        JsonNode created = createProfile("22", "Finn");
        long activityId = created.at("/learningPath/activities/0/id").asLong();

        mvc.perform(put("/api/learning-paths/activities/" + activityId)
                        .header(USER, "22")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"finished\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_STATUS"));

        mvc.perform(get("/api/learning-paths/" + created.at("/profile/id").asLong()).header(USER, "22"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.learningPaths[0].activities[0].status").value("pending"))
                .andExpect(jsonPath("$.learningPaths[0].path.currentStage").value(1));
    }

    @Test
    void deniesActivityUpdatesFromOtherUsers() throws Exception {
        JsonNode created = createProfile("23", "Ruby");
        long activityId = created.at("/learningPath/activities/0/id").asLong();

        mvc.perform(put("/api/learning-paths/activities/" + activityId)
                        .header(USER, "99")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"completed\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));

        mvc.perform(get("/api/learning-paths/" + created.at("/profile/id").asLong()).header(USER, "99"))
                .andExpect(status().isForbidden());
    }

    @Test
    void reportsMissingResourcesAndFields() throws Exception {
        mvc.perform(put("/api/learning-paths/activities/987654321")
                        .header(USER, "24")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"completed\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        mvc.perform(post("/api/profiles")
                        .header(USER, "24")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"age\":7,\"readingLevel\":\"beginner\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mvc.perform(get("/api/profiles"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void assessmentGeneratesAdditionalPath() throws Exception {
        JsonNode created = createProfile("25", "Omar");
        long profileId = created.at("/profile/id").asLong();

        mvc.perform(post("/api/assessments")
                        .header(USER, "25")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"childProfileId\":" + profileId + ",\"readingLevel\":\"intermediate\",\"comprehensionScore\":70}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.assessment.readingLevel").value("intermediate"))
                .andExpect(jsonPath("$.learningPath.path.totalStages").value(5));

        mvc.perform(get("/api/learning-paths/" + profileId).header(USER, "25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.learningPaths.length()").value(2));

        mvc.perform(get("/api/assessments/" + profileId).header(USER, "25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assessments[0].comprehensionScore").value(70));

        mvc.perform(get("/api/profiles/" + profileId).header(USER, "25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.readingLevel").value("intermediate"))
                .andExpect(jsonPath("$.ownerUserId").doesNotExist());
    }

    @Test
    void deniesAssessmentsForOtherUsersProfiles() throws Exception {
        JsonNode created = createProfile("26", "Lena");
        long profileId = created.at("/profile/id").asLong();

        mvc.perform(post("/api/assessments")
                        .header(USER, "98")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"childProfileId\":" + profileId + ",\"readingLevel\":\"advanced\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));

        mvc.perform(get("/api/assessments/" + profileId).header(USER, "98"))
                .andExpect(status().isForbidden());

        mvc.perform(get("/api/assessments/" + profileId).header(USER, "26"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assessments.length()").value(0));
        mvc.perform(get("/api/learning-paths/" + profileId).header(USER, "26"))
                .andExpect(jsonPath("$.learningPaths.length()").value(1));
        mvc.perform(get("/api/profiles/" + profileId).header(USER, "26"))
                .andExpect(jsonPath("$.readingLevel").value("beginner"));
    }

    private JsonNode createProfile(String userId, String name) throws Exception {
        String body = mvc.perform(post("/api/profiles")
                        .header(USER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"" + name + "\",\"age\":8,\"readingLevel\":\"beginner\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }
}
