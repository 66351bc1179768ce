package com.storynest.reading.repository;

import com.storynest.reading.domain.DomainModels.ActivityStatus;
import com.storynest.reading.domain.DomainModels.ActivityType;
import com.storynest.reading.domain.DomainModels.LearningPath;
import com.storynest.reading.domain.DomainModels.PathActivity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
public class LearningPathJdbcRepository {
    private static final String PATH_COLUMNS =
            "id, child_profile_id, title, description, current_stage, total_stages, progress_percentage, created_at, last_updated";
    private static final String ACTIVITY_COLUMNS =
            "id, learning_path_id, title, description, activity_type, content_url, stage_number, status, is_completed, created_at";

    private final JdbcTemplate jdbcTemplate;

    public LearningPathJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public LearningPath insertPath(LearningPath p) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO learning_paths(child_profile_id, title, description, current_stage, total_stages, progress_percentage, created_at, last_updated) VALUES (?,?,?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, p.childProfileId());
            ps.setString(2, p.title());
            ps.setString(3, p.description());
            ps.setInt(4, p.currentStage());
            ps.setInt(5, p.totalStages());
            ps.setInt(6, p.progressPercentage());
            ps.setString(7, p.createdAt().toString());
            ps.setString(8, p.lastUpdated().toString());
            return ps;
        }, keys);
        long id = Objects.requireNonNull(keys.getKey(), "no generated key for learning path").longValue();
        return new LearningPath(id, p.childProfileId(), p.title(), p.description(), p.currentStage(), p.totalStages(),
                p.progressPercentage(), p.createdAt(), p.lastUpdated());
    }

    public PathActivity insertActivity(PathActivity a) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO path_activities(learning_path_id, title, description, activity_type, content_url, stage_number, status, is_completed, created_at) VALUES (?,?,?,?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, a.learningPathId());
            ps.setString(2, a.title());
            ps.setString(3, a.description());
            ps.setString(4, a.activityType().wireName());
            if (a.contentUrl() == null) ps.setNull(5, Types.VARCHAR); else ps.setString(5, a.contentUrl());
            ps.setInt(6, a.stageNumber());
            ps.setString(7, a.status().wireName());
            ps.setBoolean(8, a.completed());
            ps.setString(9, a.createdAt().toString());
            return ps;
        }, keys);
        long id = Objects.requireNonNull(keys.getKey(), "no generated key for path activity").longValue();
        return new PathActivity(id, a.learningPathId(), a.title(), a.description(), a.activityType(), a.contentUrl(),
                a.stageNumber(), a.status(), a.completed(), a.createdAt());
    }

    public Optional<LearningPath> findPath(long id) {
        return jdbcTemplate.query("SELECT " + PATH_COLUMNS + " FROM learning_paths WHERE id=?",
                (rs, n) -> mapPath(rs), id).stream().findFirst();
    }

    public List<LearningPath> findPathsByProfile(long childProfileId) {
        return jdbcTemplate.query("SELECT " + PATH_COLUMNS + " FROM learning_paths WHERE child_profile_id=? ORDER BY id",
                (rs, n) -> mapPath(rs), childProfileId);
    }

    public Optional<PathActivity> findActivity(long id) {
        return jdbcTemplate.query("SELECT " + ACTIVITY_COLUMNS + " FROM path_activities WHERE id=?",
                (rs, n) -> mapActivity(rs), id).stream().findFirst();
    }

    public List<PathActivity> findActivitiesByPath(long learningPathId) {
        return jdbcTemplate.query("SELECT " + ACTIVITY_COLUMNS + " FROM path_activities WHERE learning_path_id=? ORDER BY stage_number, id",
                (rs, n) -> mapActivity(rs), learningPathId);
    }

    public long countActivities(long learningPathId) {
        Long value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM path_activities WHERE learning_path_id=?", Long.class, learningPathId);
        return value == null ? 0 : value;
    }

    public long countCompletedActivities(long learningPathId) {
        Long value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM path_activities WHERE learning_path_id=? AND is_completed=TRUE", Long.class, learningPathId);
        return value == null ? 0 : value;
    }

    public void updateActivityState(long activityId, ActivityStatus status, boolean completed) {
        jdbcTemplate.update("UPDATE path_activities SET status=?, is_completed=? WHERE id=?",
                status.wireName(), completed, activityId);
    }

    public void updatePathProgress(long pathId, int currentStage, int progressPercentage, Instant lastUpdated) {
        jdbcTemplate.update("UPDATE learning_paths SET current_stage=?, progress_percentage=?, last_updated=? WHERE id=?",
                currentStage, progressPercentage, lastUpdated.toString(), pathId);
    }

    private static LearningPath mapPath(ResultSet rs) throws SQLException {
        return new LearningPath(rs.getLong(1), rs.getLong(2), rs.getString(3), rs.getString(4),
                rs.getInt(5), rs.getInt(6), rs.getInt(7),
                Instant.parse(rs.getString(8)), Instant.parse(rs.getString(9)));
    }

    private static PathActivity mapActivity(ResultSet rs) throws SQLException {
        String rawStatus = rs.getString(8);
        ActivityStatus status = ActivityStatus.fromWire(rawStatus)
                .orElseThrow(() -> new SQLException("Unknown activity status in row: " + rawStatus));
        return new PathActivity(rs.getLong(1), rs.getLong(2), rs.getString(3), rs.getString(4),
                ActivityType.fromWire(rs.getString(5)), rs.getString(6), rs.getInt(7),
                status, rs.getBoolean(9), Instant.parse(rs.getString(10)));
    }
}
