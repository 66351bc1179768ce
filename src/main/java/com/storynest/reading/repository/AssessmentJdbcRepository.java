package com.storynest.reading.repository;

import com.storynest.reading.domain.DomainModels.ProgressAssessment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Repository
public class AssessmentJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AssessmentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public ProgressAssessment insert(ProgressAssessment a) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO progress_assessments(child_profile_id, assessment_date, reading_level, reading_fluency_score, comprehension_score, vocabulary_score, notes) VALUES (?,?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, a.childProfileId());
            ps.setString(2, a.assessmentDate().toString());
            ps.setString(3, a.readingLevel());
            ps.setObject(4, a.readingFluencyScore());
            ps.setObject(5, a.comprehensionScore());
            ps.setObject(6, a.vocabularyScore());
            ps.setString(7, a.notes());
            return ps;
        }, keys);
        long id = Objects.requireNonNull(keys.getKey(), "no generated key for assessment").longValue();
        return new ProgressAssessment(id, a.childProfileId(), a.assessmentDate(), a.readingLevel(),
                a.readingFluencyScore(), a.comprehensionScore(), a.vocabularyScore(), a.notes());
    }

    public List<ProgressAssessment> findByProfile(long childProfileId) {
        return jdbcTemplate.query(
                "SELECT id, child_profile_id, assessment_date, reading_level, reading_fluency_score, comprehension_score, vocabulary_score, notes " +
                        "FROM progress_assessments WHERE child_profile_id=? ORDER BY id DESC",
                (rs, n) -> new ProgressAssessment(rs.getLong(1), rs.getLong(2), Instant.parse(rs.getString(3)), rs.getString(4),
                        (Integer) rs.getObject(5), (Integer) rs.getObject(6), (Integer) rs.getObject(7), rs.getString(8)),
                childProfileId);
    }
}
