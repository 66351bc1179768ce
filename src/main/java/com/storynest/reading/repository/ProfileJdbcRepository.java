package com.storynest.reading.repository;

import com.storynest.reading.domain.DomainModels.ChildProfile;
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
public class ProfileJdbcRepository {
    private static final String COLUMNS = "id, owner_user_id, name, age, reading_level, avatar_url, created_at";

    private final JdbcTemplate jdbcTemplate;

    public ProfileJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public ChildProfile insert(ChildProfile p) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO child_profiles(owner_user_id, name, age, reading_level, avatar_url, created_at) VALUES (?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, p.ownerUserId());
            ps.setString(2, p.name());
            ps.setInt(3, p.age());
            ps.setString(4, p.readingLevel());
            if (p.avatarUrl() == null) ps.setNull(5, Types.VARCHAR); else ps.setString(5, p.avatarUrl());
            ps.setString(6, p.createdAt().toString());
            return ps;
        }, keys);
        long id = Objects.requireNonNull(keys.getKey(), "no generated key for child profile").longValue();
        return new ChildProfile(id, p.ownerUserId(), p.name(), p.age(), p.readingLevel(), p.avatarUrl(), p.createdAt());
    }

    public Optional<ChildProfile> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM child_profiles WHERE id=?",
                (rs, n) -> map(rs), id).stream().findFirst();
    }

    public List<ChildProfile> findByOwner(long ownerUserId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM child_profiles WHERE owner_user_id=? ORDER BY id",
                (rs, n) -> map(rs), ownerUserId);
    }

    public void updateReadingLevel(long id, String readingLevel) {
        jdbcTemplate.update("UPDATE child_profiles SET reading_level=? WHERE id=?", readingLevel, id);
    }

    private static ChildProfile map(ResultSet rs) throws SQLException {
        return new ChildProfile(rs.getLong(1), rs.getLong(2), rs.getString(3), rs.getInt(4), rs.getString(5),
                rs.getString(6), Instant.parse(rs.getString(7)));
    }
}
