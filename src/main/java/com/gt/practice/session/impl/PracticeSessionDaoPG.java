package com.gt.practice.session.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.practice.exception.MappingException;
import com.gt.practice.model.*;
import com.gt.practice.session.PracticeSessionDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class PracticeSessionDaoPG implements PracticeSessionDao {

    private static final Logger log = LoggerFactory.getLogger(PracticeSessionDaoPG.class);

    private static final String SESSION_COLUMNS =
            "id, learner_id, configuration, execution, results, version, created_at, updated_at ";

    private static final String CREATE_SESSION_SQL =
            "INSERT INTO practice_session " +
                    "(id, learner_id, status, configuration, execution, results, version, created_at, updated_at) " +
                    "VALUES (:id, :learnerId, :status, CAST(:configuration AS jsonb), CAST(:execution AS jsonb), CAST(:results AS jsonb), " +
                    ":version, :createdAt, :updatedAt)";

    private static final String SAVE_SESSION_SQL =
            "UPDATE practice_session " +
            "SET status = :status, execution = CAST(:execution AS jsonb), results = CAST(:results AS jsonb), " +
                    "version = :expectedVersion + 1, updated_at = :updatedAt " +
            "WHERE id = :id AND version = :expectedVersion";

    private static final String LOAD_SESSION_SQL =
            "SELECT " + SESSION_COLUMNS +
            "FROM practice_session " +
            "WHERE id = :id";

    private static final String LOAD_ACTIVE_SESSION_SQL =
            "SELECT " + SESSION_COLUMNS +
            "FROM practice_session " +
            "WHERE learner_id = :learnerId AND status IN ('not-started', 'in-progress') " +
            "ORDER BY updated_at DESC LIMIT 1";

    private static final String LOAD_RECENT_SESSIONS_SQL =
            "SELECT " + SESSION_COLUMNS +
            "FROM practice_session " +
            "WHERE learner_id = :learnerId " +
            "ORDER BY updated_at DESC LIMIT :limit";

    private static final String PURGE_FINISHED_SESSIONS_SQL =
            "DELETE FROM practice_session WHERE status IN ('completed', 'cancelled') AND updated_at < :cutoff";

    private static final String PURGE_UNSTARTED_SESSIONS_SQL =
            "DELETE FROM practice_session WHERE status = 'not-started' AND updated_at < :cutoff";

    private final NamedParameterJdbcTemplate template;
    private final ObjectMapper objectMapper;

    public PracticeSessionDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        this.template = namedParameterJdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void createSession(PracticeSession session) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", session.id())
                .addValue("learnerId", session.learnerId())
                .addValue("status", session.status().getCode())
                .addValue("configuration", toJson(session.id(), session.configuration()))
                .addValue("execution", toJson(session.id(), session.execution()))
                .addValue("results", toJson(session.id(), session.results()))
                .addValue("version", session.version())
                .addValue("createdAt", Timestamp.from(session.createdAt()))
                .addValue("updatedAt", Timestamp.from(session.updatedAt()));

        template.update(CREATE_SESSION_SQL, params);
    }

    @Override
    public int saveSession(PracticeSession session, long expectedVersion) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", session.id())
                .addValue("status", session.status().getCode())
                .addValue("execution", toJson(session.id(), session.execution()))
                .addValue("results", toJson(session.id(), session.results()))
                .addValue("expectedVersion", expectedVersion)
                .addValue("updatedAt", Timestamp.from(session.updatedAt()));

        return template.update(SAVE_SESSION_SQL, params);
    }

    @Override
    public Optional<PracticeSession> loadSession(String sessionId) {
        List<PracticeSession> sessions = template.query(LOAD_SESSION_SQL, Map.of("id", sessionId), this::getSessionFromResultSet);

        return sessions.stream().findFirst();
    }

    @Override
    public Optional<PracticeSession> loadActiveSession(String learnerId) {
        List<PracticeSession> sessions = template.query(LOAD_ACTIVE_SESSION_SQL, Map.of("learnerId", learnerId), this::getSessionFromResultSet);

        return sessions.stream().findFirst();
    }

    @Override
    public List<PracticeSession> loadRecentSessions(String learnerId, int limit) {
        return template.query(LOAD_RECENT_SESSIONS_SQL, Map.of("learnerId", learnerId, "limit", limit), this::getSessionFromResultSet);
    }

    @Override
    public int purgeFinishedSessions(Instant cutoff) {
        return template.update(PURGE_FINISHED_SESSIONS_SQL, Map.of("cutoff", Timestamp.from(cutoff)));
    }

    @Override
    public int purgeUnstartedSessions(Instant cutoff) {
        return template.update(PURGE_UNSTARTED_SESSIONS_SQL, Map.of("cutoff", Timestamp.from(cutoff)));
    }

    private String toJson(String sessionId, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Unable to serialize " + value.getClass().getSimpleName() + " of session " + sessionId, ex);
        }
    }

    private <T> T fromJson(String sessionId, String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            String errMsg = "Unable to read " + type.getSimpleName() + " of session " + sessionId;
            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }
    }

    private PracticeSession getSessionFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        String id = rs.getString("id");
        String results = rs.getString("results");

        return new PracticeSession(
                id,
                rs.getString("learner_id"),
                fromJson(id, rs.getString("configuration"), SessionConfiguration.class),
                fromJson(id, rs.getString("execution"), SessionExecution.class),
                results == null ? SessionResults.EMPTY : fromJson(id, results, SessionResults.class),
                rs.getLong("version"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
