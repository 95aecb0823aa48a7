package com.gt.practice.schedule.impl;

import com.gt.practice.model.SchedulingRecord;
import com.gt.practice.schedule.SchedulingRecordDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class SchedulingRecordDaoPG implements SchedulingRecordDao {

    private static final String LOAD_RECORDS_SQL =
            "SELECT item_id, ease_factor, repetition_count, interval_days, next_due_at, last_reviewed_at, total_reviews, lapse_count " +
            "FROM scheduling_record " +
            "WHERE learner_id = :learnerId AND item_id IN (:itemIds)";

    private static final String LOAD_ALL_RECORDS_SQL =
            "SELECT item_id, ease_factor, repetition_count, interval_days, next_due_at, last_reviewed_at, total_reviews, lapse_count " +
            "FROM scheduling_record " +
            "WHERE learner_id = :learnerId";

    private static final String SAVE_RECORD_SQL =
            "INSERT INTO scheduling_record " +
                    "(learner_id, item_id, ease_factor, repetition_count, interval_days, next_due_at, last_reviewed_at, total_reviews, lapse_count) " +
                    "VALUES (:learnerId, :itemId, :easeFactor, :repetitionCount, :intervalDays, :nextDueAt, :lastReviewedAt, :totalReviews, :lapseCount) " +
            "ON CONFLICT (learner_id, item_id) DO UPDATE " +
                    "SET ease_factor = :easeFactor, repetition_count = :repetitionCount, interval_days = :intervalDays, " +
                    "next_due_at = :nextDueAt, last_reviewed_at = :lastReviewedAt, total_reviews = :totalReviews, lapse_count = :lapseCount";

    private final NamedParameterJdbcTemplate template;

    public SchedulingRecordDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<SchedulingRecord> loadRecords(String learnerId, Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_RECORDS_SQL, Map.of("learnerId", learnerId, "itemIds", itemIds),
                SchedulingRecordDaoPG::getSchedulingRecordFromResultSet);
    }

    @Override
    public List<SchedulingRecord> loadAllRecords(String learnerId) {
        return template.query(LOAD_ALL_RECORDS_SQL, Map.of("learnerId", learnerId),
                SchedulingRecordDaoPG::getSchedulingRecordFromResultSet);
    }

    @Override
    public void saveRecord(String learnerId, SchedulingRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("learnerId", learnerId)
                .addValue("itemId", record.itemId())
                .addValue("easeFactor", record.easeFactor())
                .addValue("repetitionCount", record.repetitionCount())
                .addValue("intervalDays", record.intervalDays())
                .addValue("nextDueAt", Timestamp.from(record.nextDueAt()))
                .addValue("lastReviewedAt", record.lastReviewedAt() == null ? null : Timestamp.from(record.lastReviewedAt()))
                .addValue("totalReviews", record.totalReviews())
                .addValue("lapseCount", record.lapseCount());

        template.update(SAVE_RECORD_SQL, params);
    }

    private static SchedulingRecord getSchedulingRecordFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new SchedulingRecord(
                rs.getString("item_id"),
                rs.getDouble("ease_factor"),
                rs.getInt("repetition_count"),
                rs.getInt("interval_days"),
                toInstant(rs.getTimestamp("next_due_at")),
                toInstant(rs.getTimestamp("last_reviewed_at")),
                rs.getInt("total_reviews"),
                rs.getInt("lapse_count"));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
