package com.gt.practice.schedule;

import com.gt.practice.exception.RecordNotFoundException;
import com.gt.practice.exception.StorageException;
import com.gt.practice.model.ReviewForecast;
import com.gt.practice.model.SchedulingRecord;
import com.gt.practice.model.SchedulingStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class SchedulingRecordService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingRecordService.class);

    private static final int MAX_FORECAST_DAYS = 365;

    private final SchedulingRecordDao schedulingRecordDao;

    public SchedulingRecordService(SchedulingRecordDao schedulingRecordDao) {
        this.schedulingRecordDao = schedulingRecordDao;
    }

    public Map<String, SchedulingRecord> loadRecords(String learnerId, Collection<String> itemIds) {
        try {
            return schedulingRecordDao.loadRecords(learnerId, new HashSet<>(itemIds)).stream()
                    .collect(Collectors.toMap(SchedulingRecord::itemId, Function.identity(), (first, second) -> first));
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load scheduling records for learner " + learnerId;
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }
    }

    public void saveRecord(String learnerId, SchedulingRecord record) {
        try {
            schedulingRecordDao.saveRecord(learnerId, record);
        } catch (DataAccessException ex) {
            String errMsg = "Unable to save scheduling record for item " + record.itemId() + " of learner " + learnerId;
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }
    }

    public List<ReviewForecast> getReviewForecast(String learnerId, int days, Instant now) {
        if (days <= 0 || days > MAX_FORECAST_DAYS) {
            throw new IllegalArgumentException("Forecast must cover between 1 and " + MAX_FORECAST_DAYS + " days, was " + days);
        }

        int[] dueCounts = new int[days];
        for (SchedulingRecord record : loadAllRecords(learnerId)) {
            long dayOffset = record.isDue(now) ? 0 : Duration.between(now, record.nextDueAt()).toDays();
            if (dayOffset < days) {
                dueCounts[(int) dayOffset]++;
            }
        }

        List<ReviewForecast> forecast = new ArrayList<>(days);
        for (int dayOffset = 0; dayOffset < days; dayOffset++) {
            forecast.add(new ReviewForecast(dayOffset, now.plus(Duration.ofDays(dayOffset)), dueCounts[dayOffset]));
        }

        return forecast;
    }

    public SchedulingStatistics getStatistics(String learnerId, Instant now) {
        List<SchedulingRecord> records = loadAllRecords(learnerId);
        if (records.isEmpty()) {
            return SchedulingStatistics.EMPTY;
        }

        int dueNow = (int) records.stream().filter(record -> record.isDue(now)).count();
        int graduated = (int) records.stream().filter(SchedulingRecord::isGraduated).count();
        double averageInterval = records.stream().mapToInt(SchedulingRecord::intervalDays).average().orElse(0);
        double averageAccuracy = records.stream()
                .map(SchedulingRecord::accuracy)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .average()
                .orElse(0);

        return new SchedulingStatistics(records.size(), dueNow, graduated, averageInterval, averageAccuracy);
    }

    // Moves an item's next review without touching its ease factor or repetition count
    public SchedulingRecord rescheduleItem(String learnerId, String itemId, Instant nextDueAt) {
        SchedulingRecord record = loadRecords(learnerId, List.of(itemId)).get(itemId);
        if (record == null) {
            throw new RecordNotFoundException("No scheduling record for item " + itemId + " of learner " + learnerId);
        }

        SchedulingRecord rescheduled = record.withNextDueAt(nextDueAt);
        saveRecord(learnerId, rescheduled);

        log.info("Rescheduled item {} of learner {} to {}", itemId, learnerId, nextDueAt);

        return rescheduled;
    }

    private List<SchedulingRecord> loadAllRecords(String learnerId) {
        try {
            return schedulingRecordDao.loadAllRecords(learnerId);
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load scheduling records for learner " + learnerId;
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }
    }
}
