package com.gt.practice.task;

import com.gt.practice.session.ActiveSessionRegistry;
import com.gt.practice.session.PracticeSessionDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class SessionMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceTask.class);

    private static final long IDLE_EVICT_SCHEDULE_MS = 5 * 60 * 1000;

    private final PracticeSessionDao practiceSessionDao;
    private final ActiveSessionRegistry activeSessionRegistry;
    private final int purgeSessionsAfterDays;
    private final int purgeUnstartedAfterDays;
    private final int evictIdleAfterMinutes;

    public SessionMaintenanceTask(PracticeSessionDao practiceSessionDao,
                                  ActiveSessionRegistry activeSessionRegistry,
                                  @Value("${practice.maintenance.purgeAfterDays:90}") int purgeSessionsAfterDays,
                                  @Value("${practice.maintenance.purgeUnstartedAfterDays:7}") int purgeUnstartedAfterDays,
                                  @Value("${practice.maintenance.evictIdleAfterMinutes:30}") int evictIdleAfterMinutes) {
        this.practiceSessionDao = practiceSessionDao;
        this.activeSessionRegistry = activeSessionRegistry;
        this.purgeSessionsAfterDays = purgeSessionsAfterDays;
        this.purgeUnstartedAfterDays = purgeUnstartedAfterDays;
        this.evictIdleAfterMinutes = evictIdleAfterMinutes;
    }

    @Scheduled(cron = "@daily")
    public void performDatabaseMaintenance() {
        Instant now = Instant.now();

        purgeFinishedSessions(now);
        purgeUnstartedSessions(now);
    }

    @Scheduled(fixedDelay = IDLE_EVICT_SCHEDULE_MS, initialDelay = IDLE_EVICT_SCHEDULE_MS)
    public void performRegistryMaintenance() {
        evictIdleSessions(Instant.now());
    }

    void purgeFinishedSessions(Instant now) {
        Instant cutoff = now.minus(purgeSessionsAfterDays, ChronoUnit.DAYS);

        int rowsDeleted = practiceSessionDao.purgeFinishedSessions(cutoff);

        log.info("Purged finished practice sessions. {} rows deleted.", rowsDeleted);
    }

    void purgeUnstartedSessions(Instant now) {
        Instant cutoff = now.minus(purgeUnstartedAfterDays, ChronoUnit.DAYS);

        int rowsDeleted = practiceSessionDao.purgeUnstartedSessions(cutoff);

        log.info("Purged practice sessions that were never started. {} rows deleted.", rowsDeleted);
    }

    void evictIdleSessions(Instant now) {
        int evicted = activeSessionRegistry.evictIdle(now.minus(evictIdleAfterMinutes, ChronoUnit.MINUTES));

        if (evicted > 0) {
            log.info("Evicted {} idle sessions, {} still active.", evicted, activeSessionRegistry.size());
        }
    }
}
