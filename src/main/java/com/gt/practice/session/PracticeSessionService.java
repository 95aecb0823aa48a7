package com.gt.practice.session;

import com.gt.practice.composer.Composition;
import com.gt.practice.composer.SessionComposer;
import com.gt.practice.content.ContentService;
import com.gt.practice.evaluation.AnswerEvaluationEngine;
import com.gt.practice.exception.ConflictException;
import com.gt.practice.exception.RecordNotFoundException;
import com.gt.practice.exception.StorageException;
import com.gt.practice.model.*;
import com.gt.practice.model.submission.Submission;
import com.gt.practice.schedule.SchedulingRecordService;
import com.gt.practice.schedule.SpacedRepetitionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs practice sessions against the store. Loads what a session needs, hands every command to the session's
 * {@link PracticeSessionStateMachine}, then writes back the scheduling records and the session projection the command
 * produced.
 * <p>
 * Commands for the same session are serialized on its state machine. Writes are at least once: anything the store did
 * not acknowledge stays queued on the machine, is retried by the next command or by {@link #sync(String)}, and a
 * {@link StorageException} is raised to the caller in the meantime.
 */
@Component
public class PracticeSessionService {

    private static final Logger log = LoggerFactory.getLogger(PracticeSessionService.class);

    public static final int MAX_RECENT_SESSIONS = 50;

    private final ContentService contentService;
    private final SchedulingRecordService schedulingRecordService;
    private final PracticeSessionDao practiceSessionDao;
    private final SessionComposer sessionComposer;
    private final SpacedRepetitionScheduler scheduler;
    private final AnswerEvaluationEngine evaluationEngine;
    private final ActiveSessionRegistry activeSessionRegistry;
    private final Random random;

    public PracticeSessionService(ContentService contentService,
                                  SchedulingRecordService schedulingRecordService,
                                  PracticeSessionDao practiceSessionDao,
                                  SessionComposer sessionComposer,
                                  SpacedRepetitionScheduler scheduler,
                                  AnswerEvaluationEngine evaluationEngine,
                                  ActiveSessionRegistry activeSessionRegistry,
                                  Random random) {
        this.contentService = contentService;
        this.schedulingRecordService = schedulingRecordService;
        this.practiceSessionDao = practiceSessionDao;
        this.sessionComposer = sessionComposer;
        this.scheduler = scheduler;
        this.evaluationEngine = evaluationEngine;
        this.activeSessionRegistry = activeSessionRegistry;
        this.random = random;
    }

    public CreatedSession createSession(String learnerId, SessionConfiguration configuration, Instant now) {
        if (configuration.targetCount() <= 0) {
            throw new IllegalArgumentException("Target count must be positive, was " + configuration.targetCount());
        }

        List<ContentItem> pool = contentService.loadPool(configuration.topicId(), configuration.learningPathIds());
        Map<String, SchedulingRecord> records = schedulingRecordService.loadRecords(learnerId,
                pool.stream().map(ContentItem::id).toList());

        Composition composition;
        synchronized (random) {
            composition = sessionComposer.compose(pool, records, configuration, now, random);
        }

        if (composition.taskIds().isEmpty()) {
            // a session without tasks could never be started, so none is stored
            log.info("Nothing to practice for learner {} in topic {}, no session created", learnerId, configuration.topicId());
            return new CreatedSession(null, composition);
        }

        Set<String> taskIds = new HashSet<>(composition.taskIds());
        Map<String, ContentItem> items = pool.stream()
                .filter(item -> taskIds.contains(item.id()))
                .collect(Collectors.toMap(ContentItem::id, Function.identity(), (first, second) -> first));

        PracticeSession session = PracticeSession.create(UUID.randomUUID().toString(), learnerId, configuration, composition.taskIds(), now);

        try {
            practiceSessionDao.createSession(session);
        } catch (DataAccessException ex) {
            String errMsg = "Unable to create session for learner " + learnerId;
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }

        PracticeSessionStateMachine machine = activeSessionRegistry.register(
                PracticeSessionStateMachine.create(session, items, records, scheduler, evaluationEngine), now);

        log.info("Created session {} for learner {} with {} due and {} new tasks", session.id(), learnerId,
                composition.dueCount(), composition.newCount());

        return new CreatedSession(machine.getSnapshot(), composition);
    }

    public SessionSnapshot start(String sessionId, Instant now) {
        PracticeSessionStateMachine machine = getMachine(sessionId, now);
        synchronized (machine) {
            machine.start(now);
            return persist(machine);
        }
    }

    public SessionSnapshot submitAnswer(String sessionId, Submission submission, Instant now) {
        PracticeSessionStateMachine machine = getMachine(sessionId, now);
        synchronized (machine) {
            machine.submitAnswer(submission, now);
            return persist(machine);
        }
    }

    public SessionSnapshot skip(String sessionId, Instant now) {
        PracticeSessionStateMachine machine = getMachine(sessionId, now);
        synchronized (machine) {
            machine.skip(now);
            return persist(machine);
        }
    }

    public SessionSnapshot advance(String sessionId, Instant now) {
        PracticeSessionStateMachine machine = getMachine(sessionId, now);
        synchronized (machine) {
            machine.advance(now);
            return persist(machine);
        }
    }

    public SessionSnapshot toggleHint(String sessionId, Instant now) {
        PracticeSessionStateMachine machine = getMachine(sessionId, now);
        synchronized (machine) {
            machine.toggleHint();
            return persist(machine);
        }
    }

    public SessionSnapshot cancel(String sessionId, Instant now) {
        PracticeSessionStateMachine machine = getMachine(sessionId, now);
        synchronized (machine) {
            machine.cancel(now);
            return persist(machine);
        }
    }

    public SessionSnapshot finish(String sessionId, Instant now) {
        PracticeSessionStateMachine machine = getMachine(sessionId, now);
        synchronized (machine) {
            machine.finish(now);
            return persist(machine);
        }
    }

    // Retries writes left over from an earlier failure. Nothing is graded again.
    public SessionSnapshot sync(String sessionId, Instant now) {
        PracticeSessionStateMachine machine = getMachine(sessionId, now);
        synchronized (machine) {
            return persist(machine);
        }
    }

    public SessionSnapshot getSnapshot(String sessionId, Instant now) {
        PracticeSessionStateMachine machine = getMachine(sessionId, now);
        synchronized (machine) {
            return machine.getSnapshot();
        }
    }

    public Optional<SessionSnapshot> getActiveSession(String learnerId, Instant now) {
        Optional<PracticeSession> session;
        try {
            session = practiceSessionDao.loadActiveSession(learnerId);
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load active session for learner " + learnerId;
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }

        return session.map(activeSession -> getSnapshot(activeSession.id(), now));
    }

    // Most recently touched sessions of the learner as stored, newest first
    public List<PracticeSession> getRecentSessions(String learnerId, int limit) {
        if (limit <= 0 || limit > MAX_RECENT_SESSIONS) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_RECENT_SESSIONS + ", was " + limit);
        }

        try {
            return practiceSessionDao.loadRecentSessions(learnerId, limit);
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load recent sessions for learner " + learnerId;
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }
    }

    // Record writes are flushed only after the session passed its version check
    private SessionSnapshot persist(PracticeSessionStateMachine machine) {
        PracticeSession session = machine.getSession();

        if (machine.isSessionDirty()) {
            long expectedVersion = session.version();

            int rowsUpdated;
            try {
                rowsUpdated = practiceSessionDao.saveSession(session, expectedVersion);
            } catch (DataAccessException ex) {
                String errMsg = "Unable to save session " + session.id();
                log.error(errMsg, ex);
                throw new StorageException(errMsg, ex);
            }

            if (rowsUpdated == 0) {
                // the stored copy moved on; drop ours so the next request reloads it
                activeSessionRegistry.remove(session.id(), machine);

                String errMsg = "Session " + session.id() + " was modified since version " + expectedVersion;
                log.warn(errMsg);
                throw new ConflictException(errMsg);
            }

            machine.acknowledgeSessionWrite(expectedVersion + 1);
        }

        for (SchedulingRecord record : machine.getPendingRecordWrites().values()) {
            schedulingRecordService.saveRecord(session.learnerId(), record);
            machine.acknowledgeRecordWrite(record);
        }

        if (machine.isFinished() && !machine.hasPendingWrites()) {
            activeSessionRegistry.remove(session.id(), machine);
        }

        return machine.getSnapshot();
    }

    private PracticeSessionStateMachine getMachine(String sessionId, Instant now) {
        Optional<PracticeSessionStateMachine> active = activeSessionRegistry.get(sessionId, now);
        if (active.isPresent()) {
            return active.get();
        }

        PracticeSession session;
        try {
            session = practiceSessionDao.loadSession(sessionId)
                    .orElseThrow(() -> new RecordNotFoundException("No session with id " + sessionId));
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load session " + sessionId;
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }

        List<String> taskIds = session.execution().taskIds();
        Map<String, ContentItem> items = contentService.loadItems(taskIds);
        Map<String, SchedulingRecord> records = schedulingRecordService.loadRecords(session.learnerId(), taskIds);

        PracticeSessionStateMachine machine = PracticeSessionStateMachine.restore(session, items, records, scheduler, evaluationEngine, now);
        if (session.status().isFinal()) {
            // finished sessions are read only, there is nothing to keep in memory
            return machine;
        }

        log.info("Restored session {} at task {} of {}", sessionId, session.execution().currentTaskIndex(), taskIds.size());

        return activeSessionRegistry.register(machine, now);
    }
}
