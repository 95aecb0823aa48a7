package com.gt.practice.session;

import com.gt.practice.evaluation.AnswerEvaluationEngine;
import com.gt.practice.exception.InvalidTransitionException;
import com.gt.practice.model.*;
import com.gt.practice.model.submission.Submission;
import com.gt.practice.schedule.QualityMapper;
import com.gt.practice.schedule.SpacedRepetitionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Progress of a single practice session. Owns the session projection, the per-task micro state (presented or answered)
 * and hint visibility, and queues the scheduling record updates produced by graded answers until the store confirms
 * them.
 * <p>
 * Instances are not thread safe; the caller must serialize commands for a session. Every command validates its
 * preconditions before changing anything, so a rejected command ({@link InvalidTransitionException}) leaves the machine
 * exactly as it was.
 */
public class PracticeSessionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PracticeSessionStateMachine.class);

    private final Map<String, ContentItem> items;
    private final Map<String, SchedulingRecord> records;
    private final SpacedRepetitionScheduler scheduler;
    private final AnswerEvaluationEngine evaluationEngine;

    private final Map<String, SchedulingRecord> pendingRecordWrites = new LinkedHashMap<>();

    private PracticeSession session;
    private TaskState taskState;
    private boolean hintVisible;
    private boolean hintUsed;
    private EvaluationResult lastEvaluation;
    private Instant presentedAt;
    private boolean sessionDirty;

    private PracticeSessionStateMachine(PracticeSession session,
                                        Map<String, ContentItem> items,
                                        Map<String, SchedulingRecord> records,
                                        SpacedRepetitionScheduler scheduler,
                                        AnswerEvaluationEngine evaluationEngine) {
        for (String taskId : session.execution().taskIds()) {
            if (!items.containsKey(taskId)) {
                throw new IllegalArgumentException("Session " + session.id() + " refers to unknown item " + taskId);
            }
        }

        this.session = session;
        this.items = Map.copyOf(items);
        this.records = new HashMap<>(records);
        this.scheduler = scheduler;
        this.evaluationEngine = evaluationEngine;
    }

    public static PracticeSessionStateMachine create(PracticeSession session,
                                                     Map<String, ContentItem> items,
                                                     Map<String, SchedulingRecord> records,
                                                     SpacedRepetitionScheduler scheduler,
                                                     AnswerEvaluationEngine evaluationEngine) {
        if (session.status() != SessionStatus.NotStarted) {
            throw new IllegalArgumentException("Session " + session.id() + " has already been started");
        }

        return new PracticeSessionStateMachine(session, items, records, scheduler, evaluationEngine);
    }

    // Rebuilds a machine from a stored session. A task that already has an outcome at the cursor is resumed as answered.
    public static PracticeSessionStateMachine restore(PracticeSession session,
                                                      Map<String, ContentItem> items,
                                                      Map<String, SchedulingRecord> records,
                                                      SpacedRepetitionScheduler scheduler,
                                                      AnswerEvaluationEngine evaluationEngine,
                                                      Instant now) {
        PracticeSessionStateMachine machine = new PracticeSessionStateMachine(session, items, records, scheduler, evaluationEngine);

        if (session.status() == SessionStatus.InProgress) {
            machine.taskState = session.execution().isCurrentTaskResolved() ? TaskState.Answered : TaskState.Presented;
            machine.presentedAt = now;
        }

        return machine;
    }

    public SessionSnapshot start(Instant now) {
        requireStatus(SessionStatus.NotStarted, "start");
        if (session.execution().taskIds().isEmpty()) {
            throw new InvalidTransitionException("Session " + session.id() + " has no tasks to practice");
        }

        session = session.withExecution(session.execution().started(now), now);
        presentTask(now);
        sessionDirty = true;

        log.info("Started session {} with {} tasks", session.id(), session.execution().taskIds().size());

        return getSnapshot();
    }

    public SessionSnapshot submitAnswer(Submission submission, Instant now) {
        requireStatus(SessionStatus.InProgress, "submitAnswer");
        if (taskState == TaskState.Answered) {
            // second submit for the same task, e.g. a double tap
            log.debug("Ignoring repeated submission for task {} of session {}", session.execution().currentTaskIndex(), session.id());
            return getSnapshot();
        }

        ContentItem item = currentItem();
        EvaluationResult result = evaluationEngine.evaluate(item, submission, elapsedMs(now));

        SchedulingRecord current = records.get(item.id());
        if (current == null) {
            current = scheduler.newRecord(item.id(), now);
        }
        SchedulingRecord next = scheduler.update(current, QualityMapper.fromEvaluation(item.variant(), result), now);

        records.put(item.id(), next);
        pendingRecordWrites.put(item.id(), next);

        session = session.withExecution(session.execution().withAnswer(TaskOutcome.answered(item, result, hintUsed)), now);
        lastEvaluation = result;
        taskState = TaskState.Answered;
        hintVisible = false;
        sessionDirty = true;

        return getSnapshot();
    }

    public SessionSnapshot skip(Instant now) {
        requireStatus(SessionStatus.InProgress, "skip");
        requireTaskState(TaskState.Presented, "skip");

        ContentItem item = currentItem();
        session = session.withExecution(session.execution().withSkip(TaskOutcome.skipped(item, elapsedMs(now), hintUsed)), now);
        sessionDirty = true;

        moveToNextTask(now);

        return getSnapshot();
    }

    public SessionSnapshot advance(Instant now) {
        requireStatus(SessionStatus.InProgress, "advance");
        requireTaskState(TaskState.Answered, "advance");

        moveToNextTask(now);
        sessionDirty = true;

        return getSnapshot();
    }

    public SessionSnapshot toggleHint() {
        requireStatus(SessionStatus.InProgress, "toggleHint");
        requireTaskState(TaskState.Presented, "toggleHint");

        hintVisible = !hintVisible;
        if (hintVisible) {
            hintUsed = true;
        }

        return getSnapshot();
    }

    // Cancelling keeps whatever results were last computed; they are not finalized
    public SessionSnapshot cancel(Instant now) {
        requireStatus(SessionStatus.InProgress, "cancel");

        session = session.withExecution(session.execution().finished(SessionStatus.Cancelled, now), now);
        clearTask();
        sessionDirty = true;

        log.info("Cancelled session {} after {} of {} tasks", session.id(),
                session.execution().outcomes().size(), session.execution().taskIds().size());

        return getSnapshot();
    }

    public SessionSnapshot finish(Instant now) {
        requireStatus(SessionStatus.InProgress, "finish");

        finalizeSession(now);

        return getSnapshot();
    }

    public SessionSnapshot getSnapshot() {
        return new SessionSnapshot(
                session.id(),
                session.execution(),
                session.results(),
                taskState == null ? null : currentItem(),
                taskState,
                hintVisible,
                lastEvaluation,
                hasPendingWrites());
    }

    public PracticeSession getSession() {
        return session;
    }

    public Map<String, SchedulingRecord> getPendingRecordWrites() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(pendingRecordWrites));
    }

    public void acknowledgeRecordWrite(SchedulingRecord record) {
        pendingRecordWrites.remove(record.itemId(), record);
    }

    public boolean isSessionDirty() {
        return sessionDirty;
    }

    public void acknowledgeSessionWrite(long newVersion) {
        session = session.withVersion(newVersion);
        sessionDirty = false;
    }

    public boolean hasPendingWrites() {
        return sessionDirty || !pendingRecordWrites.isEmpty();
    }

    public boolean isFinished() {
        return session.status().isFinal();
    }

    private void moveToNextTask(Instant now) {
        SessionExecution execution = session.execution();
        if (execution.isLastTask()) {
            finalizeSession(now);
        } else {
            session = session.withExecution(execution.atTask(execution.currentTaskIndex() + 1), now);
            presentTask(now);
        }
    }

    private void finalizeSession(Instant now) {
        SessionExecution finished = session.execution().finished(SessionStatus.Completed, now);
        session = session.withExecution(finished, now).withResults(SessionResults.fromExecution(finished));
        clearTask();
        sessionDirty = true;

        log.info("Completed session {}: {} answered, {} correct, {} skipped", session.id(),
                finished.completedCount(), finished.correctCount(), finished.skippedCount());
    }

    private void presentTask(Instant now) {
        taskState = TaskState.Presented;
        hintVisible = false;
        hintUsed = false;
        lastEvaluation = null;
        presentedAt = now;
    }

    private void clearTask() {
        taskState = null;
        hintVisible = false;
        hintUsed = false;
        presentedAt = null;
    }

    private ContentItem currentItem() {
        return items.get(session.execution().currentTaskId());
    }

    private long elapsedMs(Instant now) {
        if (presentedAt == null) {
            return 0;
        }
        return Math.max(0, Duration.between(presentedAt, now).toMillis());
    }

    private void requireStatus(SessionStatus required, String command) {
        if (session.status() != required) {
            throw new InvalidTransitionException("Cannot " + command + " session " + session.id() + " while it is "
                    + session.status().getCode());
        }
    }

    private void requireTaskState(TaskState required, String command) {
        if (taskState != required) {
            throw new InvalidTransitionException("Cannot " + command + " task " + session.execution().currentTaskIndex()
                    + " of session " + session.id() + " while it is " + taskState);
        }
    }
}
