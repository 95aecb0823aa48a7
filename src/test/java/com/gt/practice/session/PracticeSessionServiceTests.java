package com.gt.practice.session;

import com.gt.practice.composer.CompositionOrder;
import com.gt.practice.composer.SessionComposer;
import com.gt.practice.content.ContentService;
import com.gt.practice.evaluation.AnswerEvaluationEngine;
import com.gt.practice.exception.ConflictException;
import com.gt.practice.exception.InvalidTransitionException;
import com.gt.practice.exception.RecordNotFoundException;
import com.gt.practice.exception.StorageException;
import com.gt.practice.model.*;
import com.gt.practice.model.submission.OptionSubmission;
import com.gt.practice.model.submission.SelfAssessmentSubmission;
import com.gt.practice.schedule.SchedulingRecordService;
import com.gt.practice.schedule.SpacedRepetitionScheduler;
import com.gt.practice.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Fail.fail;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class PracticeSessionServiceTests {

    private static final String TEST_LEARNER_ID = "learner-1";
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private static final ContentItem TEST_ITEM_1 = TestUtils.multipleChoice("item-1");
    private static final ContentItem TEST_ITEM_2 = TestUtils.flashcard("item-2");
    private static final SessionConfiguration TEST_CONFIGURATION = new SessionConfiguration(
            TestUtils.TEST_TOPIC_ID, List.of(TestUtils.TEST_LEARNING_PATH_ID), 5, true);

    private PracticeSessionService practiceSessionService;
    private ActiveSessionRegistry activeSessionRegistry;

    @Mock private ContentService contentService;
    @Mock private SchedulingRecordService schedulingRecordService;
    @Mock private PracticeSessionDao practiceSessionDao;

    @BeforeEach
    public void setup() {
        activeSessionRegistry = new ActiveSessionRegistry();
        practiceSessionService = new PracticeSessionService(
                contentService,
                schedulingRecordService,
                practiceSessionDao,
                new SessionComposer(CompositionOrder.Stable),
                new SpacedRepetitionScheduler(),
                new AnswerEvaluationEngine(),
                activeSessionRegistry,
                new Random(42));

        when(contentService.loadPool(eq(TestUtils.TEST_TOPIC_ID), anyList())).thenReturn(List.of(TEST_ITEM_2, TEST_ITEM_1));
        when(contentService.loadItems(anyCollection())).thenReturn(Map.of(TEST_ITEM_1.id(), TEST_ITEM_1, TEST_ITEM_2.id(), TEST_ITEM_2));
        when(schedulingRecordService.loadRecords(eq(TEST_LEARNER_ID), anyCollection())).thenReturn(Map.of());
        when(practiceSessionDao.saveSession(any(), anyLong())).thenReturn(1);
    }

    @Test
    public void testCreateSession() {
        CreatedSession created = practiceSessionService.createSession(TEST_LEARNER_ID, TEST_CONFIGURATION, NOW);

        ArgumentCaptor<PracticeSession> sessionCaptor = ArgumentCaptor.forClass(PracticeSession.class);
        verify(practiceSessionDao).createSession(sessionCaptor.capture());
        PracticeSession session = sessionCaptor.getValue();

        assertEquals(TEST_LEARNER_ID, session.learnerId());
        assertEquals(List.of("item-1", "item-2"), session.execution().taskIds());
        assertEquals(SessionStatus.NotStarted, session.status());
        assertEquals(0, session.version());

        assertEquals(session.id(), created.snapshot().sessionId());
        assertTrue(created.composition().underflow());
        assertEquals(2, created.composition().newCount());
        assertEquals(1, activeSessionRegistry.size());
    }

    @Test
    public void testCreateSession_NothingToPractice() {
        when(contentService.loadPool(eq("empty-topic"), anyList())).thenReturn(List.of());

        CreatedSession created = practiceSessionService.createSession(TEST_LEARNER_ID,
                new SessionConfiguration("empty-topic", List.of(), 5, true), NOW);

        assertFalse(created.hasSession());
        assertNull(created.snapshot());
        assertTrue(created.composition().underflow());
        assertEquals(List.of(), created.composition().taskIds());
        verify(practiceSessionDao, never()).createSession(any());
        assertEquals(0, activeSessionRegistry.size());
    }

    @Test
    public void testCreateSession_InvalidTargetCount() {
        try {
            practiceSessionService.createSession(TEST_LEARNER_ID, new SessionConfiguration(TestUtils.TEST_TOPIC_ID, List.of(), 0, true), NOW);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException ex) {
            verify(practiceSessionDao, never()).createSession(any());
        }
    }

    @Test
    public void testCreateSession_StorageFailure() {
        doThrow(new DataAccessResourceFailureException("down")).when(practiceSessionDao).createSession(any());

        try {
            practiceSessionService.createSession(TEST_LEARNER_ID, TEST_CONFIGURATION, NOW);
            fail("Expected StorageException");
        } catch (StorageException ex) {
            assertEquals(0, activeSessionRegistry.size());
        }
    }

    @Test
    public void testStartAndSubmitAnswer() {
        String sessionId = practiceSessionService.createSession(TEST_LEARNER_ID, TEST_CONFIGURATION, NOW).snapshot().sessionId();

        practiceSessionService.start(sessionId, NOW);
        SessionSnapshot snapshot = practiceSessionService.submitAnswer(sessionId, new OptionSubmission("a"), NOW.plusSeconds(4));

        assertTrue(snapshot.lastEvaluation().correct());
        assertFalse(snapshot.syncPending());

        ArgumentCaptor<SchedulingRecord> recordCaptor = ArgumentCaptor.forClass(SchedulingRecord.class);
        verify(schedulingRecordService).saveRecord(eq(TEST_LEARNER_ID), recordCaptor.capture());
        assertEquals("item-1", recordCaptor.getValue().itemId());
        assertEquals(1, recordCaptor.getValue().repetitionCount());

        verify(practiceSessionDao).saveSession(any(), eq(0L));
        verify(practiceSessionDao).saveSession(any(), eq(1L));
    }

    @Test
    public void testConflictOnSave() {
        String sessionId = practiceSessionService.createSession(TEST_LEARNER_ID, TEST_CONFIGURATION, NOW).snapshot().sessionId();
        when(practiceSessionDao.saveSession(any(), anyLong())).thenReturn(0);

        try {
            practiceSessionService.start(sessionId, NOW);
            fail("Expected ConflictException");
        } catch (ConflictException ex) {
            assertEquals(0, activeSessionRegistry.size());
        }
    }

    @Test
    public void testConflictLeavesRecordsUnwritten() {
        String sessionId = practiceSessionService.createSession(TEST_LEARNER_ID, TEST_CONFIGURATION, NOW).snapshot().sessionId();
        practiceSessionService.start(sessionId, NOW);
        when(practiceSessionDao.saveSession(any(), anyLong())).thenReturn(0);

        try {
            practiceSessionService.submitAnswer(sessionId, new OptionSubmission("a"), NOW.plusSeconds(2));
            fail("Expected ConflictException");
        } catch (ConflictException ex) {
            verify(schedulingRecordService, never()).saveRecord(any(), any());
            assertEquals(0, activeSessionRegistry.size());
        }
    }

    @Test
    public void testIdleSessionEvictedThenRestored() {
        CreatedSession created = practiceSessionService.createSession(TEST_LEARNER_ID, TEST_CONFIGURATION, NOW);
        String sessionId = created.snapshot().sessionId();

        ArgumentCaptor<PracticeSession> sessionCaptor = ArgumentCaptor.forClass(PracticeSession.class);
        verify(practiceSessionDao).createSession(sessionCaptor.capture());
        when(practiceSessionDao.loadSession(sessionId)).thenReturn(Optional.of(sessionCaptor.getValue()));

        assertEquals(0, activeSessionRegistry.evictIdle(NOW));
        assertEquals(1, activeSessionRegistry.evictIdle(NOW.plusSeconds(60)));
        assertEquals(0, activeSessionRegistry.size());

        SessionSnapshot snapshot = practiceSessionService.start(sessionId, NOW.plusSeconds(120));

        assertEquals(SessionStatus.InProgress, snapshot.execution().status());
        assertEquals("item-1", snapshot.currentTask().id());
        verify(practiceSessionDao).loadSession(sessionId);
        assertEquals(1, activeSessionRegistry.size());
    }

    @Test
    public void testStorageFailureThenSync() {
        String sessionId = practiceSessionService.createSession(TEST_LEARNER_ID, TEST_CONFIGURATION, NOW).snapshot().sessionId();
        practiceSessionService.start(sessionId, NOW);

        doThrow(new StorageException("down")).doNothing().when(schedulingRecordService).saveRecord(eq(TEST_LEARNER_ID), any());

        try {
            practiceSessionService.submitAnswer(sessionId, new OptionSubmission("a"), NOW.plusSeconds(2));
            fail("Expected StorageException");
        } catch (StorageException ex) {
            // expected
        }

        SessionSnapshot pending = practiceSessionService.getSnapshot(sessionId, NOW.plusSeconds(3));
        assertTrue(pending.syncPending());
        assertEquals(TaskState.Answered, pending.taskState());
        assertEquals(1, pending.execution().completedCount());

        SessionSnapshot synced = practiceSessionService.sync(sessionId, NOW.plusSeconds(4));

        assertFalse(synced.syncPending());
        assertEquals(1, synced.execution().completedCount());

        ArgumentCaptor<SchedulingRecord> recordCaptor = ArgumentCaptor.forClass(SchedulingRecord.class);
        verify(schedulingRecordService, times(2)).saveRecord(eq(TEST_LEARNER_ID), recordCaptor.capture());
        assertEquals(recordCaptor.getAllValues().get(0), recordCaptor.getAllValues().get(1));
    }

    @Test
    public void testInvalidTransitionDoesNotWrite() {
        String sessionId = practiceSessionService.createSession(TEST_LEARNER_ID, TEST_CONFIGURATION, NOW).snapshot().sessionId();

        try {
            practiceSessionService.advance(sessionId, NOW);
            fail("Expected InvalidTransitionException");
        } catch (InvalidTransitionException ex) {
            verify(practiceSessionDao, never()).saveSession(any(), anyLong());
        }
    }

    @Test
    public void testFinishedSessionLeavesRegistry() {
        String sessionId = practiceSessionService.createSession(TEST_LEARNER_ID, TEST_CONFIGURATION, NOW).snapshot().sessionId();
        practiceSessionService.start(sessionId, NOW);
        practiceSessionService.submitAnswer(sessionId, new OptionSubmission("a"), NOW.plusSeconds(1));
        practiceSessionService.advance(sessionId, NOW.plusSeconds(2));
        practiceSessionService.submitAnswer(sessionId, new SelfAssessmentSubmission(false), NOW.plusSeconds(3));

        SessionSnapshot snapshot = practiceSessionService.advance(sessionId, NOW.plusSeconds(4));

        assertEquals(SessionStatus.Completed, snapshot.execution().status());
        assertEquals(0.5, snapshot.results().accuracy(), 1e-9);
        assertEquals(0, activeSessionRegistry.size());
    }

    @Test
    public void testRestoreFromStore() {
        PracticeSession stored = PracticeSession.create("stored-session", TEST_LEARNER_ID, TEST_CONFIGURATION, List.of("item-2", "item-1"), NOW);
        stored = stored.withExecution(stored.execution().started(NOW), NOW).withVersion(3);
        when(practiceSessionDao.loadSession("stored-session")).thenReturn(Optional.of(stored));

        SessionSnapshot snapshot = practiceSessionService.submitAnswer("stored-session", new SelfAssessmentSubmission(true), NOW.plusSeconds(5));

        assertEquals("item-2", snapshot.currentTask().id());
        assertTrue(snapshot.lastEvaluation().correct());
        verify(practiceSessionDao).saveSession(any(), eq(3L));
        assertEquals(1, activeSessionRegistry.size());
    }

    @Test
    public void testUnknownSession() {
        when(practiceSessionDao.loadSession("missing")).thenReturn(Optional.empty());

        try {
            practiceSessionService.getSnapshot("missing", NOW);
            fail("Expected RecordNotFoundException");
        } catch (RecordNotFoundException ex) {
            // expected
        }
    }

    @Test
    public void testGetRecentSessions() {
        PracticeSession recent = PracticeSession.create("recent-session", TEST_LEARNER_ID, TEST_CONFIGURATION, List.of("item-1"), NOW);
        when(practiceSessionDao.loadRecentSessions(TEST_LEARNER_ID, 10)).thenReturn(List.of(recent));

        assertEquals(List.of(recent), practiceSessionService.getRecentSessions(TEST_LEARNER_ID, 10));
    }

    @Test
    public void testGetRecentSessions_InvalidLimit() {
        try {
            practiceSessionService.getRecentSessions(TEST_LEARNER_ID, PracticeSessionService.MAX_RECENT_SESSIONS + 1);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException ex) {
            verify(practiceSessionDao, never()).loadRecentSessions(any(), anyInt());
        }
    }

    @Test
    public void testGetActiveSession() {
        when(practiceSessionDao.loadActiveSession("nobody")).thenReturn(Optional.empty());

        assertTrue(practiceSessionService.getActiveSession("nobody", NOW).isEmpty());
    }
}
