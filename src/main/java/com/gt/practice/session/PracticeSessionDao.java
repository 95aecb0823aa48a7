package com.gt.practice.session;

import com.gt.practice.model.PracticeSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PracticeSessionDao {

    void createSession(PracticeSession session);

    /**
     * Writes the session if the stored version still equals {@code expectedVersion}, bumping it by one.
     *
     * @return number of rows updated; 0 means someone else saved the session first
     */
    int saveSession(PracticeSession session, long expectedVersion);

    Optional<PracticeSession> loadSession(String sessionId);

    // Most recent unfinished session of the learner, if any
    Optional<PracticeSession> loadActiveSession(String learnerId);

    // Sessions of the learner in any status, most recently updated first
    List<PracticeSession> loadRecentSessions(String learnerId, int limit);

    int purgeFinishedSessions(Instant cutoff);

    int purgeUnstartedSessions(Instant cutoff);
}
