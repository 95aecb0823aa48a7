package com.gt.practice.session;

import com.gt.practice.model.PracticeSession;
import com.gt.practice.model.SessionConfiguration;
import com.gt.practice.model.SessionSnapshot;
import com.gt.practice.model.submission.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/session")
public class PracticeSessionController {

    private static final Logger log = LoggerFactory.getLogger(PracticeSessionController.class);

    private final PracticeSessionService practiceSessionService;

    public PracticeSessionController(PracticeSessionService practiceSessionService) {
        this.practiceSessionService = practiceSessionService;
    }

    @PostMapping(value = "/create", consumes = "application/json", produces = "application/json")
    public CreatedSession createSession(@RequestBody CreateSessionRequest request) {
        return practiceSessionService.createSession(
                request.learnerId(),
                new SessionConfiguration(request.topicId(), request.learningPathIds(), request.targetCount(), request.includeReview()),
                Instant.now());
    }

    @GetMapping(value = "/active", produces = "application/json")
    public ResponseEntity<SessionSnapshot> getActiveSession(@RequestParam(value = "learnerId") String learnerId) {
        return ResponseEntity.of(practiceSessionService.getActiveSession(learnerId, Instant.now()));
    }

    @GetMapping(value = "/recent", produces = "application/json")
    public List<PracticeSession> getRecentSessions(@RequestParam(value = "learnerId") String learnerId,
                                                   @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return practiceSessionService.getRecentSessions(learnerId, limit);
    }

    @GetMapping(value = "/{sessionId}", produces = "application/json")
    public SessionSnapshot getSnapshot(@PathVariable("sessionId") String sessionId) {
        return practiceSessionService.getSnapshot(sessionId, Instant.now());
    }

    @PostMapping(value = "/{sessionId}/start", produces = "application/json")
    public SessionSnapshot start(@PathVariable("sessionId") String sessionId) {
        return practiceSessionService.start(sessionId, Instant.now());
    }

    @PostMapping(value = "/{sessionId}/submitAnswer", consumes = "application/json", produces = "application/json")
    public SessionSnapshot submitAnswer(@PathVariable("sessionId") String sessionId, @RequestBody Submission submission) {
        return practiceSessionService.submitAnswer(sessionId, submission, Instant.now());
    }

    @PostMapping(value = "/{sessionId}/skip", produces = "application/json")
    public SessionSnapshot skip(@PathVariable("sessionId") String sessionId) {
        return practiceSessionService.skip(sessionId, Instant.now());
    }

    @PostMapping(value = "/{sessionId}/advance", produces = "application/json")
    public SessionSnapshot advance(@PathVariable("sessionId") String sessionId) {
        return practiceSessionService.advance(sessionId, Instant.now());
    }

    @PostMapping(value = "/{sessionId}/toggleHint", produces = "application/json")
    public SessionSnapshot toggleHint(@PathVariable("sessionId") String sessionId) {
        return practiceSessionService.toggleHint(sessionId, Instant.now());
    }

    @PostMapping(value = "/{sessionId}/cancel", produces = "application/json")
    public SessionSnapshot cancel(@PathVariable("sessionId") String sessionId) {
        return practiceSessionService.cancel(sessionId, Instant.now());
    }

    @PostMapping(value = "/{sessionId}/finish", produces = "application/json")
    public SessionSnapshot finish(@PathVariable("sessionId") String sessionId) {
        return practiceSessionService.finish(sessionId, Instant.now());
    }

    @PostMapping(value = "/{sessionId}/sync", produces = "application/json")
    public SessionSnapshot sync(@PathVariable("sessionId") String sessionId) {
        log.info("Sync requested for session {}", sessionId);
        return practiceSessionService.sync(sessionId, Instant.now());
    }

    private record CreateSessionRequest(String learnerId, String topicId, List<String> learningPathIds, int targetCount, boolean includeReview) { }
}
