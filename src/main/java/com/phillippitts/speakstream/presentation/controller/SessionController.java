package com.phillippitts.speakstream.presentation.controller;

import com.phillippitts.speakstream.domain.DictationMode;
import com.phillippitts.speakstream.exception.SessionStateException;
import com.phillippitts.speakstream.service.session.CompletionOutcome;
import com.phillippitts.speakstream.service.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Local control API for dictation sessions, the HTTP counterpart of the hotkeys.
 */
@RestController
@RequestMapping("/api/session")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final SessionManager sessionManager;

    SessionController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @GetMapping
    ResponseEntity<SessionStatus> status() {
        return ResponseEntity.ok(currentStatus());
    }

    @PostMapping("/start")
    ResponseEntity<SessionStatus> start(@RequestParam(defaultValue = "TRANSCRIBE") DictationMode mode) {
        if (!sessionManager.startSession(mode)) {
            throw new SessionStateException("A session is already active", sessionManager.getState().name());
        }
        LOG.info("Session started via API (mode={})", mode);
        return ResponseEntity.ok(currentStatus());
    }

    @PostMapping("/mode")
    ResponseEntity<SessionStatus> mode(@RequestParam DictationMode mode) {
        if (!sessionManager.setMode(mode)) {
            throw new SessionStateException("No streaming session", sessionManager.getState().name());
        }
        return ResponseEntity.ok(currentStatus());
    }

    @PostMapping("/cancel")
    ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = sessionManager.cancelSession();
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @PostMapping("/complete")
    ResponseEntity<Map<String, Object>> complete() {
        CompletionOutcome outcome = sessionManager.completeSession();
        return ResponseEntity.ok(Map.of("outcome", outcome.name()));
    }

    private SessionStatus currentStatus() {
        return new SessionStatus(
                sessionManager.getSessionId(),
                sessionManager.getState().name(),
                sessionManager.getMode().name(),
                sessionManager.getBufferedDurationMs());
    }

    record SessionStatus(String sessionId, String state, String mode, long bufferedDurationMs) { }
}
