package com.phillippitts.speakstream.service.events;

import com.phillippitts.speakstream.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.speakstream.service.insertion.event.AllInsertionFallbacksFailedEvent;
import com.phillippitts.speakstream.service.insertion.event.InsertionFallbackEvent;
import com.phillippitts.speakstream.service.rpc.auth.AuthInvalidatedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onHotkeyPermissionDenied(HotkeyPermissionDeniedEvent e) {
        if (shouldLog("hotkey-permission")) {
            LOG.warn("Hotkey permission denied. On macOS grant Accessibility: "
                    + "System Settings → Privacy & Security → Accessibility (then restart app)");
        }
    }

    @EventListener
    void onHotkeyConflict(HotkeyConflictEvent e) {
        if (shouldLog("hotkey-conflict-" + e.key() + '-' + e.modifiers())) {
            LOG.warn("Configured hotkey conflicts with OS-reserved shortcut: key={}, modifiers={}. "
                    + "Update hotkey.* properties.", e.key(), e.modifiers());
        }
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        if (shouldLog("capture-" + e.reason())) {
            LOG.warn("Capture error: reason={}. Check microphone device & permissions.", e.reason());
        }
    }

    @EventListener
    void onAuthInvalidated(AuthInvalidatedEvent e) {
        // never throttled: every occurrence means the user was signed out
        LOG.warn("Signed out: credentials could not be refreshed (reason={})", e.reason());
    }

    @EventListener
    void onInsertionFallback(InsertionFallbackEvent e) {
        LOG.debug("Insertion tier {} failed: {}", e.tier(), e.reason());
    }

    @EventListener
    void onAllInsertionFallbacksFailed(AllInsertionFallbacksFailedEvent e) {
        if (shouldLog("insertion-failed")) {
            LOG.warn("Transcript could not be inserted ({}). On macOS check Accessibility permission.", e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
