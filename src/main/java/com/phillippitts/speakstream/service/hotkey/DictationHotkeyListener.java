package com.phillippitts.speakstream.service.hotkey;

import com.phillippitts.speakstream.domain.DictationMode;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyCancelEvent;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyPressedEvent;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyReleasedEvent;
import com.phillippitts.speakstream.service.session.CompletionOutcome;
import com.phillippitts.speakstream.service.session.SessionManager;
import com.phillippitts.speakstream.service.stream.SessionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Drives the {@link SessionManager} from hotkey events.
 *
 * <p>Press and release run in order on the single-threaded {@code sessionExecutor}, so a quick
 * tap can never complete before it started. Cancel runs on {@code eventExecutor} and interrupts a
 * completion that is still waiting for its transcript.
 */
@Component
public class DictationHotkeyListener {

    private static final Logger LOG = LogManager.getLogger(DictationHotkeyListener.class);

    private final SessionManager sessionManager;

    public DictationHotkeyListener(SessionManager sessionManager) {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager must not be null");
    }

    /** Starts a session, or switches a streaming session to EDIT. */
    @EventListener
    @Async("sessionExecutor")
    public void onHotkeyPressed(HotkeyPressedEvent evt) {
        if (evt.mode() == DictationMode.EDIT && sessionManager.getState() == SessionState.STREAMING) {
            sessionManager.setMode(DictationMode.EDIT);
            return;
        }
        if (!sessionManager.startSession(evt.mode())) {
            LOG.debug("Hotkey press ignored; session not started (state={})", sessionManager.getState());
        }
    }

    @EventListener
    @Async("sessionExecutor")
    public void onHotkeyReleased(HotkeyReleasedEvent evt) {
        CompletionOutcome outcome = sessionManager.completeSession();
        LOG.debug("Hotkey release completed session: {}", outcome);
    }

    @EventListener
    @Async("eventExecutor")
    public void onHotkeyCancel(HotkeyCancelEvent evt) {
        sessionManager.cancelSession();
    }
}
