package com.phillippitts.speakstream.service.hotkey;

import com.phillippitts.speakstream.config.hotkey.HotkeyProperties;
import com.phillippitts.speakstream.domain.DictationMode;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyCancelEvent;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyPressedEvent;
import com.phillippitts.speakstream.service.hotkey.event.HotkeyReleasedEvent;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Registers the global key hook and turns key events into dictation hotkey events.
 *
 * <p>Push-to-talk: pressing the dictation or edit key publishes {@link HotkeyPressedEvent} with
 * the matching mode; releasing the last held key publishes {@link HotkeyReleasedEvent}. Key
 * repeats are ignored. In toggle mode a second press finishes instead of a release. The cancel
 * key publishes {@link HotkeyCancelEvent} while dictation is active.
 *
 * <p>Tests inject a fake {@link GlobalKeyHook} and feed {@link NormalizedKeyEvent}s directly.
 */
@Service
public class HotkeyManager implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HotkeyManager.class);

    private final GlobalKeyHook hook;
    private final HotkeyProperties props;
    private final ApplicationEventPublisher publisher;

    private final String key;
    private final String editKey;
    private final String cancelKey;
    private final Set<String> modifiers;

    // guarded by this
    private final Set<DictationMode> held = EnumSet.noneOf(DictationMode.class);
    private DictationMode toggledMode;

    private volatile boolean running;

    public HotkeyManager(GlobalKeyHook hook, HotkeyProperties props, ApplicationEventPublisher publisher) {
        this.hook = hook;
        this.props = props;
        this.publisher = publisher;
        this.key = KeyNames.normalize(props.getKey());
        this.editKey = KeyNames.normalize(props.getEditKey());
        this.cancelKey = KeyNames.normalize(props.getCancelKey());
        this.modifiers = KeyNames.normalizeAll(props.getModifiers());
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        try {
            hook.addListener(this::dispatch);
            hook.register();
            running = true;
            LOG.info("HotkeyManager started (key={}, editKey={}, toggle={})", key, editKey, props.isToggleMode());
            detectReservedConflict();
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.toString());
            publisher.publishEvent(new HotkeyPermissionDeniedEvent(Instant.now()));
        } catch (RuntimeException e) {
            // the local control API still works without hotkeys
            LOG.error("Failed to start HotkeyManager", e);
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            hook.unregister();
        } catch (RuntimeException e) {
            LOG.debug("Error unregistering key hook: {}", e.toString());
        }
        running = false;
        LOG.info("HotkeyManager stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    synchronized void dispatch(NormalizedKeyEvent e) {
        String k = KeyNames.normalize(e.key());
        if (e.type() == NormalizedKeyEvent.Type.PRESSED) {
            onPressed(k, e.modifiers());
        } else {
            onReleased(k);
        }
    }

    private void onPressed(String k, Set<String> mods) {
        if (k.equals(cancelKey)) {
            if (!held.isEmpty() || toggledMode != null) {
                held.clear();
                toggledMode = null;
                publisher.publishEvent(new HotkeyCancelEvent(Instant.now()));
            }
            return;
        }
        DictationMode mode = modeFor(k);
        if (mode == null || !mods.containsAll(modifiers)) {
            return;
        }
        if (props.isToggleMode()) {
            if (toggledMode == null) {
                toggledMode = mode;
                publisher.publishEvent(new HotkeyPressedEvent(mode, Instant.now()));
            } else if (mode == DictationMode.EDIT && toggledMode == DictationMode.TRANSCRIBE) {
                toggledMode = mode;
                publisher.publishEvent(new HotkeyPressedEvent(mode, Instant.now()));
            } else {
                toggledMode = null;
                publisher.publishEvent(new HotkeyReleasedEvent(Instant.now()));
            }
            return;
        }
        if (held.add(mode)) {
            publisher.publishEvent(new HotkeyPressedEvent(mode, Instant.now()));
        }
    }

    private void onReleased(String k) {
        if (props.isToggleMode()) {
            return;
        }
        DictationMode mode = modeFor(k);
        if (mode != null && held.remove(mode) && held.isEmpty()) {
            publisher.publishEvent(new HotkeyReleasedEvent(Instant.now()));
        }
    }

    private DictationMode modeFor(String k) {
        if (k.equals(key)) {
            return DictationMode.TRANSCRIBE;
        }
        if (k.equals(editKey)) {
            return DictationMode.EDIT;
        }
        return null;
    }

    private void detectReservedConflict() {
        for (String configured : List.of(key, editKey)) {
            for (String shortcut : props.getReserved()) {
                if (KeyNames.matchesReserved(modifiers, configured, shortcut)) {
                    publisher.publishEvent(new HotkeyConflictEvent(configured,
                            List.copyOf(props.getModifiers()), Instant.now()));
                    LOG.warn("Configured hotkey '{}' + {} conflicts with reserved '{}'", configured, modifiers, shortcut);
                    break;
                }
            }
        }
    }
}
