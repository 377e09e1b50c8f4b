package com.phillippitts.speakstream.service.hotkey.impl;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.NativeInputEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.phillippitts.speakstream.service.hotkey.GlobalKeyHook;
import com.phillippitts.speakstream.service.hotkey.KeyNames;
import com.phillippitts.speakstream.service.hotkey.NormalizedKeyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link GlobalKeyHook} backed by JNativeHook.
 *
 * <p>JNativeHook reports both Command keys as "Meta"; the raw key code tells left from right
 * on macOS. Alt is reported the same way.
 */
@Component
public class JNativeHookGlobalKeyHook implements GlobalKeyHook, NativeKeyListener {

    private static final Logger LOG = LogManager.getLogger(JNativeHookGlobalKeyHook.class);

    private static final int MAC_RIGHT_META = 0x36;
    private static final int MAC_LEFT_META = 0x37;
    private static final int MAC_LEFT_ALT = 0x3A;
    private static final int MAC_RIGHT_ALT = 0x3D;

    private volatile Consumer<NormalizedKeyEvent> listener;
    private final AtomicBoolean registered = new AtomicBoolean(false);

    @Override
    public void register() {
        if (registered.get()) {
            return;
        }
        try {
            GlobalScreen.registerNativeHook();
            GlobalScreen.addNativeKeyListener(this);
            registered.set(true);
            LOG.info("Registered JNativeHook global key listener");
        } catch (NativeHookException | UnsatisfiedLinkError e) {
            throw new SecurityException("Failed to register global key hook: " + e.getMessage(), e);
        }
    }

    @Override
    public void unregister() {
        if (!registered.compareAndSet(true, false)) {
            return;
        }
        GlobalScreen.removeNativeKeyListener(this);
        try {
            GlobalScreen.unregisterNativeHook();
        } catch (NativeHookException e) {
            LOG.debug("Error unregistering native hook: {}", e.toString());
        }
    }

    @Override
    public void addListener(Consumer<NormalizedKeyEvent> listener) {
        this.listener = listener;
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent nativeEvent) {
        emit(nativeEvent, NormalizedKeyEvent.Type.PRESSED);
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent nativeEvent) {
        emit(nativeEvent, NormalizedKeyEvent.Type.RELEASED);
    }

    private void emit(NativeKeyEvent ne, NormalizedKeyEvent.Type type) {
        Consumer<NormalizedKeyEvent> l = this.listener;
        if (l == null) {
            return;
        }
        String key = sidedKey(KeyNames.normalize(NativeKeyEvent.getKeyText(ne.getKeyCode())), ne.getRawCode());
        NormalizedKeyEvent e = new NormalizedKeyEvent(type, key, modifiers(ne), System.currentTimeMillis());
        try {
            l.accept(e);
        } catch (RuntimeException ex) {
            LOG.warn("Listener error for {}: {}", e, ex.toString());
        }
    }

    static String sidedKey(String key, int rawCode) {
        if ("META".equals(key)) {
            if (rawCode == MAC_RIGHT_META) {
                return "RIGHT_META";
            }
            if (rawCode == MAC_LEFT_META) {
                return "LEFT_META";
            }
        } else if ("ALT".equals(key)) {
            if (rawCode == MAC_RIGHT_ALT) {
                return "RIGHT_ALT";
            }
            if (rawCode == MAC_LEFT_ALT) {
                return "LEFT_ALT";
            }
        }
        return key;
    }

    private static Set<String> modifiers(NativeInputEvent e) {
        int m = e.getModifiers();
        Set<String> mods = new HashSet<>();
        if ((m & NativeInputEvent.SHIFT_MASK) != 0) {
            mods.add("SHIFT");
        }
        if ((m & NativeInputEvent.CTRL_MASK) != 0) {
            mods.add("CONTROL");
        }
        if ((m & NativeInputEvent.ALT_MASK) != 0) {
            mods.add("ALT");
        }
        if ((m & NativeInputEvent.META_MASK) != 0) {
            mods.add("META");
        }
        return mods;
    }
}
