package com.phillippitts.speakstream.service.hotkey.impl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JNativeHookGlobalKeyHookTest {

    @Test
    void distinguishesLeftAndRightMeta() {
        assertThat(JNativeHookGlobalKeyHook.sidedKey("META", 0x36)).isEqualTo("RIGHT_META");
        assertThat(JNativeHookGlobalKeyHook.sidedKey("META", 0x37)).isEqualTo("LEFT_META");
        assertThat(JNativeHookGlobalKeyHook.sidedKey("META", 0)).isEqualTo("META");
    }

    @Test
    void distinguishesLeftAndRightAlt() {
        assertThat(JNativeHookGlobalKeyHook.sidedKey("ALT", 0x3D)).isEqualTo("RIGHT_ALT");
        assertThat(JNativeHookGlobalKeyHook.sidedKey("ALT", 0x3A)).isEqualTo("LEFT_ALT");
    }

    @Test
    void otherKeysUnchanged() {
        assertThat(JNativeHookGlobalKeyHook.sidedKey("F9", 0x36)).isEqualTo("F9");
    }
}
