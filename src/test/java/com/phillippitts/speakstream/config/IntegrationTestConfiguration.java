package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.service.audio.capture.AudioCaptureSource;
import com.phillippitts.speakstream.service.hotkey.GlobalKeyHook;
import com.phillippitts.speakstream.testutil.FakeAudioCaptureSource;
import com.phillippitts.speakstream.testutil.FakeGlobalKeyHook;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Test doubles for the hardware-bound beans: microphone and global keyboard hook.
 *
 * <p>Both are {@code @Primary} so they win over the production beans without excluding them.
 */
@TestConfiguration
public class IntegrationTestConfiguration {

    @Bean
    @Primary
    public AudioCaptureSource testAudioCaptureSource() {
        return new FakeAudioCaptureSource();
    }

    @Bean
    @Primary
    public GlobalKeyHook testGlobalKeyHook() {
        return new FakeGlobalKeyHook();
    }
}
