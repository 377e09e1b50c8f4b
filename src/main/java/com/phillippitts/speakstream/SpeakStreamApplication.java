package com.phillippitts.speakstream;

import com.phillippitts.speakstream.config.audio.AudioCaptureProperties;
import com.phillippitts.speakstream.config.auth.AuthProperties;
import com.phillippitts.speakstream.config.hotkey.HotkeyProperties;
import com.phillippitts.speakstream.config.session.SessionProperties;
import com.phillippitts.speakstream.config.transport.TransportProperties;
import com.phillippitts.speakstream.config.typing.TypingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        AuthProperties.class,
        HotkeyProperties.class,
        SessionProperties.class,
        TransportProperties.class,
        TypingProperties.class
})
public class SpeakStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakStreamApplication.class, args);
    }

}
