package com.phillippitts.speakstream.config.session;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for dictation sessions.
 */
@Validated
@ConfigurationProperties(prefix = "session")
public class SessionProperties {

    /** Sessions with less buffered audio than this are discarded without a transcript. */
    @Min(0)
    @Max(5_000)
    private final int minimumAudioDurationMs;

    /** How long completion waits for the transcript after input ends. */
    @Min(1_000)
    @Max(600_000)
    private final int responseTimeoutMs;

    /** Apply capitalization and spacing rules before inserting. */
    private final boolean grammarEnabled;

    /** Characters before the caret read for the grammar rules. */
    @Min(1)
    @Max(100)
    private final int cursorContextLength;

    @ConstructorBinding
    public SessionProperties(Integer minimumAudioDurationMs,
                             Integer responseTimeoutMs,
                             Boolean grammarEnabled,
                             Integer cursorContextLength) {
        this.minimumAudioDurationMs = minimumAudioDurationMs == null ? 100 : minimumAudioDurationMs;
        this.responseTimeoutMs = responseTimeoutMs == null ? 30_000 : responseTimeoutMs;
        this.grammarEnabled = grammarEnabled == null ? true : grammarEnabled;
        this.cursorContextLength = cursorContextLength == null ? 4 : cursorContextLength;
    }

    public int getMinimumAudioDurationMs() {
        return minimumAudioDurationMs;
    }

    public int getResponseTimeoutMs() {
        return responseTimeoutMs;
    }

    public boolean isGrammarEnabled() {
        return grammarEnabled;
    }

    public int getCursorContextLength() {
        return cursorContextLength;
    }
}
