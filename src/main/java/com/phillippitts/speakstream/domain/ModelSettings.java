package com.phillippitts.speakstream.domain;

/**
 * User-tunable model settings forwarded to the transcription service with each
 * context snapshot. Every field is optional; {@code null} means "use the server default".
 */
public record ModelSettings(
        String asrProvider,
        String asrModel,
        String asrPrompt,
        String llmProvider,
        String llmModel,
        Double llmTemperature,
        String transcriptionPrompt,
        String editingPrompt,
        Double noSpeechThreshold
) {

    private static final ModelSettings EMPTY =
            new ModelSettings(null, null, null, null, null, null, null, null, null);

    public static ModelSettings empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return this.equals(EMPTY);
    }
}
