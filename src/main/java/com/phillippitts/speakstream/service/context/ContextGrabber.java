package com.phillippitts.speakstream.service.context;

import com.phillippitts.speakstream.domain.ContextSnapshot;
import com.phillippitts.speakstream.domain.DictationMode;
import com.phillippitts.speakstream.domain.DictionaryItem;
import com.phillippitts.speakstream.domain.ModelSettings;
import com.phillippitts.speakstream.service.rpc.TranscriptionServiceClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Default {@link ContextProvider}.
 *
 * <p>Window identity and selection come from the {@link ForegroundAppInspector}. Vocabulary is the
 * user dictionary, synced incrementally from the remote service; model settings are fetched per
 * session and fall back to the last settings successfully fetched. Each piece is gathered
 * independently and degrades to its fallback on failure.
 */
public class ContextGrabber implements ContextProvider {

    private static final Logger LOG = LogManager.getLogger(ContextGrabber.class);

    private final ForegroundAppInspector inspector;
    private final TranscriptionServiceClient rpcClient;

    private final Map<String, DictionaryItem> dictionary = new LinkedHashMap<>();
    private Instant lastDictionarySync;
    private volatile ModelSettings lastKnownSettings;

    public ContextGrabber(ForegroundAppInspector inspector,
                          TranscriptionServiceClient rpcClient,
                          ModelSettings defaultSettings) {
        this.inspector = Objects.requireNonNull(inspector, "inspector must not be null");
        this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
        this.lastKnownSettings = defaultSettings == null ? ModelSettings.empty() : defaultSettings;
    }

    @Override
    public ContextSnapshot gatherContext(DictationMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        ForegroundWindow window = safely("active window", inspector::activeWindow, () -> ForegroundWindow.UNKNOWN);
        String selectedText = mode == DictationMode.EDIT
                ? safely("selected text", inspector::selectedText, () -> "")
                : "";
        List<String> vocabulary = safely("vocabulary", this::syncVocabulary, this::cachedVocabulary);
        ModelSettings settings = safely("model settings", this::fetchSettings, () -> lastKnownSettings);

        LOG.debug("Gathered context: app='{}', selectedChars={}, vocabulary={}",
                window.appName(), selectedText.length(), vocabulary.size());
        return new ContextSnapshot(window.windowTitle(), window.appName(), selectedText, vocabulary, settings);
    }

    @Override
    public String getCursorContext(int maxChars) {
        return safely("cursor context", () -> inspector.textBeforeCursor(maxChars), () -> "");
    }

    /**
     * Applies remote dictionary changes since the last sync and returns the active words.
     */
    synchronized List<String> syncVocabulary() {
        Instant syncStartedAt = Instant.now();
        List<DictionaryItem> changes = rpcClient.listDictionaryItemsSince(lastDictionarySync);
        for (DictionaryItem item : changes) {
            if (item.isDeleted()) {
                dictionary.remove(item.id());
            } else {
                dictionary.put(item.id(), item);
            }
        }
        lastDictionarySync = syncStartedAt;
        if (!changes.isEmpty()) {
            LOG.debug("Applied {} dictionary changes; {} words active", changes.size(), dictionary.size());
        }
        return cachedVocabularyLocked();
    }

    synchronized List<String> cachedVocabulary() {
        return cachedVocabularyLocked();
    }

    private List<String> cachedVocabularyLocked() {
        return dictionary.values().stream()
                .map(DictionaryItem::word)
                .filter(word -> word != null && !word.isBlank())
                .toList();
    }

    private ModelSettings fetchSettings() {
        ModelSettings settings = rpcClient.getAdvancedSettings();
        if (settings != null) {
            lastKnownSettings = settings;
        }
        return lastKnownSettings;
    }

    private static <T> T safely(String what, Supplier<T> source, Supplier<T> fallback) {
        try {
            T value = source.get();
            return value != null ? value : fallback.get();
        } catch (RuntimeException e) {
            LOG.warn("Could not gather {}: {}", what, e.getMessage());
            return fallback.get();
        }
    }
}
