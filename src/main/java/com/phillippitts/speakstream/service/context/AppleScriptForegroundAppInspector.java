package com.phillippitts.speakstream.service.context;

import com.phillippitts.speakstream.util.Timeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * macOS inspector that queries System Events through {@code osascript}.
 *
 * <p>Requires the Accessibility permission for selection and caret queries; without it those
 * return "" and only the application name is available.
 */
public class AppleScriptForegroundAppInspector implements ForegroundAppInspector {

    private static final Logger LOG = LogManager.getLogger(AppleScriptForegroundAppInspector.class);

    static final String FIELD_SEPARATOR = "\u001F";

    static final String ACTIVE_WINDOW_SCRIPT = String.join("\n",
            "tell application \"System Events\"",
            "  set p to first application process whose frontmost is true",
            "  set appName to name of p",
            "  set winTitle to \"\"",
            "  try",
            "    set winTitle to name of front window of p",
            "  end try",
            "  return appName & (ASCII character 31) & winTitle",
            "end tell");

    static final String SELECTED_TEXT_SCRIPT = String.join("\n",
            "tell application \"System Events\"",
            "  set p to first application process whose frontmost is true",
            "  set f to value of attribute \"AXFocusedUIElement\" of p",
            "  return value of attribute \"AXSelectedText\" of f",
            "end tell");

    static final String CARET_SCRIPT = String.join("\n",
            "tell application \"System Events\"",
            "  set p to first application process whose frontmost is true",
            "  set f to value of attribute \"AXFocusedUIElement\" of p",
            "  set r to value of attribute \"AXSelectedTextRange\" of f",
            "  set v to value of attribute \"AXValue\" of f",
            "  return ((item 1 of r) as text) & (ASCII character 31) & v",
            "end tell");

    private final ProcessFactory processFactory;
    private final Duration timeout;

    public AppleScriptForegroundAppInspector() {
        this(ProcessFactory.system(), Timeouts.FOREGROUND_QUERY_TIMEOUT);
    }

    AppleScriptForegroundAppInspector(ProcessFactory processFactory, Duration timeout) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public ForegroundWindow activeWindow() {
        String out = run(ACTIVE_WINDOW_SCRIPT);
        int sep = out.indexOf(FIELD_SEPARATOR);
        if (sep < 0) {
            return new ForegroundWindow(out, "");
        }
        return new ForegroundWindow(out.substring(0, sep), out.substring(sep + 1));
    }

    @Override
    public String selectedText() {
        return run(SELECTED_TEXT_SCRIPT);
    }

    @Override
    public String textBeforeCursor(int maxChars) {
        if (maxChars <= 0) {
            return "";
        }
        return textBeforeCaret(run(CARET_SCRIPT), maxChars);
    }

    /**
     * Extracts the characters before the caret from {@code "<caretLocation>\u001F<fieldValue>"}.
     * The caret location is 1-based as reported by AppleScript ranges.
     */
    static String textBeforeCaret(String caretOutput, int maxChars) {
        int sep = caretOutput.indexOf(FIELD_SEPARATOR);
        if (sep < 0) {
            return "";
        }
        int caret;
        try {
            caret = Integer.parseInt(caretOutput.substring(0, sep).trim()) - 1;
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable caret location: {}", e.getMessage());
            return "";
        }
        String value = caretOutput.substring(sep + 1);
        int end = Math.max(0, Math.min(caret, value.length()));
        int start = Math.max(0, end - maxChars);
        return value.substring(start, end);
    }

    private String run(String script) {
        Process process;
        try {
            process = processFactory.start(List.of("osascript", "-e", script));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start osascript", e);
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IllegalStateException("osascript timed out after " + timeout.toMillis() + "ms");
            }
            if (process.exitValue() != 0) {
                throw new IllegalStateException("osascript exited with " + process.exitValue());
            }
            return stripTrailingNewline(stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IllegalStateException("Interrupted while running osascript", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to read osascript output", e);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String stripTrailingNewline(String s) {
        return s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
    }
}
