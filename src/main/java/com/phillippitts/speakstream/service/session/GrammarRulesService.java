package com.phillippitts.speakstream.service.session;

import java.time.DayOfWeek;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Adjusts the first word of a transcript to fit the text already before the caret.
 *
 * <p>Stateless; the cursor context is passed per call.
 */
public class GrammarRulesService {

    private static final Set<Character> SENTENCE_END = Set.of('.', '!', '?');
    private static final Set<Character> CONTINUATION = Set.of(',', ';', ':', '-', '–', '—');
    private static final Set<Character> OPENING = Set.of('(', '[', '{', '"', '\'', '`');
    private static final Pattern LETTER = Pattern.compile("[a-zA-Z]");
    private static final Pattern ENDS_ALNUM = Pattern.compile("[a-zA-Z0-9]$");
    private static final Pattern PRONOUN_I = Pattern.compile("(?i)^i(['’](m|ll|d|ve))?[.,!?;:]*$");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|(['’]s)?[^\\p{L}\\p{N}]*$");
    private static final Pattern INNER_CAPITAL = Pattern.compile("^\\p{L}+\\p{Lu}\\p{L}*$");
    private static final Pattern ACRONYM = Pattern.compile("^\\p{Lu}{2,}\\d*$");

    private static final Set<String> CALENDAR_NAMES = Stream.concat(
                    Arrays.stream(DayOfWeek.values()).map(d -> d.getDisplayName(TextStyle.FULL, Locale.ENGLISH)),
                    Arrays.stream(Month.values()).map(m -> m.getDisplayName(TextStyle.FULL, Locale.ENGLISH)))
            .map(n -> n.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    // also common verbs; only treated as months when already capitalized
    private static final Set<String> AMBIGUOUS_MONTHS = Set.of("may", "march");

    /**
     * Capitalizes or lowercases the first letter of {@code transcript}.
     *
     * <p>Without context the first letter is capitalized. After a sentence end it is capitalized;
     * after continuation punctuation or a letter/digit it is lowercased. The pronoun "I" and proper
     * nouns (weekdays, months, acronyms, mixed-case names) are always capitalized.
     */
    public String setCaseFirstWord(String transcript, String cursorContext) {
        return setCaseFirstWord(transcript, cursorContext, List.of());
    }

    /**
     * As {@link #setCaseFirstWord(String, String)}, also treating capitalized entries of the
     * user's {@code vocabulary} as proper nouns.
     */
    public String setCaseFirstWord(String transcript, String cursorContext, Collection<String> vocabulary) {
        if (transcript == null || transcript.isEmpty()) {
            return transcript;
        }
        int idx = firstLetterIndex(transcript);
        if (idx < 0) {
            return transcript;
        }
        String word = firstWord(transcript);
        if (hasOwnCasing(word)) {
            // iPhone, NASA: the casing is part of the name
            return transcript;
        }
        boolean upper = cursorContext == null || cursorContext.isEmpty()
                || shouldCapitalize(cursorContext, word, vocabulary);
        char c = transcript.charAt(idx);
        char replaced = upper ? Character.toUpperCase(c) : Character.toLowerCase(c);
        return transcript.substring(0, idx) + replaced + transcript.substring(idx + 1);
    }

    /**
     * Prepends a space when the context ends in a non-whitespace character other than an
     * opening bracket or quote.
     */
    public String addLeadingSpaceIfNeeded(String transcript, String cursorContext) {
        if (transcript == null || transcript.isEmpty()) {
            return transcript;
        }
        if (cursorContext == null || cursorContext.isEmpty()) {
            return transcript;
        }
        char last = cursorContext.charAt(cursorContext.length() - 1);
        if (Character.isWhitespace(last) || OPENING.contains(last)) {
            return transcript;
        }
        return " " + transcript;
    }

    /** Applies both rules in order. */
    public String apply(String transcript, String cursorContext) {
        return apply(transcript, cursorContext, List.of());
    }

    /** Applies both rules in order, with the user's vocabulary as known proper nouns. */
    public String apply(String transcript, String cursorContext, Collection<String> vocabulary) {
        return addLeadingSpaceIfNeeded(setCaseFirstWord(transcript, cursorContext, vocabulary), cursorContext);
    }

    /**
     * Whether {@code word} names a person, place, weekday, month or similar and keeps its capital
     * regardless of position. Surrounding punctuation and a possessive "'s" are ignored.
     */
    boolean isProperNoun(String word, Collection<String> vocabulary) {
        if (word == null) {
            return false;
        }
        String bare = EDGE_PUNCTUATION.matcher(word.trim()).replaceAll("");
        if (bare.isEmpty()) {
            return false;
        }
        String lower = bare.toLowerCase(Locale.ROOT);
        if (CALENDAR_NAMES.contains(lower)) {
            return !AMBIGUOUS_MONTHS.contains(lower) || Character.isUpperCase(bare.charAt(0));
        }
        if (hasOwnCasing(bare)) {
            return true;
        }
        if (vocabulary != null) {
            for (String term : vocabulary) {
                if (term != null && !term.isEmpty() && Character.isUpperCase(term.charAt(0))
                        && term.equalsIgnoreCase(bare)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean hasOwnCasing(String word) {
        String bare = EDGE_PUNCTUATION.matcher(word.trim()).replaceAll("");
        return ACRONYM.matcher(bare).matches() || INNER_CAPITAL.matcher(bare).matches();
    }

    private boolean shouldCapitalize(String context, String firstWord, Collection<String> vocabulary) {
        if (PRONOUN_I.matcher(firstWord).matches() || isProperNoun(firstWord, vocabulary)) {
            return true;
        }
        String trimmed = context.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        char last = trimmed.charAt(trimmed.length() - 1);
        if (SENTENCE_END.contains(last)) {
            return true;
        }
        if (CONTINUATION.contains(last)) {
            return false;
        }
        return !ENDS_ALNUM.matcher(trimmed).find();
    }

    private static int firstLetterIndex(String s) {
        var m = LETTER.matcher(s);
        return m.find() ? m.start() : -1;
    }

    private static String firstWord(String s) {
        String trimmed = s.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}
