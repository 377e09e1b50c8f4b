package com.phillippitts.speakstream.service.session;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GrammarRulesServiceTest {

    private final GrammarRulesService grammar = new GrammarRulesService();

    @Test
    void capitalizesWithoutContextOrAfterSentenceEnd() {
        assertThat(grammar.setCaseFirstWord("hello there", "")).isEqualTo("Hello there");
        assertThat(grammar.setCaseFirstWord("hello there", null)).isEqualTo("Hello there");
        assertThat(grammar.setCaseFirstWord("hello there", "End.")).isEqualTo("Hello there");
        assertThat(grammar.setCaseFirstWord("hello", "Really? ")).isEqualTo("Hello");
    }

    @Test
    void lowercasesAfterContinuationPunctuation() {
        assertThat(grammar.setCaseFirstWord("Hello", "Dear team,")).isEqualTo("hello");
        assertThat(grammar.setCaseFirstWord("Then", "Note:")).isEqualTo("then");
        assertThat(grammar.setCaseFirstWord("Then", "well -")).isEqualTo("then");
    }

    @Test
    void lowercasesMidSentence() {
        assertThat(grammar.setCaseFirstWord("Cat", "and the")).isEqualTo("cat");
        assertThat(grammar.setCaseFirstWord("Is out", "version 2")).isEqualTo("is out");
    }

    @Test
    void capitalizesAfterOtherSymbols() {
        assertThat(grammar.setCaseFirstWord("hello", "(")).isEqualTo("Hello");
    }

    @Test
    void pronounIIsAlwaysCapitalized() {
        assertThat(grammar.setCaseFirstWord("i think", "and")).isEqualTo("I think");
    }

    @Test
    void contractionsOfIAreAlwaysCapitalized() {
        assertThat(grammar.setCaseFirstWord("i'm done", "so")).isEqualTo("I'm done");
        assertThat(grammar.setCaseFirstWord("i’ll go", "and")).isEqualTo("I’ll go");
        assertThat(grammar.setCaseFirstWord("it works", "so")).isEqualTo("it works");
    }

    @Test
    void weekdaysAndMonthsKeepCapitalMidSentence() {
        assertThat(grammar.setCaseFirstWord("Monday works", "Let's meet,")).isEqualTo("Monday works");
        assertThat(grammar.setCaseFirstWord("january is busy", "and")).isEqualTo("January is busy");
        assertThat(grammar.setCaseFirstWord("Friday's plan", "about")).isEqualTo("Friday's plan");
    }

    @Test
    void mayAndMarchAreMonthsOnlyWhenCapitalized() {
        assertThat(grammar.setCaseFirstWord("May works", "in")).isEqualTo("May works");
        assertThat(grammar.setCaseFirstWord("may be late", "I")).isEqualTo("may be late");
        assertThat(grammar.setCaseFirstWord("March on", "we")).isEqualTo("March on");
    }

    @Test
    void acronymsAndMixedCaseNamesAreLeftAlone() {
        assertThat(grammar.setCaseFirstWord("NASA launched", "and")).isEqualTo("NASA launched");
        assertThat(grammar.setCaseFirstWord("iPhone sales", "the")).isEqualTo("iPhone sales");
        assertThat(grammar.setCaseFirstWord("McDonald called", "then")).isEqualTo("McDonald called");
    }

    @Test
    void vocabularyNamesKeepCapital() {
        List<String> vocabulary = List.of("Paris", "Kubernetes", "latte");

        assertThat(grammar.setCaseFirstWord("Paris is lovely", "We flew to Lyon,", vocabulary))
                .isEqualTo("Paris is lovely");
        assertThat(grammar.setCaseFirstWord("kubernetes pods", "the", vocabulary))
                .isEqualTo("Kubernetes pods");
        // lowercase entries are ordinary words
        assertThat(grammar.setCaseFirstWord("Latte please", "a", vocabulary)).isEqualTo("latte please");
        // without the vocabulary a capitalized word mid-sentence is lowercased
        assertThat(grammar.setCaseFirstWord("Paris is lovely", "We flew to Lyon,")).isEqualTo("paris is lovely");
    }

    @Test
    void isProperNounIgnoresSurroundingPunctuation() {
        assertThat(grammar.isProperNoun("(Tuesday),", List.of())).isTrue();
        assertThat(grammar.isProperNoun("hello", List.of())).isFalse();
        assertThat(grammar.isProperNoun("", List.of())).isFalse();
        assertThat(grammar.isProperNoun(null, List.of())).isFalse();
    }

    @Test
    void emptyAndLetterlessTranscriptsAreUnchanged() {
        assertThat(grammar.setCaseFirstWord("", "x")).isEmpty();
        assertThat(grammar.setCaseFirstWord("42!", "x")).isEqualTo("42!");
    }

    @Test
    void capitalizesLetterAfterLeadingPunctuation() {
        assertThat(grammar.setCaseFirstWord("\"quoted\" text", "")).isEqualTo("\"Quoted\" text");
    }

    @Test
    void addsSpaceAfterWordOrPunctuation() {
        assertThat(grammar.addLeadingSpaceIfNeeded("hello", "word")).isEqualTo(" hello");
        assertThat(grammar.addLeadingSpaceIfNeeded("Hello", "Done.")).isEqualTo(" Hello");
    }

    @Test
    void noSpaceAfterWhitespaceOpeningBracketOrEmptyContext() {
        assertThat(grammar.addLeadingSpaceIfNeeded("hello", "word ")).isEqualTo("hello");
        assertThat(grammar.addLeadingSpaceIfNeeded("hello", "say \"")).isEqualTo("hello");
        assertThat(grammar.addLeadingSpaceIfNeeded("hello", "[")).isEqualTo("hello");
        assertThat(grammar.addLeadingSpaceIfNeeded("hello", "")).isEqualTo("hello");
    }

    @Test
    void applyRunsCaseThenSpacing() {
        assertThat(grammar.apply("Next item", "first,")).isEqualTo(" next item");
        assertThat(grammar.apply("next item", "")).isEqualTo("Next item");
        assertThat(grammar.apply("Paris next", "then", List.of("Paris"))).isEqualTo(" Paris next");
    }
}
