package com.phillippitts.speakstream.service.insertion;

import com.phillippitts.speakstream.service.insertion.event.AllInsertionFallbacksFailedEvent;
import com.phillippitts.speakstream.service.insertion.event.InsertionFallbackEvent;
import com.phillippitts.speakstream.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyChainTextInserterTest {

    private final EventCapturingPublisher events = new EventCapturingPublisher();

    @Test
    void usesFirstAvailableAdapterInOrder() {
        StubAdapter clipboard = new StubAdapter("clipboard", 20, true, true);
        StubAdapter paste = new StubAdapter("paste", 10, true, true);
        StrategyChainTextInserter inserter = new StrategyChainTextInserter(List.of(clipboard, paste), events);

        assertThat(inserter.insertText("hello")).isTrue();

        assertThat(paste.inserted).containsExactly("hello");
        assertThat(clipboard.inserted).isEmpty();
        assertThat(events.events()).isEmpty();
    }

    @Test
    void skipsUnavailableAdapterWithoutFallbackEvent() {
        StubAdapter paste = new StubAdapter("paste", 10, false, true);
        StubAdapter clipboard = new StubAdapter("clipboard", 20, true, true);
        StrategyChainTextInserter inserter = new StrategyChainTextInserter(List.of(paste, clipboard), events);

        inserter.insertText("hello");

        assertThat(paste.inserted).isEmpty();
        assertThat(clipboard.inserted).containsExactly("hello");
        assertThat(events.eventsOf(InsertionFallbackEvent.class)).isEmpty();
    }

    @Test
    void shouldFallBackWhenAdapterThrows() {
        StubAdapter paste = new StubAdapter("paste", 10, true, true);
        paste.failure = new IllegalStateException("robot gone");
        StubAdapter clipboard = new StubAdapter("clipboard", 20, true, true);
        StrategyChainTextInserter inserter = new StrategyChainTextInserter(List.of(paste, clipboard), events);

        assertThat(inserter.insertText("hello")).isTrue();

        assertThat(events.eventsOf(InsertionFallbackEvent.class)).singleElement().satisfies(e -> {
            assertThat(e.tier()).isEqualTo("paste");
            assertThat(e.reason()).isEqualTo("IllegalStateException");
        });
    }

    @Test
    void allAdaptersFailingPublishesEventAndReturnsFalse() {
        StubAdapter paste = new StubAdapter("paste", 10, true, false);
        StubAdapter clipboard = new StubAdapter("clipboard", 20, true, false);
        StrategyChainTextInserter inserter = new StrategyChainTextInserter(List.of(paste, clipboard), events);

        assertThat(inserter.insertText("hello")).isFalse();

        assertThat(events.eventsOf(InsertionFallbackEvent.class)).hasSize(2);
        assertThat(events.eventsOf(AllInsertionFallbacksFailedEvent.class)).hasSize(1);
    }

    @Test
    void blankTextIsNotInserted() {
        StubAdapter paste = new StubAdapter("paste", 10, true, true);
        StrategyChainTextInserter inserter = new StrategyChainTextInserter(List.of(paste), events);

        assertThat(inserter.insertText("  ")).isFalse();
        assertThat(inserter.insertText(null)).isFalse();
        assertThat(paste.inserted).isEmpty();
    }

    @Test
    void notifyOnlyAdapterAlwaysSucceedsLast() {
        NotifyOnlyAdapter notify = new NotifyOnlyAdapter();
        StubAdapter paste = new StubAdapter("paste", 10, true, false);
        StrategyChainTextInserter inserter = new StrategyChainTextInserter(List.of(notify, paste), events);

        assertThat(inserter.insertText("hello")).isTrue();
        assertThat(paste.inserted).containsExactly("hello");
        assertThat(notify.order()).isGreaterThan(paste.order());
    }

    static class StubAdapter implements InsertionAdapter {
        final String name;
        final int order;
        final boolean available;
        final boolean result;
        final List<String> inserted = new ArrayList<>();
        RuntimeException failure;

        StubAdapter(String name, int order, boolean available, boolean result) {
            this.name = name;
            this.order = order;
            this.available = available;
            this.result = result;
        }

        @Override
        public int order() {
            return order;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public boolean insert(String text) {
            if (failure != null) {
                throw failure;
            }
            inserted.add(text);
            return result;
        }

        @Override
        public String name() {
            return name;
        }
    }
}
