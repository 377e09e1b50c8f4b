package com.phillippitts.speakstream.service.insertion;

import com.phillippitts.speakstream.service.insertion.event.AllInsertionFallbacksFailedEvent;
import com.phillippitts.speakstream.service.insertion.event.InsertionFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Tries insertion adapters in {@link InsertionAdapter#order()} until one succeeds.
 * Defaults: paste shortcut, then clipboard only, then notify.
 */
@Service
public class StrategyChainTextInserter implements TextInsertionSink {

    private static final Logger LOG = LogManager.getLogger(StrategyChainTextInserter.class);

    private final List<InsertionAdapter> chain;
    private final ApplicationEventPublisher publisher;

    StrategyChainTextInserter(List<InsertionAdapter> adapters, ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher);
        this.chain = adapters.stream()
                .sorted(Comparator.comparingInt(InsertionAdapter::order))
                .toList();
    }

    @Override
    public boolean insertText(String text) {
        if (text == null || text.isBlank()) {
            LOG.debug("Skipping insertion of blank text");
            return false;
        }
        for (InsertionAdapter adapter : chain) {
            if (!adapter.isAvailable()) {
                LOG.debug("Skipping adapter {}: unavailable", adapter.name());
                continue;
            }
            try {
                if (adapter.insert(text)) {
                    LOG.info("Inserted via {} (chars={})", adapter.name(), text.length());
                    return true;
                }
                publisher.publishEvent(new InsertionFallbackEvent(adapter.name(), "insert returned false",
                        Instant.now()));
            } catch (RuntimeException e) {
                LOG.warn("Adapter {} failed: {}", adapter.name(), e.toString());
                publisher.publishEvent(new InsertionFallbackEvent(adapter.name(), e.getClass().getSimpleName(),
                        Instant.now()));
            }
        }
        LOG.warn("No insertion adapter succeeded (chars={})", text.length());
        publisher.publishEvent(new AllInsertionFallbacksFailedEvent("no adapters succeeded", Instant.now()));
        return false;
    }
}
