package com.ai.intake.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class LoggingExtractionFailureReporter implements ExtractionFailureReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingExtractionFailureReporter.class);

    private final Map<ExtractionException.Kind, AtomicLong> counts = new ConcurrentHashMap<>();

    @Override
    public void report(String conversationId, ExtractionException failure) {
        long total = counts.computeIfAbsent(failure.getKind(), k -> new AtomicLong()).incrementAndGet();
        log.warn("[{}] Extraction failed kind={} total={}: {}", conversationId, failure.getKind(), total,
                failure.getMessage(), failure.getCause());
    }

    @Override
    public Map<ExtractionException.Kind, Long> failureCounts() {
        Map<ExtractionException.Kind, Long> snapshot = new EnumMap<>(ExtractionException.Kind.class);
        for (ExtractionException.Kind kind : ExtractionException.Kind.values()) {
            AtomicLong c = counts.get(kind);
            snapshot.put(kind, c != null ? c.get() : 0L);
        }
        return snapshot;
    }
}
