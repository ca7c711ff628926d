package com.ai.intake.extraction;

import com.ai.intake.conversation.IntakeField;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the configured extractor with a hard time bound. Every failure mode ends in an
 * empty extraction plus a report; nothing propagates to the dialogue engine.
 */
@Service
public class ExtractionGateway {

    private static final Logger log = LoggerFactory.getLogger(ExtractionGateway.class);

    private final FieldExtractor extractor;
    private final ExtractionFailureReporter reporter;
    private final Duration timeout;
    private final ExecutorService executor;

    public ExtractionGateway(FieldExtractor extractor,
                             ExtractionFailureReporter reporter,
                             @Value("${intake.extractor.timeout:8s}") Duration timeout,
                             @Value("${intake.extractor.threads:8}") int threads) {
        this.extractor = extractor;
        this.reporter = reporter;
        this.timeout = timeout;
        this.executor = Executors.newFixedThreadPool(threads, new ExtractorThreadFactory());
        log.info("Extraction gateway ready: extractor={} timeout={} threads={}", extractor.name(), timeout, threads);
    }

    public ExtractedFields extract(String conversationId, String text, Set<IntakeField> missingFields) {
        Future<ExtractedFields> future;
        try {
            future = executor.submit(() -> extractor.extract(text, missingFields));
        } catch (RejectedExecutionException e) {
            reporter.report(conversationId, new ExtractionException(ExtractionException.Kind.UNAVAILABLE,
                    "Extraction executor rejected the call", e));
            return ExtractedFields.empty();
        }
        try {
            ExtractedFields fields = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (fields == null) return ExtractedFields.empty();
            log.debug("[{}] extracted {}", conversationId, fields.fields());
            return fields;
        } catch (TimeoutException e) {
            future.cancel(true);
            reporter.report(conversationId, new ExtractionException(ExtractionException.Kind.TIMEOUT,
                    "No extraction within " + timeout.toMillis() + " ms", e));
        } catch (ExecutionException e) {
            reporter.report(conversationId, asExtractionFailure(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            reporter.report(conversationId, new ExtractionException(ExtractionException.Kind.TIMEOUT,
                    "Interrupted while waiting for extraction", e));
        }
        return ExtractedFields.empty();
    }

    public String extractorName() {
        return extractor.name();
    }

    private static ExtractionException asExtractionFailure(Throwable cause) {
        if (cause instanceof ExtractionException) {
            return (ExtractionException) cause;
        }
        return new ExtractionException(ExtractionException.Kind.MALFORMED, "Extractor failed unexpectedly", cause);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private static final class ExtractorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "intake-extractor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
