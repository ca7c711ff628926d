package com.ai.intake.extraction;

import com.ai.intake.conversation.IntakeField;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionGatewayTest {

    private static final Set<IntakeField> MISSING = EnumSet.of(IntakeField.NAME);

    private final LoggingExtractionFailureReporter reporter = new LoggingExtractionFailureReporter();
    private final CountDownLatch release = new CountDownLatch(1);
    private ExtractionGateway gateway;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (gateway != null) gateway.shutdown();
    }

    private ExtractionGateway gateway(FieldExtractor extractor, Duration timeout) {
        gateway = new ExtractionGateway(extractor, reporter, timeout, 2);
        return gateway;
    }

    @Test
    void passesResultThrough() {
        ExtractedFields expected = ExtractedFields.builder().put(IntakeField.NAME, "Ann", 0.9).build();
        ExtractionGateway g = gateway(new FixedExtractor(() -> expected), Duration.ofSeconds(2));

        assertSame(expected, g.extract("c1", "I'm Ann", MISSING));
        assertEquals(0L, reporter.failureCounts().get(ExtractionException.Kind.TIMEOUT));
    }

    @Test
    void slowExtractorDegradesToEmpty() {
        ExtractionGateway g = gateway(new FixedExtractor(() -> {
            release.await(5, TimeUnit.SECONDS);
            return ExtractedFields.builder().put(IntakeField.NAME, "Late", 0.9).build();
        }), Duration.ofMillis(100));

        ExtractedFields fields = g.extract("c1", "hello", MISSING);

        assertTrue(fields.isEmpty());
        assertEquals(1L, reporter.failureCounts().get(ExtractionException.Kind.TIMEOUT));
    }

    @Test
    void extractorFailureIsReportedByKind() {
        ExtractionGateway g = gateway(new FixedExtractor(() -> {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED, "bad json");
        }), Duration.ofSeconds(2));

        assertTrue(g.extract("c1", "hello", MISSING).isEmpty());
        assertEquals(1L, reporter.failureCounts().get(ExtractionException.Kind.MALFORMED));
    }

    @Test
    void unexpectedExceptionCountsAsMalformed() {
        ExtractionGateway g = gateway(new FixedExtractor(() -> {
            throw new IllegalArgumentException("boom");
        }), Duration.ofSeconds(2));

        assertTrue(g.extract("c1", "hello", MISSING).isEmpty());
        assertEquals(1L, reporter.failureCounts().get(ExtractionException.Kind.MALFORMED));
    }

    @Test
    void nullResultIsEmpty() {
        ExtractionGateway g = gateway(new FixedExtractor(() -> null), Duration.ofSeconds(2));

        assertTrue(g.extract("c1", "hello", MISSING).isEmpty());
    }

    @Test
    void shutdownGatewayRejectsAsUnavailable() {
        ExtractionGateway g = gateway(new FixedExtractor(ExtractedFields::empty), Duration.ofSeconds(2));
        g.shutdown();

        assertTrue(g.extract("c1", "hello", MISSING).isEmpty());
        assertEquals(1L, reporter.failureCounts().get(ExtractionException.Kind.UNAVAILABLE));
    }

    interface Result {
        ExtractedFields get() throws Exception;
    }

    static final class FixedExtractor implements FieldExtractor {
        private final Result result;

        FixedExtractor(Result result) {
            this.result = result;
        }

        @Override
        public ExtractedFields extract(String text, Set<IntakeField> missingFields) {
            try {
                return result.get();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }

        @Override
        public String name() {
            return "fixed";
        }
    }
}
