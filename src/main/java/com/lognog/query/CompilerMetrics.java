package com.lognog.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics collector for query compilation
 * Tracks compiled and rejected queries, the phase rejecting them,
 * dry-run validations and compile latency
 */
@Component
public class CompilerMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter compileSucceeded;
    private final Map<CompilePhase, Counter> compileFailed = new EnumMap<>(CompilePhase.class);
    private Counter validateRequests;
    private Timer compileLatency;

    @PostConstruct
    public void init() {
        compileSucceeded = Counter.builder("lognog.dsl.compile.succeeded")
            .description("Total number of queries compiled to SQL")
            .register(meterRegistry);

        for (CompilePhase phase : CompilePhase.values()) {
            compileFailed.put(phase, Counter.builder("lognog.dsl.compile.failed")
                .description("Total number of queries rejected, by failing phase")
                .tag("phase", phase.getValue())
                .register(meterRegistry));
        }

        validateRequests = Counter.builder("lognog.dsl.validate.requests")
            .description("Total number of dry-run validations")
            .register(meterRegistry);

        // Compilation is expected in low single-digit milliseconds
        compileLatency = Timer.builder("lognog.dsl.compile.latency")
            .description("Latency of query compilation")
            .publishPercentiles(0.5, 0.95, 0.99) // P50, P95, P99
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofNanos(10_000))
            .maximumExpectedValue(Duration.ofSeconds(1))
            .register(meterRegistry);
    }

    public void recordCompileSucceeded() {
        compileSucceeded.increment();
    }

    public void recordCompileFailed(CompilePhase phase) {
        compileFailed.get(phase).increment();
    }

    public void recordValidateRequest() {
        validateRequests.increment();
    }

    public Timer.Sample startCompileTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordCompileLatency(Timer.Sample sample) {
        sample.stop(compileLatency);
    }

    public Counter getCompileSucceeded() {
        return compileSucceeded;
    }

    public Counter getCompileFailed(CompilePhase phase) {
        return compileFailed.get(phase);
    }

    public Counter getValidateRequests() {
        return validateRequests;
    }

    public Timer getCompileLatency() {
        return compileLatency;
    }
}
