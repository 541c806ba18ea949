package com.lognog.query;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CompilerMetrics
 */
@DisplayName("CompilerMetrics Tests")
class CompilerMetricsTest {

    private CompilerMetrics metrics;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new CompilerMetrics();
        metrics.meterRegistry = meterRegistry;
        metrics.init();
    }

    @Test
    @DisplayName("Should initialize all metrics on startup")
    void shouldInitializeAllMetrics() {
        assertThat(metrics.getCompileSucceeded()).isNotNull();
        assertThat(metrics.getValidateRequests()).isNotNull();
        assertThat(metrics.getCompileLatency()).isNotNull();
        for (CompilePhase phase : CompilePhase.values()) {
            assertThat(metrics.getCompileFailed(phase)).isNotNull();
        }
    }

    @Test
    @DisplayName("Should count failures per phase")
    void shouldCountFailuresPerPhase() {
        // When
        metrics.recordCompileFailed(CompilePhase.PARSE);
        metrics.recordCompileFailed(CompilePhase.PARSE);
        metrics.recordCompileFailed(CompilePhase.RESOLVE);

        // Then
        assertThat(metrics.getCompileFailed(CompilePhase.PARSE).count()).isEqualTo(2.0);
        assertThat(metrics.getCompileFailed(CompilePhase.RESOLVE).count()).isEqualTo(1.0);
        assertThat(metrics.getCompileFailed(CompilePhase.LEX).count()).isZero();
        assertThat(meterRegistry.get("lognog.dsl.compile.failed").tag("phase", "parse").counter().count())
            .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should count successes and validations")
    void shouldCountSuccessesAndValidations() {
        metrics.recordCompileSucceeded();
        metrics.recordValidateRequest();
        metrics.recordValidateRequest();

        assertThat(meterRegistry.get("lognog.dsl.compile.succeeded").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getValidateRequests().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should record compile latency")
    void shouldRecordLatency() {
        // When
        Timer.Sample sample = metrics.startCompileTimer();
        metrics.recordCompileLatency(sample);

        // Then
        Timer timer = meterRegistry.get("lognog.dsl.compile.latency").timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isGreaterThanOrEqualTo(0.0);
    }
}
