package com.docmend.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for suggestion generation and apply.
 */
@Service
public class DocmendMetrics {

    private final MeterRegistry registry;

    public DocmendMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param source "ai" or "fallback"
     * @param count  number of suggestions returned to the caller
     */
    public void recordGeneration(String source, int count) {
        Counter.builder("docmend.suggestions.generated")
                .tag("source", source)
                .register(registry)
                .increment();

        DistributionSummary.builder("docmend.suggestions.count")
                .tag("source", source)
                .register(registry)
                .record(count);
    }

    public void recordFallback(String reason) {
        Counter.builder("docmend.suggestions.fallbacks")
                .description("AI generations that degraded to the keyword fallback")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordLlmDuration(long ms) {
        Timer.builder("docmend.llm.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordApplyResult(int succeeded, int failed) {
        Counter.builder("docmend.apply.items")
                .tag("result", "success")
                .register(registry)
                .increment(succeeded);
        Counter.builder("docmend.apply.items")
                .tag("result", "error")
                .register(registry)
                .increment(failed);
    }

    public void recordBackupsCreated(int count) {
        Counter.builder("docmend.backups.created")
                .register(registry)
                .increment(count);
    }
}
