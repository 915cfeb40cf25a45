package com.loteca.riskengine.infra.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
@RequiredArgsConstructor
public class RiskEvaluationMetrics {

    public static final String FALLBACK_COVERAGE = "coverage";
    public static final String FALLBACK_WEIGHT = "weight";
    public static final String FALLBACK_PAYTABLE = "paytable";

    private final MeterRegistry meterRegistry;

    public void recordEvaluation(long durationMicros, int simulations, int tickets) {
        Timer.builder("risk.evaluation.duration")
                .description("Portfolio risk evaluation latency")
                .register(meterRegistry)
                .record(durationMicros, TimeUnit.MICROSECONDS);
        Counter.builder("risk.evaluation.simulations")
                .description("Simulated rounds scored")
                .register(meterRegistry)
                .increment(simulations);
        Counter.builder("risk.evaluation.tickets")
                .description("Tickets scored per evaluation")
                .register(meterRegistry)
                .increment(tickets);
    }

    public void recordFallback(String kind, int occurrences) {
        if (occurrences <= 0) return;
        Counter.builder("risk.evaluation.fallback")
                .description("Recovered input conditions")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment(occurrences);
    }

    public void recordFailure(String error) {
        Counter.builder("risk.evaluation.failure")
                .tag("error", error)
                .register(meterRegistry)
                .increment();
    }
}
