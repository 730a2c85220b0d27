package com.starkiller.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for checkpoint shifts.
 */
@Service
public class StarkillerMetrics {

    private final MeterRegistry registry;

    public StarkillerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEncounterGenerated(boolean shouldApprove, boolean storyShip) {
        Counter.builder("starkiller.encounters.generated")
                .tag("verdict", shouldApprove ? "approve" : "deny")
                .tag("story", String.valueOf(storyShip))
                .register(registry)
                .increment();
    }

    public void recordInvalidReason(String reason) {
        Counter.builder("starkiller.encounters.invalid")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts generations that fell back to the default ship and captain.
     */
    public void recordDegradedMatch() {
        Counter.builder("starkiller.encounters.degraded")
                .description("Encounters generated with the fallback ship and captain")
                .register(registry)
                .increment();
    }

    public void recordDecision(boolean correct) {
        Counter.builder("starkiller.decisions.total")
                .tag("result", correct ? "correct" : "wrong")
                .register(registry)
                .increment();
    }

    public void recordBranchChange(String branch) {
        Counter.builder("starkiller.narrative.branch_changes")
                .tag("branch", branch)
                .register(registry)
                .increment();
    }

    public void recordTokenTriggered(String sourceDecision) {
        Counter.builder("starkiller.consequences.triggered")
                .tag("source", sourceDecision)
                .register(registry)
                .increment();
    }

    public void recordBribe(int amount) {
        DistributionSummary.builder("starkiller.bribes.accepted")
                .baseUnit("credits")
                .register(registry)
                .record(amount);
    }
}
