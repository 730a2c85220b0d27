package com.starkiller.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StarkillerMetricsTest {

    private SimpleMeterRegistry registry;
    private StarkillerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new StarkillerMetrics(registry);
    }

    @Test
    @DisplayName("recordEncounterGenerated tags verdict and story")
    void recordEncounterGenerated() {
        metrics.recordEncounterGenerated(true, false);
        metrics.recordEncounterGenerated(false, true);
        metrics.recordEncounterGenerated(false, true);

        var routine = registry.find("starkiller.encounters.generated")
                .tag("verdict", "approve").tag("story", "false").counter();
        var story = registry.find("starkiller.encounters.generated")
                .tag("verdict", "deny").tag("story", "true").counter();

        assertNotNull(routine);
        assertNotNull(story);
        assertEquals(1.0, routine.count());
        assertEquals(2.0, story.count());
    }

    @Test
    @DisplayName("recordDecision increments correct counter")
    void recordDecision() {
        metrics.recordDecision(true);
        metrics.recordDecision(false);
        metrics.recordDecision(false);

        assertEquals(1.0, registry.find("starkiller.decisions.total").tag("result", "correct").counter().count());
        assertEquals(2.0, registry.find("starkiller.decisions.total").tag("result", "wrong").counter().count());
    }

    @Test
    @DisplayName("recordInvalidReason records by reason tag")
    void recordInvalidReason() {
        metrics.recordInvalidReason("FORGED_ACCESS_CODE");

        var counter = registry.find("starkiller.encounters.invalid").tag("reason", "FORGED_ACCESS_CODE").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordDegradedMatch counts fallbacks")
    void recordDegradedMatch() {
        metrics.recordDegradedMatch();
        metrics.recordDegradedMatch();

        assertEquals(2.0, registry.find("starkiller.encounters.degraded").counter().count());
    }

    @Test
    @DisplayName("recordBranchChange and recordTokenTriggered tag their subject")
    void branchAndToken() {
        metrics.recordBranchChange("IMPERIUM_PATH");
        metrics.recordTokenTriggered("BRIBE_ACCEPTED");

        assertNotNull(registry.find("starkiller.narrative.branch_changes").tag("branch", "IMPERIUM_PATH").counter());
        assertNotNull(registry.find("starkiller.consequences.triggered").tag("source", "BRIBE_ACCEPTED").counter());
    }

    @Test
    @DisplayName("recordBribe creates a distribution summary")
    void recordBribe() {
        metrics.recordBribe(100);
        metrics.recordBribe(50);

        var summary = registry.find("starkiller.bribes.accepted").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(150.0, summary.totalAmount());
    }
}
