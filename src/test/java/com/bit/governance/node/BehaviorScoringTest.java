package com.bit.governance.node;

import com.bit.governance.structure.node.NodeMetrics;
import com.bit.governance.structure.node.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class BehaviorScoringTest {

    private static NodeMetrics metrics(int uptime, int performance) {
        NodeMetrics metrics = new NodeMetrics();
        metrics.setUptimePercentage(uptime);
        metrics.setPerformanceScore(performance);
        return metrics;
    }

    @Test
    void overallAndReliabilityAreFloorAverages() {
        NodeMetrics m = metrics(95, 80);
        assertEquals(87, BehaviorScoring.overall(m));
        assertEquals(87, BehaviorScoring.reliability(m));
        assertEquals(13, BehaviorScoring.riskScore(m));
    }

    @Test
    void riskLevelIsHighBelowHealthyLimits() {
        assertEquals(RiskLevel.LOW, BehaviorScoring.riskLevel(metrics(90, 70)));
        assertEquals(RiskLevel.HIGH, BehaviorScoring.riskLevel(metrics(89, 100)));
        assertEquals(RiskLevel.HIGH, BehaviorScoring.riskLevel(metrics(100, 69)));
    }

    @Test
    void recommendationBands() {
        assertEquals("Excellent", BehaviorScoring.recommendation(90));
        assertEquals("Good", BehaviorScoring.recommendation(89));
        assertEquals("Good", BehaviorScoring.recommendation(80));
        assertEquals("Fair", BehaviorScoring.recommendation(70));
        assertEquals("Poor", BehaviorScoring.recommendation(69));
    }

    @Test
    void consistencyUsesBaselineUntilTwoSamples() {
        assertEquals(85, BehaviorScoring.consistency(Collections.emptyList()));
        assertEquals(85, BehaviorScoring.consistency(Collections.singletonList(40)));
        assertEquals(100, BehaviorScoring.consistency(Arrays.asList(80, 80)));
        assertEquals(70, BehaviorScoring.consistency(Arrays.asList(90, 60, 75)));
        assertEquals(0, BehaviorScoring.consistency(Arrays.asList(0, 100)));
    }

    @Test
    void trendFollowsPerformanceChange() {
        assertEquals(1, BehaviorScoring.trend(70, 80));
        assertEquals(0, BehaviorScoring.trend(80, 80));
        assertEquals(-1, BehaviorScoring.trend(80, 60));
    }
}
