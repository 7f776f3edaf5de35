package com.bit.governance.node;

import com.bit.governance.structure.node.NodeMetrics;
import com.bit.governance.structure.node.RiskLevel;

import java.util.List;

/**
 * 节点评分规则，纯函数，评分均为 0~100 的整数
 */
public final class BehaviorScoring {

    public static final int CONSISTENCY_BASELINE = 85;
    public static final int MIN_HEALTHY_UPTIME = 90;
    public static final int MIN_HEALTHY_PERFORMANCE = 70;

    private BehaviorScoring() {
    }

    public static int reliability(NodeMetrics metrics) {
        return (metrics.getUptimePercentage() + metrics.getPerformanceScore()) / 2;
    }

    /**
     * 样本不足两个时取基线，否则 100 - (最高 - 最低)
     */
    public static int consistency(List<Integer> history) {
        if (history == null || history.size() < 2) {
            return CONSISTENCY_BASELINE;
        }
        int max = Integer.MIN_VALUE;
        int min = Integer.MAX_VALUE;
        for (int score : history) {
            max = Math.max(max, score);
            min = Math.min(min, score);
        }
        return clamp(100 - (max - min));
    }

    public static int overall(NodeMetrics metrics) {
        return (metrics.getUptimePercentage() + metrics.getPerformanceScore()) / 2;
    }

    public static RiskLevel riskLevel(NodeMetrics metrics) {
        if (metrics.getUptimePercentage() < MIN_HEALTHY_UPTIME
                || metrics.getPerformanceScore() < MIN_HEALTHY_PERFORMANCE) {
            return RiskLevel.HIGH;
        }
        return RiskLevel.LOW;
    }

    public static int riskScore(NodeMetrics metrics) {
        return clamp(100 - overall(metrics));
    }

    public static String recommendation(int overallScore) {
        if (overallScore >= 90) {
            return "Excellent";
        }
        if (overallScore >= 80) {
            return "Good";
        }
        if (overallScore >= 70) {
            return "Fair";
        }
        return "Poor";
    }

    public static int trend(int previousPerformance, int currentPerformance) {
        return Integer.compare(currentPerformance, previousPerformance);
    }

    static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
