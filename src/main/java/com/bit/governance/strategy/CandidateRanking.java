package com.bit.governance.strategy;

import com.bit.governance.common.Address;
import com.bit.governance.node.BehaviorScoring;
import com.bit.governance.structure.node.NodeMetrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 候选节点排序与推荐
 */
public final class CandidateRanking {

    public static final int RISK_ADJUSTED_MIN_SCORE = 70;
    public static final int DEFAULT_RISK_TOLERANCE = 80;
    public static final int DIVERSIFICATION_MIN_SCORE = 60;

    private static final Comparator<NodeMetrics> BY_PERFORMANCE =
            Comparator.comparingInt(NodeMetrics::getPerformanceScore).reversed()
                    .thenComparing(NodeMetrics::getNodeAddress);

    private CandidateRanking() {
    }

    /**
     * 性能评分不低于 minScore 的节点，按性能降序、地址升序
     */
    public static List<Address> performanceBased(List<NodeMetrics> nodes, int maxCandidates, int minScore) {
        List<NodeMetrics> eligible = new ArrayList<>();
        for (NodeMetrics node : nodes) {
            if (node.getPerformanceScore() >= minScore) {
                eligible.add(node);
            }
        }
        eligible.sort(BY_PERFORMANCE);
        List<Address> result = new ArrayList<>();
        for (NodeMetrics node : eligible) {
            if (result.size() >= maxCandidates) {
                break;
            }
            result.add(node.getNodeAddress());
        }
        return result;
    }

    /**
     * 先取两倍候选，再剔除风险评分高于容忍度的节点
     */
    public static List<Address> riskAdjusted(List<NodeMetrics> nodes, int maxCandidates, int riskTolerance) {
        Map<Address, NodeMetrics> index = index(nodes);
        List<Address> result = new ArrayList<>();
        for (Address candidate : performanceBased(nodes, maxCandidates * 2, RISK_ADJUSTED_MIN_SCORE)) {
            if (result.size() >= maxCandidates) {
                break;
            }
            if (BehaviorScoring.riskScore(index.get(candidate)) <= riskTolerance) {
                result.add(candidate);
            }
        }
        return result;
    }

    /**
     * 先取三倍候选，再等距抽取
     */
    public static List<Address> diversification(List<NodeMetrics> nodes, int maxCandidates) {
        List<Address> all = performanceBased(nodes, maxCandidates * 3, DIVERSIFICATION_MIN_SCORE);
        int step = Math.max(1, all.size() / maxCandidates);
        List<Address> result = new ArrayList<>();
        for (int i = 0; i < all.size() && result.size() < maxCandidates; i += step) {
            result.add(all.get(i));
        }
        return result;
    }

    /**
     * 候选人风险评分的向下取整平均值，空集合为0
     */
    public static int aggregateRisk(List<Address> candidates, List<NodeMetrics> nodes) {
        if (candidates.isEmpty()) {
            return 0;
        }
        Map<Address, NodeMetrics> index = index(nodes);
        long total = 0;
        for (Address candidate : candidates) {
            NodeMetrics metrics = index.get(candidate);
            total += metrics == null ? 100 : BehaviorScoring.riskScore(metrics);
        }
        return (int) (total / candidates.size());
    }

    private static Map<Address, NodeMetrics> index(List<NodeMetrics> nodes) {
        Map<Address, NodeMetrics> index = new HashMap<>();
        for (NodeMetrics node : nodes) {
            index.put(node.getNodeAddress(), node);
        }
        return index;
    }
}
