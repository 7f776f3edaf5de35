package com.bit.governance.node.impl;

import com.bit.governance.auth.WitnessVerifier;
import com.bit.governance.common.Address;
import com.bit.governance.event.EventType;
import com.bit.governance.event.GovernanceEvent;
import com.bit.governance.exception.GovernanceException;
import com.bit.governance.node.BehaviorScoring;
import com.bit.governance.node.NodeBehaviorAnalyzer;
import com.bit.governance.store.GovernanceStore;
import com.bit.governance.store.KeyLocks;
import com.bit.governance.store.WriteSet;
import com.bit.governance.structure.node.NodeBehaviorAnalysis;
import com.bit.governance.structure.node.NodeMetrics;
import com.bit.governance.time.TimeSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class NodeBehaviorAnalyzerImpl implements NodeBehaviorAnalyzer {

    private final GovernanceStore store;
    private final WitnessVerifier witnessVerifier;
    private final TimeSource timeSource;
    private final KeyLocks keyLocks;

    @Override
    public NodeMetrics updateNodeMetrics(Address caller, Address node, int uptimePercentage, int performanceScore,
                                         long blocksProduced, int consensusParticipation) {
        if (caller == null || node == null) {
            throw GovernanceException.validation("调用方和节点地址不能为空");
        }
        checkPercentage("在线率", uptimePercentage);
        checkPercentage("性能评分", performanceScore);
        checkPercentage("共识参与率", consensusParticipation);
        if (blocksProduced < 0) {
            throw GovernanceException.validation("出块数不能为负");
        }

        return keyLocks.withLocks(() -> {
            long now = timeSource.now();
            Optional<NodeMetrics> previous = store.getNodeMetrics(node);
            if (previous.isPresent() && !previous.get().getReporter().equals(caller)
                    && !witnessVerifier.authorize(caller)) {
                throw GovernanceException.unauthorized("无权更新该节点指标: " + node);
            }

            NodeMetrics metrics = previous.orElseGet(() -> {
                NodeMetrics created = new NodeMetrics();
                created.setNodeAddress(node);
                created.setReporter(caller);
                return created;
            });
            int trend = previous.map(p -> BehaviorScoring.trend(p.getPerformanceScore(), performanceScore)).orElse(0);
            metrics.setUptimePercentage(uptimePercentage);
            metrics.setPerformanceScore(performanceScore);
            metrics.setBlocksProduced(blocksProduced);
            metrics.setConsensusParticipation(consensusParticipation);
            metrics.setLastUpdated(now);
            metrics.setTrendDirection(trend);
            metrics.appendHistory(performanceScore);

            WriteSet writeSet = new WriteSet();
            store.stageNodeMetrics(writeSet, metrics);
            writeSet.event(GovernanceEvent.of(EventType.NODE_METRICS_UPDATED, node.toHex(), caller.toHex(), now)
                    .with("uptimePercentage", uptimePercentage)
                    .with("performanceScore", performanceScore)
                    .with("trendDirection", trend));
            if (performanceScore < BehaviorScoring.MIN_HEALTHY_PERFORMANCE) {
                writeSet.event(GovernanceEvent.of(EventType.RISK_ALERT_GENERATED, node.toHex(), caller.toHex(), now)
                        .with("reason", "性能评分过低")
                        .with("performanceScore", performanceScore));
            }
            store.commit(writeSet);
            log.info("节点指标已更新: {} 在线率: {} 性能: {} 趋势: {}", node, uptimePercentage, performanceScore, trend);
            return metrics;
        }, KeyLocks.node(node));
    }

    @Override
    public NodeBehaviorAnalysis analyzeNodeBehavior(Address caller, Address node, int analysisPeriod) {
        if (caller == null || node == null) {
            throw GovernanceException.validation("调用方和节点地址不能为空");
        }
        if (analysisPeriod <= 0) {
            throw GovernanceException.validation("分析周期必须大于0");
        }
        return keyLocks.withLocks(() -> {
            NodeMetrics metrics = store.getNodeMetrics(node)
                    .orElseThrow(() -> GovernanceException.notFound("节点没有上报指标: " + node));
            long now = timeSource.now();

            NodeBehaviorAnalysis analysis = new NodeBehaviorAnalysis();
            analysis.setNodeAddress(node);
            analysis.setAnalysisPeriod(analysisPeriod);
            analysis.setReliabilityScore(BehaviorScoring.reliability(metrics));
            analysis.setConsistencyScore(BehaviorScoring.consistency(metrics.getPerformanceHistory()));
            analysis.setParticipationScore(metrics.getConsensusParticipation());
            analysis.setOverallScore(BehaviorScoring.overall(metrics));
            analysis.setRiskLevel(BehaviorScoring.riskLevel(metrics));
            analysis.setRiskScore(BehaviorScoring.riskScore(metrics));
            analysis.setRecommendation(BehaviorScoring.recommendation(analysis.getOverallScore()));
            analysis.setAnalysisTime(now);
            analysis.setAnalyst(caller);

            WriteSet writeSet = new WriteSet();
            store.stageNodeAnalysis(writeSet, analysis);
            writeSet.event(GovernanceEvent.of(EventType.COUNCIL_NODE_ANALYZED, node.toHex(), caller.toHex(), now)
                    .with("overallScore", analysis.getOverallScore())
                    .with("riskLevel", analysis.getRiskLevel().name())
                    .with("recommendation", analysis.getRecommendation()));
            store.commit(writeSet);
            log.info("节点行为分析完成: {} 综合评分: {} 风险: {}", node, analysis.getOverallScore(), analysis.getRiskLevel());
            return analysis;
        }, KeyLocks.node(node));
    }

    @Override
    public Optional<NodeMetrics> getNodeMetrics(Address node) {
        return store.getNodeMetrics(node);
    }

    @Override
    public Optional<NodeBehaviorAnalysis> getNodeAnalysis(Address node) {
        return store.getNodeAnalysis(node);
    }

    @Override
    public List<NodeMetrics> listNodeMetrics() {
        return store.listNodeMetrics();
    }

    private static void checkPercentage(String name, int value) {
        if (value < 0 || value > 100) {
            throw GovernanceException.validation(name + "必须在0~100之间: " + value);
        }
    }
}
