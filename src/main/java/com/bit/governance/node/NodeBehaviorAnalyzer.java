package com.bit.governance.node;

import com.bit.governance.common.Address;
import com.bit.governance.structure.node.NodeBehaviorAnalysis;
import com.bit.governance.structure.node.NodeMetrics;

import java.util.List;
import java.util.Optional;

public interface NodeBehaviorAnalyzer {

    /**
     * 上报节点指标。首个上报者拥有该节点记录，其他调用方需要管理员权限
     */
    NodeMetrics updateNodeMetrics(Address caller, Address node, int uptimePercentage, int performanceScore,
                                  long blocksProduced, int consensusParticipation);

    /**
     * 基于最新指标全量重算行为分析并保存
     */
    NodeBehaviorAnalysis analyzeNodeBehavior(Address caller, Address node, int analysisPeriod);

    Optional<NodeMetrics> getNodeMetrics(Address node);

    Optional<NodeBehaviorAnalysis> getNodeAnalysis(Address node);

    List<NodeMetrics> listNodeMetrics();
}
