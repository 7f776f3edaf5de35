package com.bit.governance.strategy;

import com.bit.governance.common.Address;
import com.bit.governance.structure.node.NodeMetrics;
import com.bit.governance.structure.strategy.StrategyType;
import com.bit.governance.structure.strategy.VotingStrategy;

import java.util.List;

/**
 * 按策略类型从已上报指标的节点中挑选候选人
 */
public interface CandidateSelector {

    StrategyType type();

    /**
     * @param nodes 全部已上报指标的节点
     * @return 选中的候选人，有序，数量不超过 strategy.maxCandidates
     */
    List<Address> select(VotingStrategy strategy, List<NodeMetrics> nodes);
}
