package com.bit.governance.strategy.selector;

import com.bit.governance.common.Address;
import com.bit.governance.strategy.CandidateRanking;
import com.bit.governance.strategy.CandidateSelector;
import com.bit.governance.structure.node.NodeMetrics;
import com.bit.governance.structure.strategy.StrategyType;
import com.bit.governance.structure.strategy.VotingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 模型评分未接入，按性能排序选择
 */
@Slf4j
@Component
public class MlDrivenSelector implements CandidateSelector {

    @Override
    public StrategyType type() {
        return StrategyType.ML_DRIVEN;
    }

    @Override
    public List<Address> select(VotingStrategy strategy, List<NodeMetrics> nodes) {
        log.debug("策略{}使用性能排序代替模型评分", strategy.getId());
        return CandidateRanking.performanceBased(nodes, strategy.getMaxCandidates(), strategy.getMinPerformanceScore());
    }
}
