package com.bit.governance.strategy.selector;

import com.bit.governance.common.Address;
import com.bit.governance.strategy.CandidateRanking;
import com.bit.governance.strategy.CandidateSelector;
import com.bit.governance.structure.node.NodeMetrics;
import com.bit.governance.structure.strategy.StrategyType;
import com.bit.governance.structure.strategy.VotingStrategy;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class RiskAdjustedSelector implements CandidateSelector {

    @Override
    public StrategyType type() {
        return StrategyType.RISK_ADJUSTED;
    }

    @Override
    public List<Address> select(VotingStrategy strategy, List<NodeMetrics> nodes) {
        return CandidateRanking.riskAdjusted(nodes, strategy.getMaxCandidates(), CandidateRanking.DEFAULT_RISK_TOLERANCE);
    }
}
