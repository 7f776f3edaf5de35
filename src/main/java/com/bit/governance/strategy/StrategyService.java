package com.bit.governance.strategy;

import com.bit.governance.common.Address;
import com.bit.governance.common.StrategyId;
import com.bit.governance.result.Result;
import com.bit.governance.structure.strategy.StrategyExecution;
import com.bit.governance.structure.strategy.StrategyOutcome;
import com.bit.governance.structure.strategy.StrategyType;
import com.bit.governance.structure.strategy.VotingStrategy;

import java.util.List;
import java.util.Optional;

/**
 * 投票策略与推荐
 * 风险过高、未到执行时间等预期内的失败以软拒绝 Result 返回，不抛异常
 */
public interface StrategyService {

    VotingStrategy createStrategy(Address caller, String name, String description, StrategyType type,
                                  int maxCandidates, int minPerformanceScore, boolean autoExecute,
                                  long executionInterval);

    /**
     * 执行策略（创建者或管理员）
     * @param dryRun 只生成推荐，不写入
     */
    Result<StrategyOutcome> executeStrategy(Address caller, StrategyId strategyId, boolean dryRun);

    /**
     * 到期的自动策略以创建者身份执行，并安排下一次执行时间
     */
    Result<StrategyOutcome> triggerAutomatedVoting(StrategyId strategyId);

    VotingStrategy deactivateStrategy(Address caller, StrategyId strategyId);

    Optional<VotingStrategy> getStrategy(StrategyId strategyId);

    Optional<StrategyExecution> getExecution(StrategyId strategyId, long sequence);

    /**
     * 已启用自动执行且到期的策略
     */
    List<VotingStrategy> dueStrategies();

    List<Address> getPerformanceBasedRecommendation(int maxCandidates, int minScore);

    List<Address> getRiskAdjustedRecommendation(int maxCandidates, int riskTolerance);

    List<Address> getDiversificationRecommendation(int maxCandidates);
}
