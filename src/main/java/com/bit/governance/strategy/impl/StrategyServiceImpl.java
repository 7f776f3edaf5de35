package com.bit.governance.strategy.impl;

import com.bit.governance.auth.WitnessVerifier;
import com.bit.governance.common.Address;
import com.bit.governance.common.ContentIdGenerator;
import com.bit.governance.common.StrategyId;
import com.bit.governance.config.SystemConfig;
import com.bit.governance.event.EventType;
import com.bit.governance.event.GovernanceEvent;
import com.bit.governance.exception.GovernanceException;
import com.bit.governance.result.Result;
import com.bit.governance.store.GovernanceStore;
import com.bit.governance.store.KeyLocks;
import com.bit.governance.store.WriteSet;
import com.bit.governance.strategy.CandidateRanking;
import com.bit.governance.strategy.CandidateSelector;
import com.bit.governance.strategy.StrategyService;
import com.bit.governance.structure.node.NodeMetrics;
import com.bit.governance.structure.strategy.StrategyExecution;
import com.bit.governance.structure.strategy.StrategyOutcome;
import com.bit.governance.structure.strategy.StrategyType;
import com.bit.governance.structure.strategy.VotingStrategy;
import com.bit.governance.time.TimeSource;
import com.bit.governance.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class StrategyServiceImpl implements StrategyService {

    public static final int MAX_CANDIDATES_LIMIT = 100;
    // now + interval 不得溢出
    public static final long MAX_EXECUTION_INTERVAL = Long.MAX_VALUE / 4;

    private final GovernanceStore store;
    private final WitnessVerifier witnessVerifier;
    private final TimeSource timeSource;
    private final KeyLocks keyLocks;
    private final SystemConfig systemConfig;
    private final Map<StrategyType, CandidateSelector> selectors = new EnumMap<>(StrategyType.class);

    public StrategyServiceImpl(GovernanceStore store, WitnessVerifier witnessVerifier, TimeSource timeSource,
                               KeyLocks keyLocks, SystemConfig systemConfig, List<CandidateSelector> selectors) {
        this.store = store;
        this.witnessVerifier = witnessVerifier;
        this.timeSource = timeSource;
        this.keyLocks = keyLocks;
        this.systemConfig = systemConfig;
        for (CandidateSelector selector : selectors) {
            if (this.selectors.put(selector.type(), selector) != null) {
                throw new IllegalStateException("重复的候选人选择器: " + selector.type());
            }
        }
        for (StrategyType type : StrategyType.values()) {
            if (!this.selectors.containsKey(type)) {
                throw new IllegalStateException("缺少候选人选择器: " + type);
            }
        }
    }

    @Override
    public VotingStrategy createStrategy(Address caller, String name, String description, StrategyType type,
                                         int maxCandidates, int minPerformanceScore, boolean autoExecute,
                                         long executionInterval) {
        if (caller == null) {
            throw GovernanceException.validation("调用方不能为空");
        }
        if (name == null || name.isBlank()) {
            throw GovernanceException.validation("策略名称不能为空");
        }
        if (type == null) {
            throw GovernanceException.validation("策略类型不能为空");
        }
        if (maxCandidates < 1 || maxCandidates > MAX_CANDIDATES_LIMIT) {
            throw GovernanceException.validation("候选人数量必须在1~" + MAX_CANDIDATES_LIMIT + "之间");
        }
        if (minPerformanceScore < 0 || minPerformanceScore > 100) {
            throw GovernanceException.validation("最低性能评分必须在0~100之间");
        }
        if (executionInterval < 0 || (autoExecute && executionInterval == 0)) {
            throw GovernanceException.validation("自动执行的策略必须设置执行间隔");
        }
        if (executionInterval > MAX_EXECUTION_INTERVAL) {
            throw GovernanceException.validation("执行间隔过大: " + executionInterval);
        }

        return keyLocks.withLocks(() -> {
            long now = timeSource.now();
            long count = store.counter(GovernanceStore.STRATEGY_COUNT);
            byte[] entropy = ByteUtils.concat(caller.toBytes(), name.getBytes(StandardCharsets.UTF_8));
            StrategyId id = ContentIdGenerator.strategyId(now, count, entropy);
            if (store.getStrategy(id).isPresent()) {
                throw GovernanceException.conflict("策略ID冲突: " + id);
            }

            VotingStrategy strategy = new VotingStrategy();
            strategy.setId(id);
            strategy.setName(name);
            strategy.setDescription(description == null ? "" : description);
            strategy.setCreator(caller);
            strategy.setStrategyType(type);
            strategy.setMaxCandidates(maxCandidates);
            strategy.setMinPerformanceScore(minPerformanceScore);
            strategy.setAutoExecute(autoExecute);
            strategy.setExecutionInterval(executionInterval);
            strategy.setCreatedAt(now);
            strategy.setNextExecution(now + executionInterval);
            strategy.setActive(true);

            WriteSet writeSet = new WriteSet();
            store.stageStrategy(writeSet, strategy);
            store.stageCounter(writeSet, GovernanceStore.STRATEGY_COUNT, count + 1);
            writeSet.event(GovernanceEvent.of(EventType.STRATEGY_CREATED, id.toHex(), caller.toHex(), now)
                    .with("name", name)
                    .with("strategyType", type.name())
                    .with("autoExecute", autoExecute));
            store.commit(writeSet);
            log.info("策略创建成功: {} 类型: {} 创建者: {}", id, type, caller);
            return strategy;
        }, KeyLocks.counter(GovernanceStore.STRATEGY_COUNT));
    }

    @Override
    public Result<StrategyOutcome> executeStrategy(Address caller, StrategyId strategyId, boolean dryRun) {
        if (caller == null || strategyId == null) {
            throw GovernanceException.validation("调用方和策略ID不能为空");
        }
        return keyLocks.withLocks(() -> {
            VotingStrategy strategy = requireStrategy(strategyId);
            if (!strategy.getCreator().equals(caller) && !witnessVerifier.authorize(caller)) {
                throw GovernanceException.unauthorized("只有创建者或管理员可以执行策略");
            }
            if (!strategy.isActive()) {
                throw GovernanceException.conflict("策略已停用: " + strategyId);
            }
            long now = timeSource.now();
            return run(strategy, caller, dryRun, now, new WriteSet());
        }, KeyLocks.strategy(strategyId));
    }

    @Override
    public Result<StrategyOutcome> triggerAutomatedVoting(StrategyId strategyId) {
        return keyLocks.withLocks(() -> {
            VotingStrategy strategy = requireStrategy(strategyId);
            long now = timeSource.now();
            if (!strategy.isAutoExecute() || !strategy.isActive()) {
                log.warn("策略未启用自动执行: {}", strategyId);
                return Result.rejected("策略未启用自动执行", null);
            }
            if (now < strategy.getNextExecution()) {
                log.warn("策略未到执行时间: {} 下次执行: {}", strategyId, strategy.getNextExecution());
                return Result.rejected("未到执行时间", null);
            }
            // 无论风险拦截与否都推进调度，避免每个调度周期重复告警
            strategy.setNextExecution(now + strategy.getExecutionInterval());
            WriteSet writeSet = new WriteSet();
            store.stageStrategy(writeSet, strategy);
            writeSet.event(GovernanceEvent.of(EventType.AUTOMATED_VOTING_TRIGGERED, strategyId.toHex(),
                            strategy.getCreator().toHex(), now)
                    .with("nextExecution", strategy.getNextExecution()));
            return run(strategy, strategy.getCreator(), false, now, writeSet);
        }, KeyLocks.strategy(strategyId));
    }

    /**
     * 选人 → 风险评估 → 预演或落库
     * @param writeSet 调用方预先放入的写入/事件，和执行记录一起提交
     */
    private Result<StrategyOutcome> run(VotingStrategy strategy, Address executor, boolean dryRun, long now,
                                        WriteSet writeSet) {
        StrategyId strategyId = strategy.getId();
        List<NodeMetrics> nodes = store.listNodeMetrics();
        List<Address> candidates = selectors.get(strategy.getStrategyType()).select(strategy, nodes);
        int riskScore = CandidateRanking.aggregateRisk(candidates, nodes);

        int threshold = systemConfig.getStrategy().getRiskThreshold();
        if (riskScore > threshold) {
            writeSet.event(GovernanceEvent.of(EventType.RISK_ALERT_GENERATED, strategyId.toHex(), executor.toHex(), now)
                    .with("reason", "策略候选人风险过高")
                    .with("riskScore", riskScore)
                    .with("threshold", threshold));
            store.commit(writeSet);
            log.warn("策略执行被风险拦截: {} 风险评分: {} 阈值: {}", strategyId, riskScore, threshold);
            return Result.rejected("风险评分过高: " + riskScore,
                    new StrategyOutcome(strategyId, candidates, riskScore, dryRun, 0));
        }

        if (dryRun) {
            store.publish(GovernanceEvent.of(EventType.VOTING_RECOMMENDATION_GENERATED, strategyId.toHex(),
                            executor.toHex(), now)
                    .with("candidates", toHex(candidates))
                    .with("riskScore", riskScore));
            log.info("策略预演完成: {} 候选人: {}", strategyId, candidates.size());
            return Result.OK(new StrategyOutcome(strategyId, candidates, riskScore, true, 0));
        }

        int sequence = strategy.getExecutionCount() + 1;
        strategy.setExecutionCount(sequence);
        strategy.setLastExecution(now);

        StrategyExecution execution = new StrategyExecution();
        execution.setStrategyId(strategyId);
        execution.setSequence(sequence);
        execution.setExecutor(executor);
        execution.setExecutionTime(now);
        execution.setSelectedCandidates(new ArrayList<>(candidates));
        execution.setRiskScore(riskScore);
        execution.setSuccess(true);

        store.stageStrategy(writeSet, strategy);
        store.stageExecution(writeSet, execution);
        writeSet.event(GovernanceEvent.of(EventType.STRATEGY_EXECUTED, strategyId.toHex(), executor.toHex(), now)
                .with("sequence", sequence)
                .with("candidates", toHex(candidates))
                .with("riskScore", riskScore));
        store.commit(writeSet);
        log.info("策略执行成功: {} 第{}次 候选人: {}", strategyId, sequence, candidates.size());
        return Result.OK(new StrategyOutcome(strategyId, candidates, riskScore, false, sequence));
    }

    @Override
    public VotingStrategy deactivateStrategy(Address caller, StrategyId strategyId) {
        return keyLocks.withLocks(() -> {
            VotingStrategy strategy = requireStrategy(strategyId);
            if (!strategy.getCreator().equals(caller) && !witnessVerifier.authorize(caller)) {
                throw GovernanceException.unauthorized("只有创建者或管理员可以停用策略");
            }
            if (!strategy.isActive()) {
                throw GovernanceException.conflict("策略已停用: " + strategyId);
            }
            long now = timeSource.now();
            strategy.setActive(false);

            WriteSet writeSet = new WriteSet();
            store.stageStrategy(writeSet, strategy);
            writeSet.event(GovernanceEvent.of(EventType.STRATEGY_DEACTIVATED, strategyId.toHex(), caller.toHex(), now));
            store.commit(writeSet);
            log.info("策略已停用: {}", strategyId);
            return strategy;
        }, KeyLocks.strategy(strategyId));
    }

    @Override
    public Optional<VotingStrategy> getStrategy(StrategyId strategyId) {
        return store.getStrategy(strategyId);
    }

    @Override
    public Optional<StrategyExecution> getExecution(StrategyId strategyId, long sequence) {
        return store.getExecution(strategyId, sequence);
    }

    @Override
    public List<VotingStrategy> dueStrategies() {
        long now = timeSource.now();
        List<VotingStrategy> due = new ArrayList<>();
        for (VotingStrategy strategy : store.listStrategies()) {
            if (strategy.isActive() && strategy.isAutoExecute() && now >= strategy.getNextExecution()) {
                due.add(strategy);
            }
        }
        return due;
    }

    @Override
    public List<Address> getPerformanceBasedRecommendation(int maxCandidates, int minScore) {
        checkMaxCandidates(maxCandidates);
        return CandidateRanking.performanceBased(store.listNodeMetrics(), maxCandidates, minScore);
    }

    @Override
    public List<Address> getRiskAdjustedRecommendation(int maxCandidates, int riskTolerance) {
        checkMaxCandidates(maxCandidates);
        return CandidateRanking.riskAdjusted(store.listNodeMetrics(), maxCandidates, riskTolerance);
    }

    @Override
    public List<Address> getDiversificationRecommendation(int maxCandidates) {
        checkMaxCandidates(maxCandidates);
        return CandidateRanking.diversification(store.listNodeMetrics(), maxCandidates);
    }

    private VotingStrategy requireStrategy(StrategyId strategyId) {
        return store.getStrategy(strategyId)
                .orElseThrow(() -> GovernanceException.notFound("策略不存在: " + strategyId));
    }

    private static void checkMaxCandidates(int maxCandidates) {
        if (maxCandidates < 1 || maxCandidates > MAX_CANDIDATES_LIMIT) {
            throw GovernanceException.validation("候选人数量必须在1~" + MAX_CANDIDATES_LIMIT + "之间");
        }
    }

    private static List<String> toHex(List<Address> addresses) {
        List<String> result = new ArrayList<>(addresses.size());
        for (Address address : addresses) {
            result.add(address.toHex());
        }
        return result;
    }
}
