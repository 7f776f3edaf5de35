package com.bit.governance.store;

import com.bit.governance.common.Address;
import com.bit.governance.common.ProposalId;
import com.bit.governance.common.StrategyId;
import com.bit.governance.database.DataBase;
import com.bit.governance.database.TableEnum;
import com.bit.governance.event.EventSink;
import com.bit.governance.event.GovernanceEvent;
import com.bit.governance.exception.ErrorType;
import com.bit.governance.exception.GovernanceException;
import com.bit.governance.structure.config.VotingConfig;
import com.bit.governance.structure.node.NodeBehaviorAnalysis;
import com.bit.governance.structure.node.NodeMetrics;
import com.bit.governance.structure.proposal.Proposal;
import com.bit.governance.structure.proposal.Vote;
import com.bit.governance.structure.strategy.StrategyExecution;
import com.bit.governance.structure.strategy.VotingStrategy;
import com.bit.governance.structure.voter.VoterInfo;
import com.bit.governance.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 治理数据仓库：类型化读取 + 全局计数器 + 原子提交
 * 事件只在提交成功后发布
 */
@Slf4j
@Component
@DependsOn("dbConfig")
public class GovernanceStore {

    public static final String PROPOSAL_COUNT = "proposal_count";
    public static final String STRATEGY_COUNT = "strategy_count";
    public static final String TOTAL_VOTING_POWER = "total_voting_power";

    private static final byte[] CONFIG_KEY = "voting_config".getBytes(StandardCharsets.UTF_8);

    private final DataBase dataBase;
    private final EventSink eventSink;

    public GovernanceStore(DataBase dataBase, EventSink eventSink) {
        this.dataBase = dataBase;
        this.eventSink = eventSink;
    }

    // ==================== 提交 ====================

    /**
     * 原子提交写集，成功后按顺序发布事件
     * @throws GovernanceException STORAGE_FAILED 提交失败，任何写入都不可见
     */
    public void commit(WriteSet writeSet) {
        if (!writeSet.getOperations().isEmpty()) {
            boolean ok;
            try {
                ok = dataBase.dataTransaction(new ArrayList<>(writeSet.getOperations()));
            } catch (RuntimeException e) {
                log.error("事务提交异常，操作数: {}", writeSet.getOperations().size(), e);
                throw new GovernanceException(ErrorType.STORAGE_FAILED, "事务提交失败", e);
            }
            if (!ok) {
                log.error("事务提交失败，操作数: {}", writeSet.getOperations().size());
                throw new GovernanceException(ErrorType.STORAGE_FAILED, "事务提交失败");
            }
        }
        for (GovernanceEvent event : writeSet.getEvents()) {
            eventSink.publish(event);
        }
    }

    /**
     * 不伴随写入的事件（如策略预演的推荐结果）
     */
    public void publish(GovernanceEvent event) {
        eventSink.publish(event);
    }

    // ==================== 计数器 ====================

    public long counter(String name) {
        byte[] bytes = dataBase.get(TableEnum.META, counterKey(name));
        return bytes == null ? 0L : ByteUtils.bytesToLong(bytes);
    }

    public void stageCounter(WriteSet writeSet, String name, long value) {
        writeSet.put(TableEnum.META, counterKey(name), ByteUtils.longToBytes(value));
    }

    private static byte[] counterKey(String name) {
        return name.getBytes(StandardCharsets.UTF_8);
    }

    // ==================== 提案/选票 ====================

    public Optional<Proposal> getProposal(ProposalId id) {
        byte[] bytes = getProposalBytes(id);
        return bytes == null ? Optional.empty() : Optional.of(decode(bytes, Proposal::deserialize));
    }

    /**
     * 提案原始序列化内容
     */
    public byte[] getProposalBytes(ProposalId id) {
        return dataBase.get(TableEnum.PROPOSAL, id.getBytes());
    }

    public void stageProposal(WriteSet writeSet, Proposal proposal) {
        writeSet.put(TableEnum.PROPOSAL, proposal.getId().getBytes(), proposal.serialize());
    }

    public Optional<Vote> getVote(ProposalId id, Address voter) {
        byte[] bytes = dataBase.get(TableEnum.VOTE, Vote.key(id, voter));
        return bytes == null ? Optional.empty() : Optional.of(decode(bytes, Vote::deserialize));
    }

    public boolean hasVoted(ProposalId id, Address voter) {
        return dataBase.isExist(TableEnum.VOTE, Vote.key(id, voter));
    }

    public void stageVote(WriteSet writeSet, Vote vote) {
        writeSet.put(TableEnum.VOTE, Vote.key(vote.getProposalId(), vote.getVoter()), vote.serialize());
    }

    // ==================== 投票人 ====================

    public Optional<VoterInfo> getVoter(Address address) {
        byte[] bytes = dataBase.get(TableEnum.VOTER, address.toBytes());
        return bytes == null ? Optional.empty() : Optional.of(decode(bytes, VoterInfo::deserialize));
    }

    public void stageVoter(WriteSet writeSet, VoterInfo voter) {
        writeSet.put(TableEnum.VOTER, voter.getAddress().toBytes(), voter.serialize());
    }

    // ==================== 配置 ====================

    public Optional<VotingConfig> getVotingConfig() {
        byte[] bytes = dataBase.get(TableEnum.CONFIG, CONFIG_KEY);
        return bytes == null ? Optional.empty() : Optional.of(decode(bytes, VotingConfig::deserialize));
    }

    public void stageVotingConfig(WriteSet writeSet, VotingConfig config) {
        writeSet.put(TableEnum.CONFIG, CONFIG_KEY, config.serialize());
    }

    // ==================== 策略 ====================

    public Optional<VotingStrategy> getStrategy(StrategyId id) {
        byte[] bytes = dataBase.get(TableEnum.STRATEGY, id.getBytes());
        return bytes == null ? Optional.empty() : Optional.of(decode(bytes, VotingStrategy::deserialize));
    }

    public List<VotingStrategy> listStrategies() {
        List<VotingStrategy> result = new ArrayList<>();
        dataBase.iterate(TableEnum.STRATEGY, (key, value) -> {
            result.add(decode(value, VotingStrategy::deserialize));
            return true;
        });
        return result;
    }

    public void stageStrategy(WriteSet writeSet, VotingStrategy strategy) {
        writeSet.put(TableEnum.STRATEGY, strategy.getId().getBytes(), strategy.serialize());
    }

    public Optional<StrategyExecution> getExecution(StrategyId id, long sequence) {
        byte[] bytes = dataBase.get(TableEnum.STRATEGY_EXECUTION, StrategyExecution.key(id, sequence));
        return bytes == null ? Optional.empty() : Optional.of(decode(bytes, StrategyExecution::deserialize));
    }

    public void stageExecution(WriteSet writeSet, StrategyExecution execution) {
        writeSet.put(TableEnum.STRATEGY_EXECUTION,
                StrategyExecution.key(execution.getStrategyId(), execution.getSequence()),
                execution.serialize());
    }

    // ==================== 节点 ====================

    public Optional<NodeMetrics> getNodeMetrics(Address node) {
        byte[] bytes = dataBase.get(TableEnum.NODE_METRICS, node.toBytes());
        return bytes == null ? Optional.empty() : Optional.of(decode(bytes, NodeMetrics::deserialize));
    }

    /**
     * 全部已上报指标的节点，按地址升序
     */
    public List<NodeMetrics> listNodeMetrics() {
        List<NodeMetrics> result = new ArrayList<>();
        dataBase.iterate(TableEnum.NODE_METRICS, (key, value) -> {
            result.add(decode(value, NodeMetrics::deserialize));
            return true;
        });
        return result;
    }

    public void stageNodeMetrics(WriteSet writeSet, NodeMetrics metrics) {
        writeSet.put(TableEnum.NODE_METRICS, metrics.getNodeAddress().toBytes(), metrics.serialize());
    }

    public Optional<NodeBehaviorAnalysis> getNodeAnalysis(Address node) {
        byte[] bytes = dataBase.get(TableEnum.NODE_ANALYSIS, node.toBytes());
        return bytes == null ? Optional.empty() : Optional.of(decode(bytes, NodeBehaviorAnalysis::deserialize));
    }

    public void stageNodeAnalysis(WriteSet writeSet, NodeBehaviorAnalysis analysis) {
        writeSet.put(TableEnum.NODE_ANALYSIS, analysis.getNodeAddress().toBytes(), analysis.serialize());
    }

    // ==================== 反序列化 ====================

    @FunctionalInterface
    private interface Decoder<T> {
        T decode(byte[] data) throws IOException;
    }

    private static <T> T decode(byte[] data, Decoder<T> decoder) {
        try {
            return decoder.decode(data);
        } catch (IOException e) {
            log.error("反序列化存储数据失败", e);
            throw new GovernanceException(ErrorType.STORAGE_FAILED, "存储数据损坏", e);
        }
    }
}
