package com.bit.governance.structure.strategy;

import com.bit.governance.common.Address;
import com.bit.governance.common.StrategyId;
import com.bit.governance.proto.Structure;
import com.google.protobuf.ByteString;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

/**
 * 投票策略
 */
@Data
@NoArgsConstructor
public class VotingStrategy {
    private StrategyId id;
    private String name;
    private String description;
    private Address creator;
    private StrategyType strategyType;
    //1~100
    private int maxCandidates;
    //0~100
    private int minPerformanceScore;
    private boolean autoExecute;
    //秒
    private long executionInterval;
    private long createdAt;
    private long lastExecution;
    private long nextExecution;
    private boolean active;
    private int executionCount;

    public byte[] serialize() {
        return toProto().toByteArray();
    }

    public static VotingStrategy deserialize(byte[] data) throws IOException {
        return fromProto(Structure.ProtoVotingStrategy.parseFrom(data));
    }

    public Structure.ProtoVotingStrategy toProto() {
        return Structure.ProtoVotingStrategy.newBuilder()
                .setId(ByteString.copyFrom(id.getBytes()))
                .setName(name)
                .setDescription(description == null ? "" : description)
                .setCreator(ByteString.copyFrom(creator.toBytes()))
                .setStrategyType(strategyType.getCode())
                .setMaxCandidates(maxCandidates)
                .setMinPerformanceScore(minPerformanceScore)
                .setAutoExecute(autoExecute)
                .setExecutionInterval(executionInterval)
                .setCreatedAt(createdAt)
                .setLastExecution(lastExecution)
                .setNextExecution(nextExecution)
                .setActive(active)
                .setExecutionCount(executionCount)
                .build();
    }

    public static VotingStrategy fromProto(Structure.ProtoVotingStrategy proto) {
        VotingStrategy strategy = new VotingStrategy();
        strategy.setId(StrategyId.fromBytes(proto.getId().toByteArray()));
        strategy.setName(proto.getName());
        strategy.setDescription(proto.getDescription());
        strategy.setCreator(Address.fromBytes(proto.getCreator().toByteArray()));
        strategy.setStrategyType(StrategyType.fromCode(proto.getStrategyType()));
        strategy.setMaxCandidates(proto.getMaxCandidates());
        strategy.setMinPerformanceScore(proto.getMinPerformanceScore());
        strategy.setAutoExecute(proto.getAutoExecute());
        strategy.setExecutionInterval(proto.getExecutionInterval());
        strategy.setCreatedAt(proto.getCreatedAt());
        strategy.setLastExecution(proto.getLastExecution());
        strategy.setNextExecution(proto.getNextExecution());
        strategy.setActive(proto.getActive());
        strategy.setExecutionCount(proto.getExecutionCount());
        return strategy;
    }
}
