package com.bit.governance.structure.strategy;

import com.bit.governance.common.Address;
import com.bit.governance.common.StrategyId;
import com.bit.governance.proto.Structure;
import com.bit.governance.util.ByteUtils;
import com.google.protobuf.ByteString;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 策略执行记录
 */
@Data
@NoArgsConstructor
public class StrategyExecution {
    private StrategyId strategyId;
    //执行后的 executionCount
    private int sequence;
    private Address executor;
    private long executionTime;
    private List<Address> selectedCandidates = new ArrayList<>();
    private int riskScore;
    private boolean success;

    /**
     * 存储键：策略ID ‖ 序号(8字节大端)
     */
    public static byte[] key(StrategyId strategyId, long sequence) {
        return ByteUtils.concat(strategyId.getBytes(), ByteUtils.longToBytes(sequence));
    }

    public byte[] serialize() {
        return toProto().toByteArray();
    }

    public static StrategyExecution deserialize(byte[] data) throws IOException {
        return fromProto(Structure.ProtoStrategyExecution.parseFrom(data));
    }

    public Structure.ProtoStrategyExecution toProto() {
        Structure.ProtoStrategyExecution.Builder builder = Structure.ProtoStrategyExecution.newBuilder()
                .setStrategyId(ByteString.copyFrom(strategyId.getBytes()))
                .setSequence(sequence)
                .setExecutor(ByteString.copyFrom(executor.toBytes()))
                .setExecutionTime(executionTime)
                .setRiskScore(riskScore)
                .setSuccess(success);
        for (Address candidate : selectedCandidates) {
            builder.addSelectedCandidates(ByteString.copyFrom(candidate.toBytes()));
        }
        return builder.build();
    }

    public static StrategyExecution fromProto(Structure.ProtoStrategyExecution proto) {
        StrategyExecution execution = new StrategyExecution();
        execution.setStrategyId(StrategyId.fromBytes(proto.getStrategyId().toByteArray()));
        execution.setSequence(proto.getSequence());
        execution.setExecutor(Address.fromBytes(proto.getExecutor().toByteArray()));
        execution.setExecutionTime(proto.getExecutionTime());
        List<Address> candidates = new ArrayList<>();
        for (ByteString candidate : proto.getSelectedCandidatesList()) {
            candidates.add(Address.fromBytes(candidate.toByteArray()));
        }
        execution.setSelectedCandidates(candidates);
        execution.setRiskScore(proto.getRiskScore());
        execution.setSuccess(proto.getSuccess());
        return execution;
    }
}
