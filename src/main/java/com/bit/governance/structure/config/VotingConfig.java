package com.bit.governance.structure.config;

import com.bit.governance.proto.Structure;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

/**
 * 全局投票参数，后写覆盖先写
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VotingConfig {
    public static final long DEFAULT_VOTING_PERIOD = 7 * 24 * 3600L;  // 7天
    public static final long DEFAULT_EXECUTION_DELAY = 24 * 3600L;  // 1天
    public static final int DEFAULT_QUORUM_THRESHOLD = 5000;  // 50%
    public static final long MIN_VOTING_PERIOD = 3600L;
    public static final int MAX_BPS = 10_000;

    //秒
    private long votingPeriod;
    //秒
    private long executionDelay;
    //基点 1~10000
    private int quorumThreshold;
    private boolean requireRegistration;

    public static VotingConfig defaults() {
        return new VotingConfig(DEFAULT_VOTING_PERIOD, DEFAULT_EXECUTION_DELAY, DEFAULT_QUORUM_THRESHOLD, true);
    }

    public byte[] serialize() {
        return toProto().toByteArray();
    }

    public static VotingConfig deserialize(byte[] data) throws IOException {
        return fromProto(Structure.ProtoVotingConfig.parseFrom(data));
    }

    public Structure.ProtoVotingConfig toProto() {
        return Structure.ProtoVotingConfig.newBuilder()
                .setVotingPeriod(votingPeriod)
                .setExecutionDelay(executionDelay)
                .setQuorumThreshold(quorumThreshold)
                .setRequireRegistration(requireRegistration)
                .build();
    }

    public static VotingConfig fromProto(Structure.ProtoVotingConfig proto) {
        return new VotingConfig(proto.getVotingPeriod(), proto.getExecutionDelay(),
                proto.getQuorumThreshold(), proto.getRequireRegistration());
    }
}
