package com.bit.governance.structure.proposal;

import com.bit.governance.common.Address;
import com.bit.governance.common.ProposalId;
import com.bit.governance.proto.Structure;
import com.google.protobuf.ByteString;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

/**
 * 治理提案
 */
@Data
@NoArgsConstructor
public class Proposal {
    /**
     * SHA-256(创建时间 ‖ 提案计数 ‖ 提案人 ‖ 标题)
     */
    private ProposalId id;
    private String title;
    private String description;
    private Address proposer;
    /**
     * 执行目标，可为空
     */
    private Address target;
    /**
     * 通过后交给执行器的不透明载荷
     */
    private byte[] executionData = new byte[0];

    private long createdAt;
    private long votingStartTime;
    //votingStartTime + 投票周期
    private long votingEndTime;
    //votingEndTime + 执行延迟
    private long executionTime;

    private ProposalStatus status = ProposalStatus.ACTIVE;
    private long yesVotes;
    private long noVotes;
    /**
     * 创建时的全网投票权快照，法定票数以此计算
     */
    private long totalVotingPower;
    /**
     * 创建时的法定票数阈值（基点）
     */
    private int quorumThreshold;

    private long executedAt;
    private long cancelledAt;

    /**
     * 已投出的总票权
     */
    public long castWeight() {
        return yesVotes + noVotes;
    }

    // ==================== 序列化/反序列化 ====================
    public byte[] serialize() {
        return toProto().toByteArray();
    }

    public static Proposal deserialize(byte[] data) throws IOException {
        return fromProto(Structure.ProtoProposal.parseFrom(data));
    }

    // ==================== Proto转换 ====================
    public Structure.ProtoProposal toProto() {
        Structure.ProtoProposal.Builder builder = Structure.ProtoProposal.newBuilder()
                .setId(ByteString.copyFrom(id.getBytes()))
                .setTitle(title)
                .setDescription(description)
                .setProposer(ByteString.copyFrom(proposer.toBytes()))
                .setCreatedAt(createdAt)
                .setVotingStartTime(votingStartTime)
                .setVotingEndTime(votingEndTime)
                .setExecutionTime(executionTime)
                .setStatus(status.getCode())
                .setYesVotes(yesVotes)
                .setNoVotes(noVotes)
                .setTotalVotingPower(totalVotingPower)
                .setQuorumThreshold(quorumThreshold)
                .setExecutedAt(executedAt)
                .setCancelledAt(cancelledAt);
        if (target != null) {
            builder.setTarget(ByteString.copyFrom(target.toBytes()));
        }
        if (executionData != null) {
            builder.setExecutionData(ByteString.copyFrom(executionData));
        }
        return builder.build();
    }

    public static Proposal fromProto(Structure.ProtoProposal proto) {
        Proposal proposal = new Proposal();
        proposal.setId(ProposalId.fromBytes(proto.getId().toByteArray()));
        proposal.setTitle(proto.getTitle());
        proposal.setDescription(proto.getDescription());
        proposal.setProposer(Address.fromBytes(proto.getProposer().toByteArray()));
        if (!proto.getTarget().isEmpty()) {
            proposal.setTarget(Address.fromBytes(proto.getTarget().toByteArray()));
        }
        proposal.setExecutionData(proto.getExecutionData().toByteArray());
        proposal.setCreatedAt(proto.getCreatedAt());
        proposal.setVotingStartTime(proto.getVotingStartTime());
        proposal.setVotingEndTime(proto.getVotingEndTime());
        proposal.setExecutionTime(proto.getExecutionTime());
        proposal.setStatus(ProposalStatus.fromCode(proto.getStatus()));
        proposal.setYesVotes(proto.getYesVotes());
        proposal.setNoVotes(proto.getNoVotes());
        proposal.setTotalVotingPower(proto.getTotalVotingPower());
        proposal.setQuorumThreshold(proto.getQuorumThreshold());
        proposal.setExecutedAt(proto.getExecutedAt());
        proposal.setCancelledAt(proto.getCancelledAt());
        return proposal;
    }
}
