package com.bit.governance.structure.proposal;

import com.bit.governance.common.Address;
import com.bit.governance.common.ProposalId;
import com.bit.governance.proto.Structure;
import com.bit.governance.util.ByteUtils;
import com.google.protobuf.ByteString;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

/**
 * 单张选票，写入后不可修改
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Vote {
    private ProposalId proposalId;
    private Address voter;
    private boolean support;
    //投票时的票权
    private long votingPower;
    private String reason = "";
    private long timestamp;

    /**
     * 存储键：提案ID ‖ 投票人
     */
    public static byte[] key(ProposalId proposalId, Address voter) {
        return ByteUtils.concat(proposalId.getBytes(), voter.toBytes());
    }

    public byte[] serialize() {
        return toProto().toByteArray();
    }

    public static Vote deserialize(byte[] data) throws IOException {
        return fromProto(Structure.ProtoVote.parseFrom(data));
    }

    public Structure.ProtoVote toProto() {
        return Structure.ProtoVote.newBuilder()
                .setProposalId(ByteString.copyFrom(proposalId.getBytes()))
                .setVoter(ByteString.copyFrom(voter.toBytes()))
                .setSupport(support)
                .setVotingPower(votingPower)
                .setReason(reason == null ? "" : reason)
                .setTimestamp(timestamp)
                .build();
    }

    public static Vote fromProto(Structure.ProtoVote proto) {
        return new Vote(
                ProposalId.fromBytes(proto.getProposalId().toByteArray()),
                Address.fromBytes(proto.getVoter().toByteArray()),
                proto.getSupport(),
                proto.getVotingPower(),
                proto.getReason(),
                proto.getTimestamp());
    }
}
