package com.bit.governance.structure.voter;

import com.bit.governance.common.Address;
import com.bit.governance.proto.Structure;
import com.google.protobuf.ByteString;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

/**
 * 注册投票人
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoterInfo {
    private Address address;
    private long votingPower;
    private long registeredAt;
    private boolean active;
    //累计投票次数，重新注册时保留
    private int votesCast;

    public byte[] serialize() {
        return toProto().toByteArray();
    }

    public static VoterInfo deserialize(byte[] data) throws IOException {
        return fromProto(Structure.ProtoVoterInfo.parseFrom(data));
    }

    public Structure.ProtoVoterInfo toProto() {
        return Structure.ProtoVoterInfo.newBuilder()
                .setAddress(ByteString.copyFrom(address.toBytes()))
                .setVotingPower(votingPower)
                .setRegisteredAt(registeredAt)
                .setActive(active)
                .setVotesCast(votesCast)
                .build();
    }

    public static VoterInfo fromProto(Structure.ProtoVoterInfo proto) {
        return new VoterInfo(
                Address.fromBytes(proto.getAddress().toByteArray()),
                proto.getVotingPower(),
                proto.getRegisteredAt(),
                proto.getActive(),
                proto.getVotesCast());
    }
}
