package com.bit.governance.voter;

import com.bit.governance.common.Address;
import com.bit.governance.structure.voter.VoterInfo;

import java.util.Optional;

/**
 * 投票人注册表
 */
public interface VoterRegistry {

    /**
     * 注册或覆盖投票人（管理员）。重新注册会重新激活并保留累计投票次数
     */
    VoterInfo registerVoter(Address caller, Address voter, long votingPower);

    /**
     * 停用投票人（管理员），其票权从总票权中扣除
     */
    VoterInfo deactivateVoter(Address caller, Address voter);

    Optional<VoterInfo> getVoter(Address voter);

    boolean isRegisteredVoter(Address voter);

    /**
     * 有效票权，未注册或已停用为0
     */
    long getVotingPower(Address voter);

    /**
     * 全部有效投票人的票权之和
     */
    long getTotalVotingPower();
}
