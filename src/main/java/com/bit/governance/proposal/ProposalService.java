package com.bit.governance.proposal;

import com.bit.governance.common.Address;
import com.bit.governance.common.ProposalId;
import com.bit.governance.structure.proposal.Proposal;
import com.bit.governance.structure.proposal.Vote;

import java.util.Optional;

/**
 * 提案生命周期：创建 → 投票 → 执行/取消
 * 所有校验在写入前完成，失败抛出 GovernanceException 且不留下任何状态
 */
public interface ProposalService {

    /**
     * 创建提案，快照当前总票权和法定票数阈值
     * @param executionData 通过后执行的载荷，可为空
     * @param target 执行目标，可为空
     */
    Proposal createProposal(Address caller, String title, String description, byte[] executionData, Address target);

    /**
     * 投票。同一投票人对同一提案只能投一次
     * @param reason 可为空
     */
    Vote castVote(Address caller, ProposalId proposalId, boolean support, String reason);

    /**
     * 到达执行时间后结算提案
     * @return 是否通过并执行成功
     */
    boolean executeProposal(Address caller, ProposalId proposalId);

    /**
     * 取消仍在投票中的提案（管理员）
     */
    Proposal cancelProposal(Address caller, ProposalId proposalId);

    Optional<Proposal> getProposal(ProposalId proposalId);

    /**
     * 提案的原始存储内容，未修改的提案多次读取结果一致
     */
    Optional<byte[]> getProposalBytes(ProposalId proposalId);

    Optional<Vote> getVote(ProposalId proposalId, Address voter);

    boolean hasVoted(ProposalId proposalId, Address voter);

    long getProposalCount();
}
