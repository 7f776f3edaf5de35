package com.bit.governance.proposal;

import com.bit.governance.structure.proposal.Proposal;

/**
 * 提案通过后执行其载荷。抛出异常即视为执行失败，不重试
 */
public interface ProposalExecutor {

    void execute(Proposal proposal);
}
