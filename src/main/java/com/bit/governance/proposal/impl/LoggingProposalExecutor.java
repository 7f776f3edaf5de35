package com.bit.governance.proposal.impl;

import com.bit.governance.proposal.ProposalExecutor;
import com.bit.governance.structure.proposal.Proposal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 默认执行器：只记录载荷，不调用目标
 */
@Slf4j
@Component
public class LoggingProposalExecutor implements ProposalExecutor {

    @Override
    public void execute(Proposal proposal) {
        log.info("执行提案载荷 提案: {} 目标: {} 载荷长度: {}", proposal.getId(), proposal.getTarget(),
                proposal.getExecutionData().length);
    }
}
