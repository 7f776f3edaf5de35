package com.bit.governance.voting;

import com.bit.governance.common.Address;
import com.bit.governance.structure.config.VotingConfig;

public interface VotingConfigService {

    /**
     * 当前配置，未设置时返回默认值
     */
    VotingConfig getVotingConfig();

    VotingConfig updateVotingConfig(Address caller, long votingPeriod, long executionDelay,
                                    int quorumThreshold, boolean requireRegistration);
}
