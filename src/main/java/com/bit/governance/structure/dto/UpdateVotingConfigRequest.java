package com.bit.governance.structure.dto;

import lombok.Data;

@Data
public class UpdateVotingConfigRequest {
    private long votingPeriod;
    private long executionDelay;
    private int quorumThreshold;
    private boolean requireRegistration;
}
