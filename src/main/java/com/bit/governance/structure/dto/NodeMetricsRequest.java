package com.bit.governance.structure.dto;

import lombok.Data;

@Data
public class NodeMetricsRequest {
    private String node;
    private int uptimePercentage;
    private int performanceScore;
    private long blocksProduced;
    private int consensusParticipation;
}
