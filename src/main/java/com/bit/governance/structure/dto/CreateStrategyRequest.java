package com.bit.governance.structure.dto;

import com.bit.governance.structure.strategy.StrategyType;
import lombok.Data;

@Data
public class CreateStrategyRequest {
    private String name;
    private String description;
    private StrategyType strategyType;
    private int maxCandidates;
    private int minPerformanceScore;
    private boolean autoExecute;
    private long executionInterval;
}
