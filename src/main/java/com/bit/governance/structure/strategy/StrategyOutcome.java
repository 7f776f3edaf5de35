package com.bit.governance.structure.strategy;

import com.bit.governance.common.Address;
import com.bit.governance.common.StrategyId;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 策略执行（或预演）的返回值，不落库
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StrategyOutcome {
    private StrategyId strategyId;
    private List<Address> candidates;
    private int riskScore;
    private boolean dryRun;
    //未落库时为0
    private int sequence;
}
