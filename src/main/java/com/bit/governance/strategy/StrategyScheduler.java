package com.bit.governance.strategy;

import com.bit.governance.exception.GovernanceException;
import com.bit.governance.result.Result;
import com.bit.governance.structure.strategy.StrategyOutcome;
import com.bit.governance.structure.strategy.VotingStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时扫描到期的自动策略
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "system.strategy", name = "scheduler-enabled", havingValue = "true")
public class StrategyScheduler {

    private final StrategyService strategyService;

    @Scheduled(fixedDelayString = "${system.strategy.scheduler-interval-ms:60000}")
    public void triggerDueStrategies() {
        for (VotingStrategy strategy : strategyService.dueStrategies()) {
            try {
                Result<StrategyOutcome> result = strategyService.triggerAutomatedVoting(strategy.getId());
                if (!result.isSuccess()) {
                    log.warn("自动策略未执行: {} 原因: {}", strategy.getId(), result.getMessage());
                }
            } catch (GovernanceException e) {
                // 单个策略失败不影响其他策略
                log.error("自动策略执行失败: {} 类型: {}", strategy.getId(), e.getErrorType(), e);
            }
        }
    }
}
