package com.bit.governance.voting.impl;

import com.bit.governance.auth.WitnessVerifier;
import com.bit.governance.common.Address;
import com.bit.governance.event.EventType;
import com.bit.governance.event.GovernanceEvent;
import com.bit.governance.exception.GovernanceException;
import com.bit.governance.store.GovernanceStore;
import com.bit.governance.store.KeyLocks;
import com.bit.governance.store.WriteSet;
import com.bit.governance.structure.config.VotingConfig;
import com.bit.governance.time.TimeSource;
import com.bit.governance.voting.QuorumMath;
import com.bit.governance.voting.VotingConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class VotingConfigServiceImpl implements VotingConfigService {

    private final GovernanceStore store;
    private final WitnessVerifier witnessVerifier;
    private final TimeSource timeSource;
    private final KeyLocks keyLocks;

    @Override
    public VotingConfig getVotingConfig() {
        return store.getVotingConfig().orElseGet(VotingConfig::defaults);
    }

    @Override
    public VotingConfig updateVotingConfig(Address caller, long votingPeriod, long executionDelay,
                                           int quorumThreshold, boolean requireRegistration) {
        if (!witnessVerifier.authorize(caller)) {
            throw GovernanceException.unauthorized("仅管理员可修改投票配置");
        }
        if (votingPeriod < VotingConfig.MIN_VOTING_PERIOD) {
            throw GovernanceException.validation("投票周期不能小于" + VotingConfig.MIN_VOTING_PERIOD + "秒");
        }
        if (executionDelay < 0) {
            throw GovernanceException.validation("执行延迟不能为负");
        }
        if (!QuorumMath.isValidBps(quorumThreshold)) {
            throw GovernanceException.validation("法定票数阈值必须在1~10000基点之间");
        }
        // 溢出检查：创建提案时需要 now + 周期 + 延迟
        if (votingPeriod > Long.MAX_VALUE / 4 || executionDelay > Long.MAX_VALUE / 4) {
            throw GovernanceException.validation("投票周期或执行延迟过大");
        }

        VotingConfig config = new VotingConfig(votingPeriod, executionDelay, quorumThreshold, requireRegistration);
        return keyLocks.withLocks(() -> {
            long now = timeSource.now();
            WriteSet writeSet = new WriteSet();
            store.stageVotingConfig(writeSet, config);
            writeSet.event(GovernanceEvent.of(EventType.VOTING_CONFIG_UPDATED, "config", caller.toHex(), now)
                    .with("votingPeriod", votingPeriod)
                    .with("executionDelay", executionDelay)
                    .with("quorumThreshold", quorumThreshold)
                    .with("requireRegistration", requireRegistration));
            store.commit(writeSet);
            log.info("投票配置已更新: {}", config);
            return config;
        }, KeyLocks.CONFIG);
    }
}
