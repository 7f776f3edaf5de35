package com.bit.governance.voter.impl;

import com.bit.governance.auth.WitnessVerifier;
import com.bit.governance.common.Address;
import com.bit.governance.event.EventType;
import com.bit.governance.event.GovernanceEvent;
import com.bit.governance.exception.GovernanceException;
import com.bit.governance.store.GovernanceStore;
import com.bit.governance.store.KeyLocks;
import com.bit.governance.store.WriteSet;
import com.bit.governance.structure.voter.VoterInfo;
import com.bit.governance.time.TimeSource;
import com.bit.governance.voter.VoterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class VoterRegistryImpl implements VoterRegistry {

    private final GovernanceStore store;
    private final WitnessVerifier witnessVerifier;
    private final TimeSource timeSource;
    private final KeyLocks keyLocks;

    @Override
    public VoterInfo registerVoter(Address caller, Address voter, long votingPower) {
        if (!witnessVerifier.authorize(caller)) {
            throw GovernanceException.unauthorized("仅管理员可注册投票人");
        }
        if (voter == null) {
            throw GovernanceException.validation("投票人地址不能为空");
        }
        if (votingPower <= 0) {
            throw GovernanceException.validation("票权必须大于0");
        }

        return keyLocks.withLocks(() -> {
            long now = timeSource.now();
            Optional<VoterInfo> previous = store.getVoter(voter);
            long previousActivePower = previous.filter(VoterInfo::isActive).map(VoterInfo::getVotingPower).orElse(0L);
            int votesCast = previous.map(VoterInfo::getVotesCast).orElse(0);

            long total = store.counter(GovernanceStore.TOTAL_VOTING_POWER);
            long newTotal;
            try {
                newTotal = Math.addExact(total - previousActivePower, votingPower);
            } catch (ArithmeticException e) {
                throw GovernanceException.validation("总票权溢出");
            }

            VoterInfo info = new VoterInfo(voter, votingPower, now, true, votesCast);
            WriteSet writeSet = new WriteSet();
            store.stageVoter(writeSet, info);
            store.stageCounter(writeSet, GovernanceStore.TOTAL_VOTING_POWER, newTotal);
            writeSet.event(GovernanceEvent.of(EventType.VOTER_REGISTERED, voter.toHex(), caller.toHex(), now)
                    .with("votingPower", votingPower)
                    .with("totalVotingPower", newTotal));
            store.commit(writeSet);
            log.info("投票人注册成功: {} 票权: {} 总票权: {}", voter, votingPower, newTotal);
            return info;
        }, KeyLocks.voter(voter), KeyLocks.counter(GovernanceStore.TOTAL_VOTING_POWER));
    }

    @Override
    public VoterInfo deactivateVoter(Address caller, Address voter) {
        if (!witnessVerifier.authorize(caller)) {
            throw GovernanceException.unauthorized("仅管理员可停用投票人");
        }
        return keyLocks.withLocks(() -> {
            VoterInfo info = store.getVoter(voter)
                    .orElseThrow(() -> GovernanceException.notFound("投票人不存在: " + voter));
            if (!info.isActive()) {
                throw GovernanceException.conflict("投票人已停用: " + voter);
            }
            long now = timeSource.now();
            long newTotal = store.counter(GovernanceStore.TOTAL_VOTING_POWER) - info.getVotingPower();
            info.setActive(false);

            WriteSet writeSet = new WriteSet();
            store.stageVoter(writeSet, info);
            store.stageCounter(writeSet, GovernanceStore.TOTAL_VOTING_POWER, Math.max(0L, newTotal));
            writeSet.event(GovernanceEvent.of(EventType.VOTER_DEACTIVATED, voter.toHex(), caller.toHex(), now)
                    .with("totalVotingPower", Math.max(0L, newTotal)));
            store.commit(writeSet);
            log.info("投票人已停用: {} 总票权: {}", voter, newTotal);
            return info;
        }, KeyLocks.voter(voter), KeyLocks.counter(GovernanceStore.TOTAL_VOTING_POWER));
    }

    @Override
    public Optional<VoterInfo> getVoter(Address voter) {
        return store.getVoter(voter);
    }

    @Override
    public boolean isRegisteredVoter(Address voter) {
        return store.getVoter(voter).map(VoterInfo::isActive).orElse(false);
    }

    @Override
    public long getVotingPower(Address voter) {
        return store.getVoter(voter).filter(VoterInfo::isActive).map(VoterInfo::getVotingPower).orElse(0L);
    }

    @Override
    public long getTotalVotingPower() {
        return store.counter(GovernanceStore.TOTAL_VOTING_POWER);
    }
}
