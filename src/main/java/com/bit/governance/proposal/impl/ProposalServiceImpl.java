package com.bit.governance.proposal.impl;

import com.bit.governance.auth.WitnessVerifier;
import com.bit.governance.common.Address;
import com.bit.governance.common.ContentIdGenerator;
import com.bit.governance.common.ProposalId;
import com.bit.governance.event.EventType;
import com.bit.governance.event.GovernanceEvent;
import com.bit.governance.exception.GovernanceException;
import com.bit.governance.proposal.ProposalExecutor;
import com.bit.governance.proposal.ProposalService;
import com.bit.governance.store.GovernanceStore;
import com.bit.governance.store.KeyLocks;
import com.bit.governance.store.WriteSet;
import com.bit.governance.structure.config.VotingConfig;
import com.bit.governance.structure.proposal.Proposal;
import com.bit.governance.structure.proposal.ProposalStatus;
import com.bit.governance.structure.proposal.Vote;
import com.bit.governance.structure.voter.VoterInfo;
import com.bit.governance.time.TimeSource;
import com.bit.governance.util.ByteUtils;
import com.bit.governance.voting.QuorumMath;
import com.bit.governance.voting.VotingConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalServiceImpl implements ProposalService {

    private final GovernanceStore store;
    private final VotingConfigService votingConfigService;
    private final WitnessVerifier witnessVerifier;
    private final ProposalExecutor proposalExecutor;
    private final TimeSource timeSource;
    private final KeyLocks keyLocks;

    @Override
    public Proposal createProposal(Address caller, String title, String description,
                                   byte[] executionData, Address target) {
        if (caller == null) {
            throw GovernanceException.validation("调用方不能为空");
        }
        if (title == null || title.isBlank()) {
            throw GovernanceException.validation("提案标题不能为空");
        }
        if (description == null || description.isBlank()) {
            throw GovernanceException.validation("提案描述不能为空");
        }
        VotingConfig config = votingConfigService.getVotingConfig();

        return keyLocks.withLocks(() -> {
            if (config.isRequireRegistration() && !isActiveVoter(caller)) {
                throw GovernanceException.validation("提案人必须是已注册的投票人");
            }
            long now = timeSource.now();
            long count = store.counter(GovernanceStore.PROPOSAL_COUNT);
            byte[] entropy = ByteUtils.concat(caller.toBytes(), title.getBytes(StandardCharsets.UTF_8));
            ProposalId id = ContentIdGenerator.proposalId(now, count, entropy);
            if (store.getProposalBytes(id) != null) {
                throw GovernanceException.conflict("提案ID冲突: " + id);
            }

            Proposal proposal = new Proposal();
            proposal.setId(id);
            proposal.setTitle(title);
            proposal.setDescription(description);
            proposal.setProposer(caller);
            proposal.setTarget(target);
            proposal.setExecutionData(executionData == null ? new byte[0] : executionData.clone());
            proposal.setCreatedAt(now);
            proposal.setVotingStartTime(now);
            proposal.setVotingEndTime(now + config.getVotingPeriod());
            proposal.setExecutionTime(proposal.getVotingEndTime() + config.getExecutionDelay());
            proposal.setStatus(ProposalStatus.ACTIVE);
            proposal.setTotalVotingPower(store.counter(GovernanceStore.TOTAL_VOTING_POWER));
            proposal.setQuorumThreshold(config.getQuorumThreshold());

            WriteSet writeSet = new WriteSet();
            store.stageProposal(writeSet, proposal);
            store.stageCounter(writeSet, GovernanceStore.PROPOSAL_COUNT, count + 1);
            writeSet.event(GovernanceEvent.of(EventType.PROPOSAL_CREATED, id.toHex(), caller.toHex(), now)
                    .with("title", title)
                    .with("votingEndTime", proposal.getVotingEndTime())
                    .with("executionTime", proposal.getExecutionTime())
                    .with("totalVotingPower", proposal.getTotalVotingPower()));
            store.commit(writeSet);
            log.info("提案创建成功: {} 提案人: {} 投票截止: {}", id, caller, proposal.getVotingEndTime());
            return proposal;
        }, KeyLocks.counter(GovernanceStore.PROPOSAL_COUNT), KeyLocks.voter(caller));
    }

    @Override
    public Vote castVote(Address caller, ProposalId proposalId, boolean support, String reason) {
        if (caller == null || proposalId == null) {
            throw GovernanceException.validation("调用方和提案ID不能为空");
        }
        VotingConfig config = votingConfigService.getVotingConfig();

        return keyLocks.withLocks(() -> {
            long now = timeSource.now();
            Proposal proposal = requireProposal(proposalId);
            if (!proposal.getStatus().acceptsVotes()) {
                throw GovernanceException.conflict("提案不在投票状态: " + proposal.getStatus());
            }
            if (now < proposal.getVotingStartTime() || now > proposal.getVotingEndTime()) {
                throw GovernanceException.conflict("不在投票时间窗口内");
            }

            Optional<VoterInfo> voter = store.getVoter(caller);
            boolean active = voter.map(VoterInfo::isActive).orElse(false);
            if (config.isRequireRegistration() && !active) {
                throw GovernanceException.validation("投票人未注册");
            }
            if (store.hasVoted(proposalId, caller)) {
                throw GovernanceException.conflict("已对该提案投过票");
            }
            long power = active ? voter.get().getVotingPower() : 0L;
            if (power <= 0) {
                throw GovernanceException.validation("没有票权");
            }
            long cast = proposal.castWeight();
            if (power > proposal.getTotalVotingPower() - cast) {
                throw GovernanceException.conflict("投票总权重将超过提案快照总票权");
            }

            Vote vote = new Vote(proposalId, caller, support, power, reason == null ? "" : reason, now);
            if (support) {
                proposal.setYesVotes(proposal.getYesVotes() + power);
            } else {
                proposal.setNoVotes(proposal.getNoVotes() + power);
            }
            boolean quorumTransition = proposal.getStatus() == ProposalStatus.ACTIVE
                    && QuorumMath.isQuorumReached(proposal.castWeight(), proposal.getTotalVotingPower(),
                    proposal.getQuorumThreshold());
            if (quorumTransition) {
                proposal.setStatus(ProposalStatus.QUORUM_REACHED);
            }

            VoterInfo info = voter.get();
            info.setVotesCast(info.getVotesCast() + 1);

            WriteSet writeSet = new WriteSet();
            store.stageVote(writeSet, vote);
            store.stageProposal(writeSet, proposal);
            store.stageVoter(writeSet, info);
            writeSet.event(GovernanceEvent.of(EventType.VOTE_CAST, proposalId.toHex(), caller.toHex(), now)
                    .with("support", support)
                    .with("votingPower", power)
                    .with("yesVotes", proposal.getYesVotes())
                    .with("noVotes", proposal.getNoVotes()));
            if (quorumTransition) {
                writeSet.event(GovernanceEvent.of(EventType.QUORUM_REACHED, proposalId.toHex(), caller.toHex(), now)
                        .with("castVotes", proposal.castWeight())
                        .with("requiredQuorum", QuorumMath.requiredQuorum(proposal.getTotalVotingPower(),
                                proposal.getQuorumThreshold())));
            }
            store.commit(writeSet);
            log.info("投票成功 提案: {} 投票人: {} 赞成: {} 票权: {}", proposalId, caller, support, power);
            return vote;
        }, KeyLocks.proposal(proposalId), KeyLocks.voter(caller));
    }

    @Override
    public boolean executeProposal(Address caller, ProposalId proposalId) {
        if (caller == null || proposalId == null) {
            throw GovernanceException.validation("调用方和提案ID不能为空");
        }
        return keyLocks.withLocks(() -> {
            long now = timeSource.now();
            Proposal proposal = requireProposal(proposalId);
            if (now < proposal.getExecutionTime()) {
                throw GovernanceException.conflict("未到执行时间: " + proposal.getExecutionTime());
            }
            if (proposal.getStatus().isTerminal()) {
                throw GovernanceException.conflict("提案已终结: " + proposal.getStatus());
            }

            boolean passed = QuorumMath.isPassed(proposal.getYesVotes(), proposal.getNoVotes(),
                    proposal.getTotalVotingPower(), proposal.getQuorumThreshold());
            ProposalStatus finalStatus = passed ? ProposalStatus.EXECUTED : ProposalStatus.FAILED;
            proposal.setStatus(finalStatus);
            proposal.setExecutedAt(now);

            // 终态先落库再执行载荷，提交失败时载荷不会运行，也不会被重复执行
            WriteSet writeSet = new WriteSet();
            store.stageProposal(writeSet, proposal);
            boolean hasPayload = passed && proposal.getExecutionData().length > 0;
            if (!hasPayload) {
                writeSet.event(executedEvent(proposal, caller, now));
            }
            store.commit(writeSet);

            if (hasPayload) {
                try {
                    proposalExecutor.execute(proposal);
                    store.publish(executedEvent(proposal, caller, now));
                } catch (RuntimeException e) {
                    log.error("提案载荷执行失败: {}", proposalId, e);
                    proposal.setStatus(ProposalStatus.EXECUTION_FAILED);
                    WriteSet failed = new WriteSet();
                    store.stageProposal(failed, proposal);
                    failed.event(executedEvent(proposal, caller, now));
                    store.commit(failed);
                }
            }
            log.info("提案结算完成: {} 状态: {}", proposalId, proposal.getStatus());
            return proposal.getStatus() == ProposalStatus.EXECUTED;
        }, KeyLocks.proposal(proposalId));
    }

    @Override
    public Proposal cancelProposal(Address caller, ProposalId proposalId) {
        if (!witnessVerifier.authorize(caller)) {
            throw GovernanceException.unauthorized("仅管理员可取消提案");
        }
        return keyLocks.withLocks(() -> {
            long now = timeSource.now();
            Proposal proposal = requireProposal(proposalId);
            if (proposal.getStatus() != ProposalStatus.ACTIVE) {
                throw GovernanceException.conflict("只能取消投票中的提案: " + proposal.getStatus());
            }
            proposal.setStatus(ProposalStatus.CANCELLED);
            proposal.setCancelledAt(now);

            WriteSet writeSet = new WriteSet();
            store.stageProposal(writeSet, proposal);
            writeSet.event(GovernanceEvent.of(EventType.PROPOSAL_CANCELLED, proposalId.toHex(), caller.toHex(), now));
            store.commit(writeSet);
            log.info("提案已取消: {}", proposalId);
            return proposal;
        }, KeyLocks.proposal(proposalId));
    }

    @Override
    public Optional<Proposal> getProposal(ProposalId proposalId) {
        return store.getProposal(proposalId);
    }

    @Override
    public Optional<byte[]> getProposalBytes(ProposalId proposalId) {
        return Optional.ofNullable(store.getProposalBytes(proposalId));
    }

    @Override
    public Optional<Vote> getVote(ProposalId proposalId, Address voter) {
        return store.getVote(proposalId, voter);
    }

    @Override
    public boolean hasVoted(ProposalId proposalId, Address voter) {
        return store.hasVoted(proposalId, voter);
    }

    @Override
    public long getProposalCount() {
        return store.counter(GovernanceStore.PROPOSAL_COUNT);
    }

    private static GovernanceEvent executedEvent(Proposal proposal, Address caller, long now) {
        return GovernanceEvent.of(EventType.PROPOSAL_EXECUTED, proposal.getId().toHex(), caller.toHex(), now)
                .with("status", proposal.getStatus().name())
                .with("yesVotes", proposal.getYesVotes())
                .with("noVotes", proposal.getNoVotes());
    }

    private Proposal requireProposal(ProposalId proposalId) {
        return store.getProposal(proposalId)
                .orElseThrow(() -> GovernanceException.notFound("提案不存在: " + proposalId));
    }

    private boolean isActiveVoter(Address address) {
        return store.getVoter(address).map(VoterInfo::isActive).orElse(false);
    }
}
