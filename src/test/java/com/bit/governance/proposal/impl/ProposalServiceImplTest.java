package com.bit.governance.proposal.impl;

import com.bit.governance.common.Address;
import com.bit.governance.common.ProposalId;
import com.bit.governance.event.EventType;
import com.bit.governance.exception.ErrorType;
import com.bit.governance.exception.GovernanceException;
import com.bit.governance.structure.proposal.Proposal;
import com.bit.governance.structure.proposal.ProposalStatus;
import com.bit.governance.structure.proposal.Vote;
import com.bit.governance.support.FailingMemoryDb;
import com.bit.governance.support.GovernanceFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.bit.governance.support.GovernanceFixture.ADMIN;
import static org.junit.jupiter.api.Assertions.*;

public class ProposalServiceImplTest {

    private static final Address VOTER_A = GovernanceFixture.address(10);
    private static final Address VOTER_B = GovernanceFixture.address(11);
    private static final Address OUTSIDER = GovernanceFixture.address(99);

    private GovernanceFixture fx;

    @BeforeEach
    void setUp() {
        fx = new GovernanceFixture();
        fx.configService.updateVotingConfig(ADMIN, 604_800, 86_400, 5000, true);
        fx.voterRegistry.registerVoter(ADMIN, VOTER_A, 600_000);
        fx.voterRegistry.registerVoter(ADMIN, VOTER_B, 400_000);
    }

    private static void assertError(ErrorType expected, Executable executable) {
        GovernanceException e = assertThrows(GovernanceException.class, executable);
        assertEquals(expected, e.getErrorType(), e.getMessage());
    }

    private Proposal create() {
        return fx.proposalService.createProposal(VOTER_A, "升级参数", "调整出块间隔", new byte[]{1, 2, 3}, null);
    }

    @Test
    void timestampsAreDerivedFromConfig() {
        Proposal p = create();
        assertEquals(0, p.getCreatedAt());
        assertEquals(604_800, p.getVotingEndTime());
        assertEquals(691_200, p.getExecutionTime());
        assertEquals(1_000_000, p.getTotalVotingPower());
        assertEquals(5000, p.getQuorumThreshold());
        assertEquals(ProposalStatus.ACTIVE, p.getStatus());
        assertEquals(1, fx.proposalService.getProposalCount());
        assertEquals(1, fx.count(EventType.PROPOSAL_CREATED));
    }

    @Test
    void fullLifecycleReachesQuorumAndExecutes() {
        Proposal p = create();

        fx.time.set(100);
        fx.proposalService.castVote(VOTER_A, p.getId(), true, "同意");
        Proposal afterVote = fx.proposalService.getProposal(p.getId()).orElseThrow();
        assertEquals(ProposalStatus.QUORUM_REACHED, afterVote.getStatus());
        assertEquals(600_000, afterVote.getYesVotes());
        assertEquals(1, fx.count(EventType.QUORUM_REACHED));

        fx.time.set(691_199);
        assertError(ErrorType.STATE_CONFLICT, () -> fx.proposalService.executeProposal(VOTER_B, p.getId()));

        fx.time.set(691_200);
        assertTrue(fx.proposalService.executeProposal(VOTER_B, p.getId()));
        Proposal executed = fx.proposalService.getProposal(p.getId()).orElseThrow();
        assertEquals(ProposalStatus.EXECUTED, executed.getStatus());
        assertEquals(691_200, executed.getExecutedAt());
        assertEquals(1, fx.executor.getExecuted().size());
        assertEquals(1, fx.count(EventType.PROPOSAL_EXECUTED));
    }

    @Test
    void secondVoteIsRejectedAndTallyUnchanged() {
        Proposal p = create();
        fx.proposalService.castVote(VOTER_B, p.getId(), false, null);
        byte[] before = fx.proposalService.getProposalBytes(p.getId()).orElseThrow();

        assertError(ErrorType.STATE_CONFLICT, () -> fx.proposalService.castVote(VOTER_B, p.getId(), true, "改票"));

        assertArrayEquals(before, fx.proposalService.getProposalBytes(p.getId()).orElseThrow());
        Vote vote = fx.proposalService.getVote(p.getId(), VOTER_B).orElseThrow();
        assertFalse(vote.isSupport());
        assertEquals("", vote.getReason());
        assertEquals(1, fx.voterRegistry.getVoter(VOTER_B).orElseThrow().getVotesCast());
    }

    @Test
    void quorumTransitionIsEmittedOnce() {
        Proposal p = create();
        fx.proposalService.castVote(VOTER_A, p.getId(), true, "");
        fx.proposalService.castVote(VOTER_B, p.getId(), false, "");

        Proposal after = fx.proposalService.getProposal(p.getId()).orElseThrow();
        assertEquals(ProposalStatus.QUORUM_REACHED, after.getStatus());
        assertEquals(1_000_000, after.castWeight());
        assertEquals(1, fx.count(EventType.QUORUM_REACHED));
        assertEquals(2, fx.count(EventType.VOTE_CAST));
    }

    @Test
    void votingWindowIsInclusive() {
        Proposal p = create();
        fx.time.set(604_800);
        fx.proposalService.castVote(VOTER_A, p.getId(), true, "");
        fx.time.set(604_801);
        assertError(ErrorType.STATE_CONFLICT, () -> fx.proposalService.castVote(VOTER_B, p.getId(), true, ""));
    }

    @Test
    void unregisteredCallersAreRejected() {
        assertError(ErrorType.VALIDATION,
                () -> fx.proposalService.createProposal(OUTSIDER, "标题", "描述", null, null));
        Proposal p = create();
        assertError(ErrorType.VALIDATION, () -> fx.proposalService.castVote(OUTSIDER, p.getId(), true, ""));
        assertFalse(fx.proposalService.hasVoted(p.getId(), OUTSIDER));
    }

    @Test
    void blankTitleOrDescriptionIsRejected() {
        assertError(ErrorType.VALIDATION, () -> fx.proposalService.createProposal(VOTER_A, " ", "描述", null, null));
        assertError(ErrorType.VALIDATION, () -> fx.proposalService.createProposal(VOTER_A, "标题", "", null, null));
        assertEquals(0, fx.proposalService.getProposalCount());
    }

    @Test
    void unknownProposalIsNotFound() {
        ProposalId missing = ProposalId.fromBytes(new byte[32]);
        assertError(ErrorType.NOT_FOUND, () -> fx.proposalService.castVote(VOTER_A, missing, true, ""));
        assertError(ErrorType.NOT_FOUND, () -> fx.proposalService.executeProposal(VOTER_A, missing));
        assertTrue(fx.proposalService.getProposal(missing).isEmpty());
    }

    @Test
    void proposalWithoutQuorumFails() {
        Proposal p = create();
        fx.proposalService.castVote(VOTER_B, p.getId(), true, "");
        fx.time.set(p.getExecutionTime());

        assertFalse(fx.proposalService.executeProposal(VOTER_A, p.getId()));
        assertEquals(ProposalStatus.FAILED, fx.proposalService.getProposal(p.getId()).orElseThrow().getStatus());
        assertTrue(fx.executor.getExecuted().isEmpty());
    }

    @Test
    void executorFailureMarksExecutionFailed() {
        Proposal p = create();
        fx.proposalService.castVote(VOTER_A, p.getId(), true, "");
        fx.executor.setFail(true);
        fx.time.set(p.getExecutionTime());

        assertFalse(fx.proposalService.executeProposal(VOTER_A, p.getId()));
        assertEquals(ProposalStatus.EXECUTION_FAILED,
                fx.proposalService.getProposal(p.getId()).orElseThrow().getStatus());
    }

    @Test
    void failedCommitNeverRunsThePayload() {
        FailingMemoryDb dataBase = new FailingMemoryDb();
        GovernanceFixture failing = new GovernanceFixture(dataBase);
        failing.voterRegistry.registerVoter(ADMIN, VOTER_A, 600_000);
        failing.voterRegistry.registerVoter(ADMIN, VOTER_B, 400_000);
        Proposal p = failing.proposalService.createProposal(VOTER_A, "升级参数", "调整出块间隔", new byte[]{1}, null);
        failing.proposalService.castVote(VOTER_A, p.getId(), true, "");
        failing.time.set(p.getExecutionTime());

        dataBase.failNextTransaction();
        GovernanceException e = assertThrows(GovernanceException.class,
                () -> failing.proposalService.executeProposal(VOTER_A, p.getId()));
        assertEquals(ErrorType.STORAGE_FAILED, e.getErrorType());
        assertTrue(failing.executor.getExecuted().isEmpty());
        assertEquals(ProposalStatus.QUORUM_REACHED,
                failing.proposalService.getProposal(p.getId()).orElseThrow().getStatus());
        assertEquals(0, failing.count(EventType.PROPOSAL_EXECUTED));

        assertTrue(failing.proposalService.executeProposal(VOTER_A, p.getId()));
        assertEquals(1, failing.executor.getExecuted().size());
        assertEquals(1, failing.count(EventType.PROPOSAL_EXECUTED));
        assertError(ErrorType.STATE_CONFLICT, () -> failing.proposalService.executeProposal(VOTER_A, p.getId()));
        assertEquals(1, failing.executor.getExecuted().size());
    }

    @Test
    void parallelVotesAreAllCounted() throws Exception {
        int voters = 20;
        long power = 50_000;
        List<Address> addresses = new ArrayList<>();
        for (int i = 0; i < voters; i++) {
            Address voter = GovernanceFixture.address(200 + i);
            fx.voterRegistry.registerVoter(ADMIN, voter, power);
            addresses.add(voter);
        }
        // 快照总票权 2_000_000，法定票数 1_000_000，最后一票恰好达到
        Proposal p = create();
        assertEquals(2_000_000, p.getTotalVotingPower());

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Vote>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < voters; i++) {
                Address voter = addresses.get(i);
                boolean support = i % 2 == 0;
                futures.add(pool.submit(() -> {
                    start.await();
                    return fx.proposalService.castVote(voter, p.getId(), support, "");
                }));
            }
            start.countDown();
            for (Future<Vote> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Proposal stored = fx.proposalService.getProposal(p.getId()).orElseThrow();
        assertEquals(voters * power, stored.castWeight());
        assertEquals(voters / 2 * power, stored.getYesVotes());
        assertEquals(voters / 2 * power, stored.getNoVotes());
        assertEquals(ProposalStatus.QUORUM_REACHED, stored.getStatus());
        assertEquals(1, fx.count(EventType.QUORUM_REACHED));
        assertEquals(voters, fx.count(EventType.VOTE_CAST));
        for (Address voter : addresses) {
            assertTrue(fx.proposalService.hasVoted(p.getId(), voter));
        }
    }

    @Test
    void finalizedProposalCannotBeExecutedAgain() {
        Proposal p = create();
        fx.proposalService.castVote(VOTER_A, p.getId(), true, "");
        fx.time.set(p.getExecutionTime());
        fx.proposalService.executeProposal(VOTER_A, p.getId());

        assertError(ErrorType.STATE_CONFLICT, () -> fx.proposalService.executeProposal(VOTER_A, p.getId()));
        assertEquals(1, fx.executor.getExecuted().size());
    }

    @Test
    void cancelIsAdminOnlyAndOnlyWhileActive() {
        Proposal p = create();
        assertError(ErrorType.AUTHORIZATION, () -> fx.proposalService.cancelProposal(VOTER_A, p.getId()));

        Proposal cancelled = fx.proposalService.cancelProposal(ADMIN, p.getId());
        assertEquals(ProposalStatus.CANCELLED, cancelled.getStatus());
        assertError(ErrorType.STATE_CONFLICT, () -> fx.proposalService.castVote(VOTER_A, p.getId(), true, ""));
        assertError(ErrorType.STATE_CONFLICT, () -> fx.proposalService.cancelProposal(ADMIN, p.getId()));

        Proposal other = fx.proposalService.createProposal(VOTER_B, "另一个", "描述", null, null);
        fx.proposalService.castVote(VOTER_A, other.getId(), true, "");
        assertError(ErrorType.STATE_CONFLICT, () -> fx.proposalService.cancelProposal(ADMIN, other.getId()));
    }

    @Test
    void votesCannotExceedThePowerSnapshot() {
        Proposal p = create();
        Address late = GovernanceFixture.address(12);
        fx.voterRegistry.registerVoter(ADMIN, late, 500_000);
        fx.proposalService.castVote(VOTER_A, p.getId(), true, "");

        assertError(ErrorType.STATE_CONFLICT, () -> fx.proposalService.castVote(late, p.getId(), true, ""));
        assertEquals(600_000, fx.proposalService.getProposal(p.getId()).orElseThrow().castWeight());
    }

    @Test
    void readsAreByteIdenticalWhileUnmodified() {
        Proposal p = create();
        byte[] first = fx.proposalService.getProposalBytes(p.getId()).orElseThrow();
        byte[] second = fx.proposalService.getProposalBytes(p.getId()).orElseThrow();
        assertArrayEquals(first, second);
        assertEquals(p, fx.proposalService.getProposal(p.getId()).orElseThrow());
    }

    @Test
    void idsAreUniqueWithinTheSameSecond() {
        Set<ProposalId> ids = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            ids.add(fx.proposalService.createProposal(VOTER_A, "同名提案", "描述", null, null).getId());
        }
        assertEquals(5, ids.size());
        assertEquals(5, fx.proposalService.getProposalCount());
    }

    @Test
    void thresholdSnapshotSurvivesConfigChange() {
        Proposal p = create();
        fx.configService.updateVotingConfig(ADMIN, 3600, 0, 10_000, true);
        fx.proposalService.castVote(VOTER_A, p.getId(), true, "");

        Proposal after = fx.proposalService.getProposal(p.getId()).orElseThrow();
        assertEquals(5000, after.getQuorumThreshold());
        assertEquals(ProposalStatus.QUORUM_REACHED, after.getStatus());
    }
}
