package com.bit.governance.voting;

import com.bit.governance.event.EventType;
import com.bit.governance.exception.ErrorType;
import com.bit.governance.exception.GovernanceException;
import com.bit.governance.structure.config.VotingConfig;
import com.bit.governance.support.GovernanceFixture;
import org.junit.jupiter.api.Test;

import static com.bit.governance.support.GovernanceFixture.ADMIN;
import static org.junit.jupiter.api.Assertions.*;

public class VotingConfigServiceTest {

    private final GovernanceFixture fx = new GovernanceFixture();

    @Test
    void defaultsWhenNothingStored() {
        VotingConfig config = fx.configService.getVotingConfig();
        assertEquals(604_800, config.getVotingPeriod());
        assertEquals(86_400, config.getExecutionDelay());
        assertEquals(5000, config.getQuorumThreshold());
        assertTrue(config.isRequireRegistration());
    }

    @Test
    void updateIsLastWriteWins() {
        fx.configService.updateVotingConfig(ADMIN, 7200, 60, 6000, false);
        fx.configService.updateVotingConfig(ADMIN, 3600, 0, 10_000, true);
        assertEquals(new VotingConfig(3600, 0, 10_000, true), fx.configService.getVotingConfig());
        assertEquals(2, fx.count(EventType.VOTING_CONFIG_UPDATED));
    }

    @Test
    void invalidValuesAreRejected() {
        assertErrorType(ErrorType.AUTHORIZATION,
                () -> fx.configService.updateVotingConfig(GovernanceFixture.address(5), 7200, 0, 5000, true));
        assertErrorType(ErrorType.VALIDATION, () -> fx.configService.updateVotingConfig(ADMIN, 3599, 0, 5000, true));
        assertErrorType(ErrorType.VALIDATION, () -> fx.configService.updateVotingConfig(ADMIN, 3600, -1, 5000, true));
        assertErrorType(ErrorType.VALIDATION, () -> fx.configService.updateVotingConfig(ADMIN, 3600, 0, 0, true));
        assertErrorType(ErrorType.VALIDATION, () -> fx.configService.updateVotingConfig(ADMIN, 3600, 0, 10_001, true));
        assertEquals(VotingConfig.defaults(), fx.configService.getVotingConfig());
    }

    private static void assertErrorType(ErrorType type, org.junit.jupiter.api.function.Executable executable) {
        assertEquals(type, assertThrows(GovernanceException.class, executable).getErrorType());
    }
}
