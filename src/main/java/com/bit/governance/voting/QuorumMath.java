package com.bit.governance.voting;

import com.bit.governance.structure.config.VotingConfig;

import java.math.BigInteger;

/**
 * 法定票数计算，全部为整数运算
 */
public final class QuorumMath {

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(VotingConfig.MAX_BPS);

    private QuorumMath() {
    }

    /**
     * floor(total × bps / 10000)，中间值用 BigInteger 避免溢出
     */
    public static long requiredQuorum(long totalVotingPower, int thresholdBps) {
        checkBps(thresholdBps);
        if (totalVotingPower < 0) {
            throw new IllegalArgumentException("总票权不能为负: " + totalVotingPower);
        }
        return BigInteger.valueOf(totalVotingPower)
                .multiply(BigInteger.valueOf(thresholdBps))
                .divide(BPS_DENOMINATOR)
                .longValueExact();
    }

    public static boolean isQuorumReached(long castWeight, long totalVotingPower, int thresholdBps) {
        return castWeight >= requiredQuorum(totalVotingPower, thresholdBps);
    }

    /**
     * 达到法定票数且赞成票严格多于反对票
     */
    public static boolean isPassed(long yesVotes, long noVotes, long totalVotingPower, int thresholdBps) {
        long cast = Math.addExact(yesVotes, noVotes);
        return isQuorumReached(cast, totalVotingPower, thresholdBps) && yesVotes > noVotes;
    }

    public static boolean isValidBps(int bps) {
        return bps >= 1 && bps <= VotingConfig.MAX_BPS;
    }

    private static void checkBps(int bps) {
        if (!isValidBps(bps)) {
            throw new IllegalArgumentException("阈值必须在1~10000基点之间: " + bps);
        }
    }
}
