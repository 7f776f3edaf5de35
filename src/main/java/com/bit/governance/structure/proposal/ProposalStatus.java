package com.bit.governance.structure.proposal;

/**
 * 提案状态，只能向前流转
 */
public enum ProposalStatus {
    /** 投票中 */
    ACTIVE(0),
    /** 已达法定票数，仍可继续投票 */
    QUORUM_REACHED(1),
    /** 通过并已执行 */
    EXECUTED(2),
    /** 未通过 */
    FAILED(3),
    /** 管理员取消 */
    CANCELLED(4),
    /** 通过但执行器报错 */
    EXECUTION_FAILED(5),

    ;

    private final int code;

    ProposalStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static ProposalStatus fromCode(int code) {
        for (ProposalStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知的提案状态: " + code);
    }

    /**
     * 终态：不再接受投票、执行或取消
     */
    public boolean isTerminal() {
        return this == EXECUTED || this == FAILED || this == CANCELLED || this == EXECUTION_FAILED;
    }

    public boolean acceptsVotes() {
        return this == ACTIVE || this == QUORUM_REACHED;
    }
}
