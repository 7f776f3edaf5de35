package com.bit.governance.event;

/**
 * 治理事件类型
 */
public enum EventType {
    PROPOSAL_CREATED,
    VOTE_CAST,
    QUORUM_REACHED,
    PROPOSAL_EXECUTED,
    PROPOSAL_CANCELLED,
    VOTER_REGISTERED,
    VOTER_DEACTIVATED,
    VOTING_CONFIG_UPDATED,
    STRATEGY_CREATED,
    STRATEGY_EXECUTED,
    STRATEGY_DEACTIVATED,
    VOTING_RECOMMENDATION_GENERATED,
    AUTOMATED_VOTING_TRIGGERED,
    NODE_METRICS_UPDATED,
    RISK_ALERT_GENERATED,
    COUNCIL_NODE_ANALYZED,
}
