package com.bit.governance.structure.dto;

import lombok.Data;

@Data
public class CastVoteRequest {
    private String proposalId;
    private boolean support;
    private String reason;
}
