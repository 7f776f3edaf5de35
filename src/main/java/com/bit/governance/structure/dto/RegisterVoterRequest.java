package com.bit.governance.structure.dto;

import lombok.Data;

@Data
public class RegisterVoterRequest {
    private String voter;
    private long votingPower;
}
