package com.bit.governance.structure.dto;

import lombok.Data;

@Data
public class CreateProposalRequest {
    private String title;
    private String description;
    private String executionData;//载荷十六进制，可为空
    private String target;//目标地址十六进制，可为空
}
