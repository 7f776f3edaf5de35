package com.bit.governance.api;

import com.bit.governance.exception.ErrorType;
import com.bit.governance.result.Result;
import com.jayway.jsonpath.JsonPath;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Slf4j
@SpringBootTest(properties = {
        "system.db.type=memory",
        "system.admins[0]=" + GovernanceApiTest.ADMIN,
        "system.strategy.scheduler-enabled=false"
})
@AutoConfigureMockMvc
public class GovernanceApiTest {

    static final String ADMIN = "ab00000000000000000000000000000000000000000000000000000000000001";
    private static final String VOTER = "ab000000000000000000000000000000000000000000000000000000000000a1";
    private static final String NODE = "ab000000000000000000000000000000000000000000000000000000000000b1";
    private static final String CALLER = "X-Caller";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void proposalFlowOverHttp() throws Exception {
        mockMvc.perform(post("/voter/register").header(CALLER, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"voter\":\"" + VOTER + "\",\"votingPower\":1000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.address").value(VOTER));

        String created = mockMvc.perform(post("/proposal/create").header(CALLER, VOTER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"调整参数\",\"description\":\"提高阈值\",\"executionData\":\"0a0b\"}"))
                .andExpect(jsonPath("$.code").value(Result.SC_OK_200))
                .andExpect(jsonPath("$.data.status").value("ACTIVE"))
                .andReturn().getResponse().getContentAsString();
        String id = JsonPath.read(created, "$.data.id");
        log.info("提案ID: {}", id);

        mockMvc.perform(post("/proposal/vote").header(CALLER, VOTER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"proposalId\":\"" + id + "\",\"support\":true,\"reason\":\"同意\"}"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.votingPower").value(1000));

        mockMvc.perform(post("/proposal/vote").header(CALLER, VOTER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"proposalId\":\"" + id + "\",\"support\":false}"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(ErrorType.STATE_CONFLICT.getCode()));

        mockMvc.perform(get("/proposal/detail").param("id", id))
                .andExpect(jsonPath("$.data.status").value("QUORUM_REACHED"))
                .andExpect(jsonPath("$.data.yesVotes").value(1000));

        mockMvc.perform(post("/proposal/execute").header(CALLER, VOTER).param("id", id))
                .andExpect(jsonPath("$.code").value(ErrorType.STATE_CONFLICT.getCode()));

        mockMvc.perform(get("/events/recent").param("limit", "100"))
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void requestErrorsMapToEnvelopeCodes() throws Exception {
        mockMvc.perform(post("/voter/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"voter\":\"" + VOTER + "\",\"votingPower\":1}"))
                .andExpect(jsonPath("$.code").value(ErrorType.VALIDATION.getCode()));

        mockMvc.perform(post("/voter/register").header(CALLER, "zz")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"voter\":\"" + VOTER + "\",\"votingPower\":1}"))
                .andExpect(jsonPath("$.code").value(ErrorType.VALIDATION.getCode()));

        mockMvc.perform(post("/voter/register").header(CALLER, VOTER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"voter\":\"" + VOTER + "\",\"votingPower\":1}"))
                .andExpect(jsonPath("$.code").value(ErrorType.AUTHORIZATION.getCode()));

        mockMvc.perform(get("/proposal/detail").param("id", "00".repeat(32)))
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void riskyStrategyIsSoftRejected() throws Exception {
        mockMvc.perform(post("/node/metrics").header(CALLER, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"node\":\"" + NODE + "\",\"uptimePercentage\":15,\"performanceScore\":15,"
                                + "\"blocksProduced\":0,\"consensusParticipation\":10}"))
                .andExpect(jsonPath("$.data.trendDirection").value(0));

        String created = mockMvc.perform(post("/strategy/create").header(CALLER, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"性能优先\",\"strategyType\":\"PERFORMANCE_BASED\","
                                + "\"maxCandidates\":1,\"minPerformanceScore\":0}"))
                .andExpect(jsonPath("$.success").value(true))
                .andReturn().getResponse().getContentAsString();
        String id = JsonPath.read(created, "$.data.id");

        mockMvc.perform(post("/strategy/execute").header(CALLER, ADMIN).param("id", id))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(Result.SOFT_REJECTED))
                .andExpect(jsonPath("$.data.riskScore").value(85));

        mockMvc.perform(get("/strategy/detail").param("id", id))
                .andExpect(jsonPath("$.data.executionCount").value(0));

        mockMvc.perform(post("/node/analyze").header(CALLER, ADMIN).param("node", NODE))
                .andExpect(jsonPath("$.data.riskLevel").value("HIGH"))
                .andExpect(jsonPath("$.data.recommendation").value("Poor"));
    }
}
