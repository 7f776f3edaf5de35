package com.bit.governance.api;

import com.bit.governance.result.Result;
import com.bit.governance.structure.config.VotingConfig;
import com.bit.governance.structure.dto.UpdateVotingConfigRequest;
import com.bit.governance.voting.VotingConfigService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/config")
public class ConfigApi {

    @Autowired
    private VotingConfigService votingConfigService;

    @GetMapping("/get")
    public Result<VotingConfig> get() {
        return Result.OK(votingConfigService.getVotingConfig());
    }

    @PostMapping("/update")
    public Result<VotingConfig> update(@RequestHeader(CallerHeader.NAME) String caller,
                                       @RequestBody UpdateVotingConfigRequest request) {
        return Result.OK(votingConfigService.updateVotingConfig(CallerHeader.parse(caller),
                request.getVotingPeriod(), request.getExecutionDelay(),
                request.getQuorumThreshold(), request.isRequireRegistration()));
    }
}
