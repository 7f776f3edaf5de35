package com.bit.governance.api;

import com.bit.governance.common.Address;
import com.bit.governance.result.Result;
import com.bit.governance.structure.dto.RegisterVoterRequest;
import com.bit.governance.structure.voter.VoterInfo;
import com.bit.governance.voter.VoterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/voter")
public class VoterApi {

    @Autowired
    private VoterRegistry voterRegistry;

    //注册或覆盖投票人 管理员
    @PostMapping("/register")
    public Result<VoterInfo> register(@RequestHeader(CallerHeader.NAME) String caller,
                                      @RequestBody RegisterVoterRequest request) {
        return Result.OK(voterRegistry.registerVoter(CallerHeader.parse(caller),
                Address.fromHex(request.getVoter()), request.getVotingPower()));
    }

    //停用投票人 管理员
    @PostMapping("/deactivate")
    public Result<VoterInfo> deactivate(@RequestHeader(CallerHeader.NAME) String caller,
                                        @RequestParam String voter) {
        return Result.OK(voterRegistry.deactivateVoter(CallerHeader.parse(caller), Address.fromHex(voter)));
    }

    @GetMapping("/detail")
    public Result<VoterInfo> detail(@RequestParam String voter) {
        return voterRegistry.getVoter(Address.fromHex(voter))
                .map(Result::OK)
                .orElseGet(() -> Result.error(404, "投票人不存在"));
    }

    @GetMapping("/power")
    public Result<Long> power(@RequestParam String voter) {
        return Result.OK(voterRegistry.getVotingPower(Address.fromHex(voter)));
    }

    @GetMapping("/total")
    public Result<Long> total() {
        return Result.OK(voterRegistry.getTotalVotingPower());
    }
}
