package com.bit.governance.api;

import com.bit.governance.common.Address;
import com.bit.governance.common.StrategyId;
import com.bit.governance.result.Result;
import com.bit.governance.strategy.CandidateRanking;
import com.bit.governance.strategy.StrategyService;
import com.bit.governance.structure.dto.CreateStrategyRequest;
import com.bit.governance.structure.strategy.StrategyExecution;
import com.bit.governance.structure.strategy.StrategyOutcome;
import com.bit.governance.structure.strategy.VotingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/strategy")
public class StrategyApi {

    @Autowired
    private StrategyService strategyService;

    @PostMapping("/create")
    public Result<VotingStrategy> create(@RequestHeader(CallerHeader.NAME) String caller,
                                         @RequestBody CreateStrategyRequest request) {
        return Result.OK(strategyService.createStrategy(CallerHeader.parse(caller),
                request.getName(), request.getDescription(), request.getStrategyType(),
                request.getMaxCandidates(), request.getMinPerformanceScore(),
                request.isAutoExecute(), request.getExecutionInterval()));
    }

    //执行或预演 风险过高时返回软拒绝
    @PostMapping("/execute")
    public Result<StrategyOutcome> execute(@RequestHeader(CallerHeader.NAME) String caller,
                                           @RequestParam String id,
                                           @RequestParam(defaultValue = "false") boolean dryRun) {
        return strategyService.executeStrategy(CallerHeader.parse(caller), StrategyId.fromHex(id), dryRun);
    }

    @PostMapping("/trigger")
    public Result<StrategyOutcome> trigger(@RequestParam String id) {
        return strategyService.triggerAutomatedVoting(StrategyId.fromHex(id));
    }

    @PostMapping("/deactivate")
    public Result<VotingStrategy> deactivate(@RequestHeader(CallerHeader.NAME) String caller,
                                             @RequestParam String id) {
        return Result.OK(strategyService.deactivateStrategy(CallerHeader.parse(caller), StrategyId.fromHex(id)));
    }

    @GetMapping("/detail")
    public Result<VotingStrategy> detail(@RequestParam String id) {
        return strategyService.getStrategy(StrategyId.fromHex(id))
                .map(Result::OK)
                .orElseGet(() -> Result.error(404, "策略不存在"));
    }

    @GetMapping("/execution")
    public Result<StrategyExecution> execution(@RequestParam String id, @RequestParam long sequence) {
        return strategyService.getExecution(StrategyId.fromHex(id), sequence)
                .map(Result::OK)
                .orElseGet(() -> Result.error(404, "执行记录不存在"));
    }

    @GetMapping("/recommendation/performance")
    public Result<List<Address>> performance(@RequestParam int maxCandidates,
                                             @RequestParam(defaultValue = "0") int minScore) {
        return Result.OK(strategyService.getPerformanceBasedRecommendation(maxCandidates, minScore));
    }

    @GetMapping("/recommendation/risk")
    public Result<List<Address>> risk(@RequestParam int maxCandidates,
                                      @RequestParam(defaultValue = "" + CandidateRanking.DEFAULT_RISK_TOLERANCE) int riskTolerance) {
        return Result.OK(strategyService.getRiskAdjustedRecommendation(maxCandidates, riskTolerance));
    }

    @GetMapping("/recommendation/diversification")
    public Result<List<Address>> diversification(@RequestParam int maxCandidates) {
        return Result.OK(strategyService.getDiversificationRecommendation(maxCandidates));
    }
}
