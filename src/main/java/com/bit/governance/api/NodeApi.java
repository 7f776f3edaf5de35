package com.bit.governance.api;

import com.bit.governance.common.Address;
import com.bit.governance.node.NodeBehaviorAnalyzer;
import com.bit.governance.result.Result;
import com.bit.governance.structure.dto.NodeMetricsRequest;
import com.bit.governance.structure.node.NodeBehaviorAnalysis;
import com.bit.governance.structure.node.NodeMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/node")
public class NodeApi {

    @Autowired
    private NodeBehaviorAnalyzer nodeBehaviorAnalyzer;

    //上报节点指标
    @PostMapping("/metrics")
    public Result<NodeMetrics> updateMetrics(@RequestHeader(CallerHeader.NAME) String caller,
                                             @RequestBody NodeMetricsRequest request) {
        return Result.OK(nodeBehaviorAnalyzer.updateNodeMetrics(CallerHeader.parse(caller),
                Address.fromHex(request.getNode()), request.getUptimePercentage(),
                request.getPerformanceScore(), request.getBlocksProduced(),
                request.getConsensusParticipation()));
    }

    @GetMapping("/metrics")
    public Result<NodeMetrics> metrics(@RequestParam String node) {
        return nodeBehaviorAnalyzer.getNodeMetrics(Address.fromHex(node))
                .map(Result::OK)
                .orElseGet(() -> Result.error(404, "节点没有上报指标"));
    }

    @GetMapping("/list")
    public Result<List<NodeMetrics>> list() {
        return Result.OK(nodeBehaviorAnalyzer.listNodeMetrics());
    }

    @PostMapping("/analyze")
    public Result<NodeBehaviorAnalysis> analyze(@RequestHeader(CallerHeader.NAME) String caller,
                                                @RequestParam String node,
                                                @RequestParam(defaultValue = "30") int analysisPeriod) {
        return Result.OK(nodeBehaviorAnalyzer.analyzeNodeBehavior(CallerHeader.parse(caller),
                Address.fromHex(node), analysisPeriod));
    }

    @GetMapping("/analysis")
    public Result<NodeBehaviorAnalysis> analysis(@RequestParam String node) {
        return nodeBehaviorAnalyzer.getNodeAnalysis(Address.fromHex(node))
                .map(Result::OK)
                .orElseGet(() -> Result.error(404, "节点没有分析结果"));
    }
}
