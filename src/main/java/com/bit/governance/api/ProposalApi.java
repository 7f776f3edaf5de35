package com.bit.governance.api;

import com.bit.governance.common.Address;
import com.bit.governance.common.ProposalId;
import com.bit.governance.proposal.ProposalService;
import com.bit.governance.result.Result;
import com.bit.governance.structure.dto.CastVoteRequest;
import com.bit.governance.structure.dto.CreateProposalRequest;
import com.bit.governance.structure.proposal.Proposal;
import com.bit.governance.structure.proposal.Vote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/proposal")
public class ProposalApi {

    @Autowired
    private ProposalService proposalService;

    //创建提案
    @PostMapping("/create")
    public Result<Proposal> create(@RequestHeader(CallerHeader.NAME) String caller,
                                   @RequestBody CreateProposalRequest request) {
        Proposal proposal = proposalService.createProposal(
                CallerHeader.parse(caller),
                request.getTitle(),
                request.getDescription(),
                CallerHeader.optionalBytes(request.getExecutionData()),
                CallerHeader.optionalAddress(request.getTarget()));
        return Result.OK(proposal);
    }

    //投票
    @PostMapping("/vote")
    public Result<Vote> vote(@RequestHeader(CallerHeader.NAME) String caller,
                             @RequestBody CastVoteRequest request) {
        Vote vote = proposalService.castVote(CallerHeader.parse(caller),
                ProposalId.fromHex(request.getProposalId()), request.isSupport(), request.getReason());
        return Result.OK(vote);
    }

    //到期结算
    @PostMapping("/execute")
    public Result<Boolean> execute(@RequestHeader(CallerHeader.NAME) String caller, @RequestParam String id) {
        return Result.OK(proposalService.executeProposal(CallerHeader.parse(caller), ProposalId.fromHex(id)));
    }

    //取消 管理员
    @PostMapping("/cancel")
    public Result<Proposal> cancel(@RequestHeader(CallerHeader.NAME) String caller, @RequestParam String id) {
        return Result.OK(proposalService.cancelProposal(CallerHeader.parse(caller), ProposalId.fromHex(id)));
    }

    @GetMapping("/detail")
    public Result<Proposal> detail(@RequestParam String id) {
        return proposalService.getProposal(ProposalId.fromHex(id))
                .map(Result::OK)
                .orElseGet(() -> Result.error(404, "提案不存在"));
    }

    @GetMapping("/vote")
    public Result<Vote> voteDetail(@RequestParam String id, @RequestParam String voter) {
        Address address = Address.fromHex(voter);
        return proposalService.getVote(ProposalId.fromHex(id), address)
                .map(Result::OK)
                .orElseGet(() -> Result.error(404, "选票不存在"));
    }

    @GetMapping("/count")
    public Result<Long> count() {
        return Result.OK(proposalService.getProposalCount());
    }
}
