package com.bit.governance.api;

import com.bit.governance.event.EventSink;
import com.bit.governance.event.GovernanceEvent;
import com.bit.governance.result.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/events")
public class EventApi {

    @Autowired
    private EventSink eventSink;

    @GetMapping("/recent")
    public Result<List<GovernanceEvent>> recent(@RequestParam(defaultValue = "50") int limit) {
        return Result.OK(eventSink.recent(limit));
    }
}
