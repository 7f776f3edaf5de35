package com.bit.governance.event.impl;

import com.bit.governance.config.SystemConfig;
import com.bit.governance.event.EventSink;
import com.bit.governance.event.GovernanceEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 有界事件日志：保留最近 N 条，同时输出到日志
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventLog implements EventSink {

    private final SystemConfig config;

    private final Deque<GovernanceEvent> events = new ArrayDeque<>();
    private long sequence = 0;

    @Override
    public synchronized void publish(GovernanceEvent event) {
        event.setSequence(++sequence);
        events.addLast(event);
        int capacity = Math.max(1, config.getEvents().getCapacity());
        while (events.size() > capacity) {
            events.removeFirst();
        }
        log.info("事件#{} {} subject={} caller={} {}", event.getSequence(), event.getType(),
                event.getSubject(), event.getCaller(), event.getAttributes());
    }

    @Override
    public synchronized List<GovernanceEvent> recent(int limit) {
        List<GovernanceEvent> result = new ArrayList<>();
        if (limit <= 0) {
            return result;
        }
        Iterator<GovernanceEvent> it = events.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(0, it.next());
        }
        return result;
    }
}
