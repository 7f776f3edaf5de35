package com.bit.governance.event.impl;

import com.bit.governance.config.SystemConfig;
import com.bit.governance.event.EventType;
import com.bit.governance.event.GovernanceEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EventLogTest {

    @Test
    void keepsMostRecentEventsInOrder() {
        SystemConfig config = new SystemConfig();
        config.getEvents().setCapacity(3);
        EventLog log = new EventLog(config);
        for (int i = 0; i < 5; i++) {
            log.publish(GovernanceEvent.of(EventType.VOTE_CAST, "p" + i, "c", i));
        }

        List<GovernanceEvent> recent = log.recent(10);
        assertEquals(3, recent.size());
        assertEquals("p2", recent.get(0).getSubject());
        assertEquals("p4", recent.get(2).getSubject());
        assertEquals(5, recent.get(2).getSequence());

        List<GovernanceEvent> lastTwo = log.recent(2);
        assertEquals("p3", lastTwo.get(0).getSubject());
        assertTrue(log.recent(0).isEmpty());
    }
}
