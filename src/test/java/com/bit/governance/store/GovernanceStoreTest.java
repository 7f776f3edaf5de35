package com.bit.governance.store;

import com.bit.governance.config.SystemConfig;
import com.bit.governance.database.DbOperation;
import com.bit.governance.database.TableEnum;
import com.bit.governance.database.memory.MemoryDb;
import com.bit.governance.event.EventType;
import com.bit.governance.event.GovernanceEvent;
import com.bit.governance.event.impl.EventLog;
import com.bit.governance.exception.ErrorType;
import com.bit.governance.exception.GovernanceException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GovernanceStoreTest {

    private static class FailingDb extends MemoryDb {
        @Override
        public boolean dataTransaction(List<DbOperation> operations) {
            return false;
        }
    }

    @Test
    void eventsArePublishedOnlyAfterCommit() {
        EventLog events = new EventLog(new SystemConfig());
        GovernanceStore store = new GovernanceStore(new MemoryDb(), events);

        WriteSet writeSet = new WriteSet();
        store.stageCounter(writeSet, GovernanceStore.PROPOSAL_COUNT, 7);
        writeSet.event(GovernanceEvent.of(EventType.PROPOSAL_CREATED, "p", "c", 1));
        assertEquals(0, store.counter(GovernanceStore.PROPOSAL_COUNT));
        assertTrue(events.recent(10).isEmpty());

        store.commit(writeSet);
        assertEquals(7, store.counter(GovernanceStore.PROPOSAL_COUNT));
        assertEquals(1, events.recent(10).size());
    }

    @Test
    void failedCommitRaisesStorageErrorWithoutEvents() {
        EventLog events = new EventLog(new SystemConfig());
        FailingDb dataBase = new FailingDb();
        GovernanceStore store = new GovernanceStore(dataBase, events);

        WriteSet writeSet = new WriteSet();
        store.stageCounter(writeSet, GovernanceStore.STRATEGY_COUNT, 1);
        writeSet.event(GovernanceEvent.of(EventType.STRATEGY_CREATED, "s", "c", 1));

        GovernanceException e = assertThrows(GovernanceException.class, () -> store.commit(writeSet));
        assertEquals(ErrorType.STORAGE_FAILED, e.getErrorType());
        assertTrue(events.recent(10).isEmpty());
        assertEquals(0, dataBase.count(TableEnum.META));
    }

    @Test
    void corruptedBytesRaiseStorageError() {
        MemoryDb dataBase = new MemoryDb();
        GovernanceStore store = new GovernanceStore(dataBase, new EventLog(new SystemConfig()));
        byte[] id = new byte[32];
        dataBase.insert(TableEnum.PROPOSAL, id, new byte[]{(byte) 0xFF, 0x01});

        GovernanceException e = assertThrows(GovernanceException.class,
                () -> store.getProposal(com.bit.governance.common.ProposalId.fromBytes(id)));
        assertEquals(ErrorType.STORAGE_FAILED, e.getErrorType());
    }
}
