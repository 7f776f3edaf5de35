package com.bit.governance.store;

import com.bit.governance.database.DbOperation;
import com.bit.governance.database.TableEnum;
import com.bit.governance.event.GovernanceEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次业务操作的全部写入与待发布事件，整体提交
 */
public class WriteSet {

    private final List<DbOperation> operations = new ArrayList<>();
    private final List<GovernanceEvent> events = new ArrayList<>();

    public WriteSet put(TableEnum table, byte[] key, byte[] value) {
        operations.add(DbOperation.put(table, key, value));
        return this;
    }

    public WriteSet event(GovernanceEvent event) {
        events.add(event);
        return this;
    }

    public List<DbOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public List<GovernanceEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }
}
