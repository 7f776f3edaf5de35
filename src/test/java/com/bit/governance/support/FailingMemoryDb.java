package com.bit.governance.support;

import com.bit.governance.database.DbOperation;
import com.bit.governance.database.memory.MemoryDb;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 可以让下一次事务提交失败的内存数据库
 */
public class FailingMemoryDb extends MemoryDb {

    private final AtomicBoolean failNext = new AtomicBoolean();

    public void failNextTransaction() {
        failNext.set(true);
    }

    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (failNext.compareAndSet(true, false)) {
            return false;
        }
        return super.dataTransaction(operations);
    }
}
