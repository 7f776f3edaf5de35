package com.bit.governance.database.memory;

import com.bit.governance.database.DataBase;
import com.bit.governance.database.DbConfig;
import com.bit.governance.database.DbOperation;
import com.bit.governance.database.KeyValueHandler;
import com.bit.governance.database.TableEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存实现：所有表共用一个有序 Map，键为 {表前缀}{实体ID}
 * 用于测试与单机演示，进程退出数据即丢失
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "system.db", name = "type", havingValue = "memory")
public class MemoryDb implements DataBase {

    private final ConcurrentSkipListMap<byte[], byte[]> store = new ConcurrentSkipListMap<>(Arrays::compareUnsigned);
    // 事务提交持有写锁，保证批量写入整体可见
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    @Override
    public boolean createDatabase(DbConfig config) {
        log.info("内存数据库已就绪");
        return true;
    }

    @Override
    public boolean closeDatabase() {
        close();
        return true;
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            store.put(table.prefixed(key), value.clone());
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        rwLock.writeLock().lock();
        try {
            store.remove(table.prefixed(key));
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            byte[] value = store.get(table.prefixed(key));
            return value == null ? null : value.clone();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        rwLock.readLock().lock();
        try {
            return tableView(table).size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            log.warn("事务操作列表为空，无需执行");
            return true;
        }
        // 先校验再写入，校验失败时不落任何数据
        for (DbOperation op : operations) {
            if (op.table == null || op.key == null || op.type == null) {
                log.error("事务包含非法操作，整体放弃");
                return false;
            }
            if (op.type != DbOperation.OpType.DELETE && op.value == null) {
                log.error("事务写操作缺少值，整体放弃, table={}", op.table);
                return false;
            }
        }
        rwLock.writeLock().lock();
        try {
            for (DbOperation op : operations) {
                byte[] fullKey = op.table.prefixed(op.key);
                if (op.type == DbOperation.OpType.DELETE) {
                    store.remove(fullKey);
                } else {
                    store.put(fullKey, op.value.clone());
                }
            }
            log.debug("事务执行成功，操作数: {}", operations.size());
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        if (table == null || handler == null) {
            log.warn("迭代表失败：表名或处理器不能为空");
            return;
        }
        List<Map.Entry<byte[], byte[]>> snapshot;
        rwLock.readLock().lock();
        try {
            snapshot = new ArrayList<>(tableView(table).entrySet());
        } finally {
            rwLock.readLock().unlock();
        }
        for (Map.Entry<byte[], byte[]> entry : snapshot) {
            byte[] fullKey = entry.getKey();
            byte[] key = Arrays.copyOfRange(fullKey, 1, fullKey.length);
            if (!handler.handle(key, entry.getValue().clone())) {
                break;
            }
        }
    }

    @Override
    public List<String> listAllTables() {
        List<String> tables = new ArrayList<>();
        for (TableEnum table : TableEnum.values()) {
            tables.add(table.getColumnFamilyName());
        }
        return tables;
    }

    @Override
    public boolean checkHealth() {
        return true;
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            store.clear();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    // 表前缀范围 [code, code+1)
    private ConcurrentNavigableMap<byte[], byte[]> tableView(TableEnum table) {
        byte[] from = {table.getCode()};
        byte[] to = {(byte) (table.getCode() + 1)};
        return store.subMap(from, true, to, false);
    }
}
