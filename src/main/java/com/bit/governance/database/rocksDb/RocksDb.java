package com.bit.governance.database.rocksDb;

import com.bit.governance.database.DataBase;
import com.bit.governance.database.DbConfig;
import com.bit.governance.database.DbOperation;
import com.bit.governance.database.KeyValueHandler;
import com.bit.governance.database.TableEnum;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * RocksDB 实现：每张表一个列族，键不再重复携带前缀
 * 每张表配一个 Caffeine 读缓存，写入/事务提交后同步刷新
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "system.db", name = "type", havingValue = "rocksdb", matchIfMissing = true)
public class RocksDb implements DataBase {

    static {
        RocksDB.loadLibrary();
    }

    // 按照表隔离的缓存，键用 ByteBuffer 包装以按内容比较
    private final Map<TableEnum, Cache<ByteBuffer, byte[]>> tableCaches = new ConcurrentHashMap<>();
    private final Map<TableEnum, ColumnFamilyHandle> handles = new EnumMap<>(TableEnum.class);
    private final List<ColumnFamilyHandle> allHandles = new ArrayList<>();

    private RocksDB db;
    private DBOptions dbOptions;
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private String dbPath;

    @Override
    public boolean createDatabase(DbConfig config) {
        String path = config.getPath();
        if (path == null) {
            log.error("未配置数据库路径 system.db.path");
            return false;
        }
        dbPath = path;

        for (TableEnum table : TableEnum.values()) {
            Cache<ByteBuffer, byte[]> cache = Caffeine.newBuilder()
                    .maximumSize(table.getCacheSize())
                    .expireAfterWrite(table.getCacheTtlMinutes(), TimeUnit.MINUTES)
                    .build();
            tableCaches.put(table, cache);
        }

        try {
            File dbDir = new File(dbPath);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                log.error("创建数据库目录失败: {}", dbPath);
                return false;
            }

            List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
            // 1. 默认列族（索引0）
            cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, new ColumnFamilyOptions()));

            // 2. 自定义列族（按 TableEnum 顺序）
            Map<TableEnum, ColumnFamilyDescriptor> customDescriptors = RTable.getColumnFamilyDescriptors();
            List<TableEnum> tableEnums = new ArrayList<>(customDescriptors.keySet());
            for (TableEnum table : tableEnums) {
                cfDescriptors.add(customDescriptors.get(table));
            }

            dbOptions = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true)
                    .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);

            db = RocksDB.open(dbOptions, dbPath, cfDescriptors, allHandles);

            if (allHandles.size() != cfDescriptors.size()) {
                throw new IllegalStateException("列族句柄数量与描述符不匹配，初始化失败");
            }
            // 自定义列族从索引1开始绑定
            for (int i = 0; i < tableEnums.size(); i++) {
                handles.put(tableEnums.get(i), allHandles.get(i + 1));
                log.debug("绑定表[{}]的列族句柄，索引: {}", tableEnums.get(i), i + 1);
            }

            log.info("RocksDB创建成功，路径: {}，列族总数: {}", dbPath, cfDescriptors.size());
            return true;
        } catch (RocksDBException e) {
            log.error("创建RocksDB失败", e);
            return false;
        }
    }

    @Override
    public boolean closeDatabase() {
        try {
            close();
            log.info("数据库已关闭");
            return true;
        } catch (Exception e) {
            log.error("关闭数据库失败", e);
            return false;
        }
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            db.put(requireHandle(table), key, value);
            cache(table).put(ByteBuffer.wrap(key.clone()), value.clone());
        } catch (RocksDBException e) {
            log.error("插入数据失败, table={}", table, e);
            throw new IllegalStateException("插入数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        rwLock.writeLock().lock();
        try {
            db.delete(requireHandle(table), key);
            cache(table).invalidate(ByteBuffer.wrap(key));
        } catch (RocksDBException e) {
            log.error("删除数据失败, table={}", table, e);
            throw new IllegalStateException("删除数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        // RocksDB的更新就是覆盖写入
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            ByteBuffer cacheKey = ByteBuffer.wrap(key.clone());
            byte[] cached = cache(table).getIfPresent(cacheKey);
            if (cached != null) {
                return cached.clone();
            }
            byte[] value = db.get(requireHandle(table), key);
            if (value != null) {
                cache(table).put(cacheKey, value.clone());
            }
            return value;
        } catch (RocksDBException e) {
            log.error("获取数据失败, table={}", table, e);
            throw new IllegalStateException("获取数据失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        int[] count = {0};
        iterate(table, (key, value) -> {
            count[0]++;
            return true;
        });
        return count[0];
    }

    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            log.warn("事务操作列表为空，无需执行");
            return true;
        }

        rwLock.writeLock().lock();
        try (WriteBatch writeBatch = new WriteBatch();
             WriteOptions writeOptions = new WriteOptions().setSync(true)) {
            // 1. 校验所有操作的表（列族）是否存在，并添加到事务批次
            for (DbOperation op : operations) {
                ColumnFamilyHandle cfHandle = requireHandle(op.table);
                switch (op.type) {
                    case INSERT:
                    case UPDATE:
                        writeBatch.put(cfHandle, op.key, op.value);
                        break;
                    case DELETE:
                        writeBatch.delete(cfHandle, op.key);
                        break;
                    default:
                        throw new IllegalArgumentException("不支持的操作类型: " + op.type);
                }
            }

            // 2. 执行事务（原子提交，WriteBatch 要么全成功，要么全失败）
            db.write(writeOptions, writeBatch);

            // 3. 提交成功后刷新缓存
            for (DbOperation op : operations) {
                ByteBuffer cacheKey = ByteBuffer.wrap(op.key.clone());
                if (op.type == DbOperation.OpType.DELETE) {
                    cache(op.table).invalidate(cacheKey);
                } else {
                    cache(op.table).put(cacheKey, op.value.clone());
                }
            }
            log.debug("事务执行成功，操作数: {}", operations.size());
            return true;
        } catch (RocksDBException e) {
            log.error("事务执行失败", e);
            return false;
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
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            iterator.seekToFirst();
            while (iterator.isValid()) {
                // 调用处理器处理键值对，返回false则停止迭代
                if (!handler.handle(iterator.key(), iterator.value())) {
                    break;
                }
                iterator.next();
            }
        } finally {
            rwLock.readLock().unlock();
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
        if (db == null) {
            log.warn("数据库健康检查失败：连接未初始化");
            return false;
        }
        rwLock.writeLock().lock();
        try {
            // 通过简单读写验证数据库可用性
            byte[] testKey = "health_check".getBytes();
            db.put(testKey, new byte[]{1});
            db.delete(testKey);
            return true;
        } catch (RocksDBException e) {
            log.error("数据库健康检查失败", e);
            return false;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            if (db != null) {
                for (ColumnFamilyHandle handle : allHandles) {
                    handle.close();
                }
                allHandles.clear();
                handles.clear();
                db.close();
                db = null;
                if (dbOptions != null) {
                    dbOptions.close();
                    dbOptions = null;
                }
                log.info("RocksDB连接已关闭");
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * 获取表对应的列族句柄
     */
    private ColumnFamilyHandle requireHandle(TableEnum table) {
        ColumnFamilyHandle handle = handles.get(table);
        if (handle == null) {
            throw new IllegalArgumentException("表不存在: " + table);
        }
        return handle;
    }

    private Cache<ByteBuffer, byte[]> cache(TableEnum table) {
        return tableCaches.get(table);
    }
}
