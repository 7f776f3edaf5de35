package com.bit.governance.database;

/**
 * 封装事务中的单个操作
 */
public class DbOperation {
    public enum OpType { INSERT, UPDATE, DELETE }

    public final TableEnum table; // 表枚举
    public final byte[] key;      // 键（不含表前缀）
    public final byte[] value;    // 值（DELETE 操作可为 null）
    public final OpType type;     // 操作类型

    public DbOperation(TableEnum table, byte[] key, byte[] value, OpType type) {
        this.table = table;
        this.key = key;
        this.value = value;
        this.type = type;
    }

    public static DbOperation put(TableEnum table, byte[] key, byte[] value) {
        return new DbOperation(table, key, value, OpType.UPDATE);
    }

    public static DbOperation delete(TableEnum table, byte[] key) {
        return new DbOperation(table, key, null, OpType.DELETE);
    }
}
