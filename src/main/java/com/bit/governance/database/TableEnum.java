package com.bit.governance.database;

import lombok.Getter;

/**
 * 表枚举（集中管理所有表的元信息，作为唯一数据源）
 * code 同时作为存储键的前缀字节：{code}{实体ID}
 */
public enum TableEnum {
    PROPOSAL((byte) 1, "proposal", 10_000, 60),
    // 键：提案ID(32) + 投票人地址(32)
    VOTE((byte) 2, "vote", 20_000, 30),
    VOTER((byte) 3, "voter", 10_000, 60),
    CONFIG((byte) 4, "config", 16, 60),
    // 计数器等全局元数据
    META((byte) 5, "meta", 16, 60),
    STRATEGY((byte) 6, "strategy", 2_000, 60),
    // 键：策略ID(32) + 执行序号(8，大端)
    STRATEGY_EXECUTION((byte) 7, "strategy_execution", 2_000, 10),
    NODE_METRICS((byte) 8, "node_metrics", 5_000, 30),
    NODE_ANALYSIS((byte) 9, "node_analysis", 5_000, 30);

    @Getter private final byte code;  // 表唯一标识（键前缀）
    @Getter private final String columnFamilyName;  // 列族实际存储名称
    @Getter private final long cacheSize;  // 缓存条数
    @Getter private final long cacheTtlMinutes;  // 缓存时长 单位分钟

    TableEnum(byte code, String columnFamilyName, long cacheSize, long cacheTtlMinutes) {
        this.code = code;
        this.columnFamilyName = columnFamilyName;
        this.cacheSize = cacheSize;
        this.cacheTtlMinutes = cacheTtlMinutes;
    }

    /**
     * 构造带前缀的存储键
     */
    public byte[] prefixed(byte[] key) {
        byte[] full = new byte[key.length + 1];
        full[0] = code;
        System.arraycopy(key, 0, full, 1, key.length);
        return full;
    }
}
