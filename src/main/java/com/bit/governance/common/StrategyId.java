package com.bit.governance.common;

/**
 * 投票策略ID
 */
public class StrategyId extends ByteHash32 {

    public StrategyId(byte[] value) {
        super(value);
    }

    public static StrategyId fromBytes(byte[] bytes) {
        return new StrategyId(bytes);
    }

    public static StrategyId fromHex(String hex) {
        return new StrategyId(hexToBytes(hex));
    }
}
