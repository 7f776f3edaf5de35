package com.bit.governance.common;

import com.bit.governance.util.ByteUtils;
import com.bit.governance.util.Sha;

/**
 * 内容寻址ID生成：SHA-256(时间戳 ‖ 单调计数器 ‖ 调用方熵)
 * 相同输入产生相同ID，计数器保证同一秒内的唯一性
 */
public final class ContentIdGenerator {

    private ContentIdGenerator() {
    }

    public static byte[] generate(long now, long counter, byte[] entropy) {
        byte[] data = ByteUtils.concat(
                ByteUtils.longToBytes(now),
                ByteUtils.longToBytes(counter),
                entropy == null ? new byte[0] : entropy);
        return Sha.applySHA256(data);
    }

    public static ProposalId proposalId(long now, long counter, byte[] entropy) {
        return ProposalId.fromBytes(generate(now, counter, entropy));
    }

    public static StrategyId strategyId(long now, long counter, byte[] entropy) {
        return StrategyId.fromBytes(generate(now, counter, entropy));
    }
}
