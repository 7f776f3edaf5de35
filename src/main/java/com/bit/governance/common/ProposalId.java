package com.bit.governance.common;

/**
 * 提案ID：SHA-256 内容寻址
 */
public class ProposalId extends ByteHash32 {

    public ProposalId(byte[] value) {
        super(value);
    }

    public static ProposalId fromBytes(byte[] bytes) {
        return new ProposalId(bytes);
    }

    public static ProposalId fromHex(String hex) {
        return new ProposalId(hexToBytes(hex));
    }
}
