package com.bit.governance.common;

import com.bit.governance.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Arrays;

/**
 * 身份地址封装（32字节公钥），统一投票人/提案人/节点的地址表示
 */
@EqualsAndHashCode
public class Address implements Comparable<Address> {
    public static final int LENGTH = 32;
    private final byte[] value;

    private Address(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为32字节");
        }
        this.value = value;
    }

    public static Address fromBytes(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("地址必须为32字节");
        }
        return new Address(Arrays.copyOf(bytes, bytes.length));
    }

    public static Address fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("地址十六进制长度必须为64: " + hex);
        }
        return new Address(ByteUtils.hexToBytes(hex));
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    @JsonValue
    public String toHex() {
        return ByteUtils.bytesToHex(value);
    }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
