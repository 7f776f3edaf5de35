package com.bit.governance.common;

import com.bit.governance.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 32字节哈希标识的通用基类，封装共同逻辑（长度校验、不可变性、转换方法等）
 * 具体标识类型（提案ID、策略ID）继承此类
 */
@EqualsAndHashCode(of = "value")
public abstract class ByteHash32 implements Serializable {
    public static final int HASH_LENGTH = 32;

    // 存储32字节哈希数据（私有且不可变）
    private final byte[] value;
    // 缓存十六进制字符串（避免重复计算）
    private final String hexValue;

    /**
     * 构造方法，由子类调用，强制校验长度
     * @param value 32字节哈希的原始字节数组
     * @throws IllegalArgumentException 若长度不符
     */
    protected ByteHash32(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("哈希值不能为空");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("哈希必须为" + HASH_LENGTH + "字节，实际为" + value.length + "字节");
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH); // 防御性拷贝
        this.hexValue = ByteUtils.bytesToHex(this.value);
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] getBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    /**
     * 转换为十六进制字符串（使用缓存值）
     */
    @JsonValue
    public String toHex() {
        return hexValue;
    }

    @Override
    public String toString() {
        return hexValue;
    }

    /**
     * 十六进制字符串转字节数组（供子类 fromHex 调用）
     */
    protected static byte[] hexToBytes(String hex) {
        if (hex == null || hex.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException("32字节哈希的十六进制长度必须为64");
        }
        return ByteUtils.hexToBytes(hex);
    }
}
