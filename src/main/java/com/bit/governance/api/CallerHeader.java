package com.bit.governance.api;

import com.bit.governance.common.Address;
import com.bit.governance.util.ByteUtils;

/**
 * 请求头 X-Caller 携带调用方地址（64位十六进制）
 */
final class CallerHeader {

    static final String NAME = "X-Caller";

    private CallerHeader() {
    }

    static Address parse(String header) {
        return Address.fromHex(header == null ? null : header.trim().toLowerCase());
    }

    static Address optionalAddress(String hex) {
        if (hex == null || hex.isBlank()) {
            return null;
        }
        return Address.fromHex(hex.trim().toLowerCase());
    }

    static byte[] optionalBytes(String hex) {
        if (hex == null || hex.isBlank()) {
            return new byte[0];
        }
        return ByteUtils.hexToBytes(hex.trim());
    }
}
