package com.bit.governance.structure.node;

public enum RiskLevel {
    LOW(0),
    HIGH(1);

    private final int code;

    RiskLevel(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static RiskLevel fromCode(int code) {
        return code == HIGH.code ? HIGH : LOW;
    }
}
