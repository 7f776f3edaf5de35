package com.bit.governance.structure.strategy;

/**
 * 候选节点选择策略
 */
public enum StrategyType {
    /** 按性能评分排序 */
    PERFORMANCE_BASED(0),
    /** 性能优先并剔除高风险节点 */
    RISK_ADJUSTED(1),
    /** 在更大的候选池中等距抽取 */
    DIVERSIFICATION(2),
    /** 暂未实现模型评分，退化为性能排序 */
    ML_DRIVEN(3),

    ;

    private final int code;

    StrategyType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static StrategyType fromCode(int code) {
        for (StrategyType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的策略类型: " + code);
    }
}
