package com.bit.governance.exception;

public enum ErrorType {
    VALIDATION(400, "参数校验失败（缺失/格式错误/越界）"),
    AUTHORIZATION(510, "权限校验失败（见证人未授权）"),
    NOT_FOUND(404, "引用的记录不存在（提案/投票人/策略/节点）"),
    STATE_CONFLICT(409, "状态冲突（重复投票/不在投票窗口/提案已终结）"),
    STORAGE_FAILED(500, "数据持久化失败（事务提交异常）");

    private final int code;
    private final String desc;

    ErrorType(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public int getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }
}
