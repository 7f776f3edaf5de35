package com.bit.governance.result;

import lombok.Data;

import java.io.Serializable;

/**
 *   接口返回数据格式
 */
@Data
public class Result<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Integer SC_OK_200 = 200;
    /**
     * 软拒绝：预期内的失败结果（如风险告警拦截），稍后可重试，不视为异常
     */
    public static final Integer SOFT_REJECTED = 460;

    /**
     * 成功标志 true=成功，false=失败
     */
    private boolean success = true;

    /**
     * 返回处理消息
     */
    private String message = "";

    /**
     * 返回代码
     */
    private Integer code = 0;

    /**
     * 返回数据对象 data
     */
    private T data;

    /**
     * 时间戳
     */
    private long timestamp = System.currentTimeMillis();

    public Result() {
    }

    public static<T> Result<T> OK(T data) {
        Result<T> r = new Result<T>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        r.setData(data);
        return r;
    }

    public static<T> Result<T> error(int code, String msg) {
        Result<T> r = new Result<T>();
        r.setCode(code);
        r.setMessage(msg);
        r.setSuccess(false);
        return r;
    }

    /**
     * 软拒绝结果，data 携带拒绝时的上下文（如风险评分）
     */
    public static<T> Result<T> rejected(String msg, T data) {
        Result<T> r = error(SOFT_REJECTED, msg);
        r.setData(data);
        return r;
    }

    public boolean isSoftRejected() {
        return !success && SOFT_REJECTED.equals(code);
    }
}
