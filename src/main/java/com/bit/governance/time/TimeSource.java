package com.bit.governance.time;

/**
 * 时间源（秒）。同一进程内返回值单调不减
 */
public interface TimeSource {
    long now();
}
