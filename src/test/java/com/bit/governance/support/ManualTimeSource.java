package com.bit.governance.support;

import com.bit.governance.time.TimeSource;

/**
 * 测试用时间源，手动拨动
 */
public class ManualTimeSource implements TimeSource {

    private long now;

    public ManualTimeSource(long start) {
        this.now = start;
    }

    @Override
    public synchronized long now() {
        return now;
    }

    public synchronized void set(long time) {
        this.now = time;
    }

    public synchronized void advance(long seconds) {
        this.now += seconds;
    }
}
