package com.bit.governance.time.impl;

import com.bit.governance.time.TimeSource;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
public class SystemTimeSource implements TimeSource {

    private final AtomicLong last = new AtomicLong();

    @Override
    public long now() {
        long wall = System.currentTimeMillis() / 1000;
        // 系统时钟回拨时沿用上一次的值
        return last.accumulateAndGet(wall, Math::max);
    }
}
