package com.bit.governance.store;

import com.google.common.util.concurrent.Striped;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * 按业务键加锁：同一提案/投票人/策略/节点/计数器的操作串行，不同键并行
 * 多个键一次性按条带顺序获取，避免死锁
 */
@Component
public class KeyLocks {

    private static final int STRIPES = 256;

    private final Striped<Lock> striped = Striped.lock(STRIPES);

    public <T> T withLocks(Supplier<T> action, Object... keys) {
        List<Lock> acquired = new ArrayList<>();
        try {
            for (Lock lock : striped.bulkGet(Arrays.asList(keys))) {
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    public static String proposal(Object id) {
        return "proposal:" + id;
    }

    public static String voter(Object address) {
        return "voter:" + address;
    }

    public static String strategy(Object id) {
        return "strategy:" + id;
    }

    public static String node(Object address) {
        return "node:" + address;
    }

    public static String counter(String name) {
        return "counter:" + name;
    }

    public static final String CONFIG = "config";
}
