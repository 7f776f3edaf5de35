package com.bit.governance.config;

import com.bit.governance.common.Address;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 系统级配置 system.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "system")
public class SystemConfig {

    /**
     * 管理员地址（64位十六进制），见证人校验以此为准
     */
    private List<String> admins = new ArrayList<>();

    private Strategy strategy = new Strategy();

    private Events events = new Events();

    @Data
    public static class Strategy {
        //聚合风险评分超过该值拒绝执行
        private int riskThreshold = 80;
        private boolean schedulerEnabled = false;
        //自动执行扫描间隔 毫秒
        private long schedulerIntervalMs = 60_000;
    }

    @Data
    public static class Events {
        //内存中保留的最近事件条数
        private int capacity = 1000;
    }

    public List<Address> adminAddresses() {
        List<Address> result = new ArrayList<>();
        for (String hex : admins) {
            result.add(Address.fromHex(hex.trim().toLowerCase()));
        }
        return result;
    }
}
