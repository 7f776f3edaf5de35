package com.bit.governance.auth.impl;

import com.bit.governance.auth.WitnessVerifier;
import com.bit.governance.common.Address;
import com.bit.governance.config.SystemConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * 基于配置的管理员名单做见证校验
 */
@Slf4j
@Component
public class AdminWitnessVerifier implements WitnessVerifier {

    private final Set<Address> admins;

    public AdminWitnessVerifier(SystemConfig config) {
        this.admins = new HashSet<>(config.adminAddresses());
        if (admins.isEmpty()) {
            log.warn("未配置管理员 system.admins，所有管理操作都将被拒绝");
        } else {
            log.info("已加载管理员{}个", admins.size());
        }
    }

    @Override
    public boolean authorize(Address caller) {
        return caller != null && admins.contains(caller);
    }
}
