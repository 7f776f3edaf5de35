package com.bit.governance.auth;

import com.bit.governance.common.Address;

/**
 * 见证人校验：判断调用方是否持有管理权限
 */
public interface WitnessVerifier {

    boolean authorize(Address caller);
}
