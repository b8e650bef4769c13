package com.cloudsync.server.enums;

public enum TriggerPolicyEnum {

    // 仅在间隔到期时同步
    INTERVAL_ONLY,

    // 间隔到期, 或者 one-way check 发现差异时同步
    INTERVAL_OR_DIFF,
}
