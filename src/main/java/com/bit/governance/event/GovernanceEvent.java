package com.bit.governance.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 治理事件：类型 + 主体ID + 附加字段
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GovernanceEvent {
    // 事件日志内的递增序号，由 EventSink 分配
    private long sequence;
    private EventType type;
    // 提案ID/投票人/策略ID/节点地址 的十六进制
    private String subject;
    // 触发者
    private String caller;
    private long timestamp;
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public static GovernanceEvent of(EventType type, String subject, String caller, long timestamp) {
        return GovernanceEvent.builder()
                .type(type)
                .subject(subject)
                .caller(caller)
                .timestamp(timestamp)
                .build();
    }

    public GovernanceEvent with(String key, Object value) {
        attributes.put(key, value);
        return this;
    }
}
