package com.bit.governance.event;

import java.util.List;

public interface EventSink {

    /**
     * 发布事件，调用方保证仅在提交成功后调用
     */
    void publish(GovernanceEvent event);

    /**
     * 最近的事件，按发布顺序
     * @param limit 最多返回条数
     */
    List<GovernanceEvent> recent(int limit);
}
