package com.buildnotify.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 渲染结果, 交给外部投递组件
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class MessageResult {

    private final String body;

    /** plain | html */
    private final String type;

    /** 未配置标题模板时为 null */
    private final String subject;

    public boolean hasSubject() {
        return subject != null;
    }
}
