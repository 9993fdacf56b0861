package com.buildnotify.model.enums;

import java.util.Locale;

/**
 * 消息体类型
 */
public enum TemplateType {

    PLAIN("plain"),

    HTML("html");

    private final String tag;

    TemplateType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * 按 tag 解析, 为空时返回 plain
     */
    public static TemplateType of(String tag) {
        if (tag == null || tag.isBlank()) {
            return PLAIN;
        }
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (TemplateType type : values()) {
            if (type.tag.equals(t)) {
                return type;
            }
        }
        throw new IllegalArgumentException("template type must be one of plain|html, got: " + tag);
    }
}
