package com.buildnotify.core.template;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 模板来源标识, 用于缓存与格式化器相等性比较
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TemplateSource {

    public enum Kind { INLINE, BUNDLED, DIRECTORY }

    Kind kind;

    /** DIRECTORY 时为搜索目录, 其余为 null */
    String directory;

    /** INLINE 时为模板内容, 其余为文件名 */
    String name;

    public static TemplateSource inline(String content) {
        return new TemplateSource(Kind.INLINE, null, content);
    }

    public static TemplateSource bundled(String filename) {
        return new TemplateSource(Kind.BUNDLED, null, filename);
    }

    public static TemplateSource directory(String directory, String filename) {
        return new TemplateSource(Kind.DIRECTORY, directory, filename);
    }

    /** 日志与异常中使用的名称 */
    public String describe() {
        return switch (kind) {
            case INLINE -> "<inline>";
            case BUNDLED -> "classpath:" + TemplateStore.BUNDLED_DIRECTORY + "/" + name;
            case DIRECTORY -> directory + "/" + name;
        };
    }
}
