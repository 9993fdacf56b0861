package com.buildnotify.exception.template;

/**
 * 模板引用了上下文中不存在的 key, 属于格式化器自身缺陷
 */
public class UndefinedContextKeyException extends RuntimeException {
    public UndefinedContextKeyException(String templateName, Throwable cause) {
        super("template '" + templateName + "' references an undefined context key: " + cause.getMessage(), cause);
    }
}
