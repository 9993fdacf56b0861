package com.buildnotify.exception.template;

/**
 * 模板配置冲突, 如同时给出内联内容与文件路径
 */
public class TemplateConfigurationException extends RuntimeException {
    public TemplateConfigurationException(String message) { super(message); }
}
