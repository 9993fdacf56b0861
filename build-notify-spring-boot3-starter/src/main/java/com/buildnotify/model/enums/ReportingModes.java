package com.buildnotify.model.enums;

/**
 * 通知模式标签, 调用方以 Set 形式传入
 */
public final class ReportingModes {

    public static final String CHANGE = "change";
    public static final String FAILING = "failing";
    public static final String PASSING = "passing";
    public static final String PROBLEM = "problem";
    public static final String WARNINGS = "warnings";
    public static final String EXCEPTION = "exception";
    public static final String CANCELLED = "cancelled";
    public static final String ALL = "all";

    private ReportingModes() {}
}
