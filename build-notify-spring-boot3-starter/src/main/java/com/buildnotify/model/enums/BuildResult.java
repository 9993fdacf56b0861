package com.buildnotify.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * 构建结果码
 */
public enum BuildResult {

    SUCCESS(0, "success"),

    WARNINGS(1, "warnings"),

    FAILURE(2, "failure"),

    SKIPPED(3, "skipped"),

    EXCEPTION(4, "exception"),

    RETRY(5, "retry"),

    CANCELLED(6, "cancelled"),

    /** 超出已知范围的结果码 */
    INVALID(-1, "Invalid status");

    /** 尚未结束的构建 results 为 null */
    public static final String NOT_FINISHED = "not finished";

    private final int code;

    private final String displayName;

    BuildResult(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public int getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 未知结果码不拒绝, 统一映射为 INVALID
     */
    @JsonCreator
    public static BuildResult fromCode(int code) {
        for (BuildResult r : values()) {
            if (r != INVALID && r.code == code) {
                return r;
            }
        }
        return INVALID;
    }

    /**
     * 结果码的展示名, null 视为未结束
     */
    public static String statusToString(BuildResult result) {
        return result == null ? NOT_FINISHED : result.displayName;
    }
}
