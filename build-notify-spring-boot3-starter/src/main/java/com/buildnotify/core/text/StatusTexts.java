package com.buildnotify.core.text;

import com.buildnotify.model.entity.BuildRecord;
import com.buildnotify.model.entity.SourceStamp;
import com.buildnotify.model.enums.BuildResult;
import com.buildnotify.model.enums.ReportingModes;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 构建状态文案, 纯函数, 任何输入都有对应文案
 */
public final class StatusTexts {

    private static final String HEAD = "HEAD";

    private StatusTexts() {}

    /**
     * 结合通知模式与上一次结果给出状态描述
     */
    public static String detectedStatusText(Set<String> mode, BuildResult results, BuildResult previousResults) {
        if (results == null) {
            return BuildResult.statusToString(null) + " build";
        }
        switch (results) {
            case FAILURE:
                if (changed(mode, results, previousResults)) {
                    return "new failure";
                }
                // SUCCESS 为 0 码, 不算作已知的上次结果
                if (mode.contains(ReportingModes.PROBLEM) && previousResults != null
                        && previousResults != BuildResult.SUCCESS && previousResults != BuildResult.FAILURE) {
                    return "new failure";
                }
                return "failed build";
            case WARNINGS:
                return "problem in the build";
            case SUCCESS:
                return changed(mode, results, previousResults) ? "restored build" : "passing build";
            case EXCEPTION:
                return "build exception";
            default:
                return BuildResult.statusToString(results) + " build";
        }
    }

    /**
     * 摘要行, 取消的构建不带 state_string
     */
    public static String summaryText(BuildRecord build, BuildResult results) {
        String t = build.getStateString();
        String suffix = t == null || t.isEmpty() ? "" : ": " + t;

        if (results == BuildResult.SUCCESS) {
            return "Build succeeded!";
        } else if (results == BuildResult.WARNINGS) {
            return "Build Had Warnings" + suffix;
        } else if (results == BuildResult.CANCELLED) {
            return "Build was cancelled";
        }
        return "BUILD FAILED" + suffix;
    }

    /**
     * 每个 sourcestamp 一行, 每行以换行结尾
     */
    public static String sourceStampText(List<SourceStamp> stamps) {
        StringBuilder sb = new StringBuilder();
        if (stamps == null) {
            return "";
        }
        for (SourceStamp ss : stamps) {
            sb.append("Build Source Stamp");
            if (notEmpty(ss.getCodebase())) {
                sb.append(" '").append(ss.getCodebase()).append('\'');
            }
            sb.append(": ");
            if (notEmpty(ss.getBranch())) {
                sb.append("[branch ").append(ss.getBranch()).append("] ");
            }
            sb.append(notEmpty(ss.getRevision()) ? ss.getRevision() : HEAD);
            if (ss.getPatch() != null) {
                sb.append(" (plus patch)");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * 去重后的项目名, 按首次出现排序; 都为空时使用 defaultTitle
     */
    public static String projectsText(Collection<SourceStamp> stamps, String defaultTitle) {
        Set<String> projects = new LinkedHashSet<>();
        if (stamps != null) {
            for (SourceStamp ss : stamps) {
                if (notEmpty(ss.getProject())) {
                    projects.add(ss.getProject());
                }
            }
        }
        if (projects.isEmpty()) {
            return defaultTitle;
        }
        return String.join(", ", projects);
    }

    private static boolean changed(Set<String> mode, BuildResult results, BuildResult previousResults) {
        return mode.contains(ReportingModes.CHANGE) && previousResults != null && previousResults != results;
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
