package com.buildnotify.core.context;

import com.buildnotify.core.text.StatusTexts;
import com.buildnotify.model.entity.BuildRecord;
import com.buildnotify.model.entity.BuildsetRecord;
import com.buildnotify.model.entity.SourceStamp;
import com.buildnotify.model.entity.WorkerRecord;
import com.buildnotify.model.enums.BuildResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 渲染上下文组装, 不做任何 IO, URL 与 blamelist 由调用方解析好传入
 */
public final class MessageContexts {

    public static final String UNKNOWN_WORKER = "<unknown>";

    /* ========== 构建结果上下文 key ========== */
    public static final String RESULTS = "results";
    public static final String MODE = "mode";
    public static final String BUILDERNAME = "buildername";
    public static final String WORKERNAME = "workername";
    public static final String BUILDSET = "buildset";
    public static final String BUILD = "build";
    public static final String PROJECTS = "projects";
    public static final String PREVIOUS_RESULTS = "previous_results";
    public static final String STATUS_DETECTED = "status_detected";
    public static final String BUILD_URL = "build_url";
    public static final String BUILDBOT_URL = "buildbot_url";
    public static final String BLAMELIST = "blamelist";
    public static final String SUMMARY = "summary";
    public static final String SOURCESTAMPS = "sourcestamps";

    /* ========== worker 掉线上下文 key ========== */
    public static final String BUILDBOT_TITLE = "buildbot_title";
    public static final String WORKER = "worker";

    private MessageContexts() {}

    public static Map<String, Object> ctxForBuild(Set<String> mode,
                                                  String builderName,
                                                  BuildRecord build,
                                                  BuildResult previousResults,
                                                  List<String> blamelist,
                                                  String projectsText,
                                                  String buildUrl,
                                                  String buildbotUrl) {
        BuildsetRecord buildset = build.getBuildset();
        List<SourceStamp> stamps = sourceStamps(buildset);
        BuildResult results = build.getResults();

        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put(RESULTS, results);
        ctx.put(MODE, mode);
        ctx.put(BUILDERNAME, builderName);
        ctx.put(WORKERNAME, workerName(build));
        ctx.put(BUILDSET, buildset);
        ctx.put(BUILD, build);
        ctx.put(PROJECTS, projectsText);
        ctx.put(PREVIOUS_RESULTS, previousResults);
        ctx.put(STATUS_DETECTED, StatusTexts.detectedStatusText(mode, results, previousResults));
        ctx.put(BUILD_URL, buildUrl);
        ctx.put(BUILDBOT_URL, buildbotUrl);
        ctx.put(BLAMELIST, blamelist == null ? Collections.emptyList() : blamelist);
        ctx.put(SUMMARY, StatusTexts.summaryText(build, results));
        ctx.put(SOURCESTAMPS, StatusTexts.sourceStampText(stamps));
        return ctx;
    }

    public static Map<String, Object> ctxForMissingWorker(String titleText, String buildbotUrl, WorkerRecord worker) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put(BUILDBOT_TITLE, titleText);
        ctx.put(BUILDBOT_URL, buildbotUrl);
        ctx.put(WORKER, worker);
        return ctx;
    }

    /**
     * 上次构建结果, 无上次构建时为 null
     */
    public static BuildResult previousResults(BuildRecord build) {
        BuildRecord prev = build.getPrevBuild();
        return prev == null ? null : prev.getResults();
    }

    public static List<SourceStamp> sourceStamps(BuildsetRecord buildset) {
        if (buildset == null || buildset.getSourcestamps() == null) {
            return Collections.emptyList();
        }
        return buildset.getSourcestamps();
    }

    private static Object workerName(BuildRecord build) {
        return build.propertyValue(WORKERNAME, UNKNOWN_WORKER);
    }
}
