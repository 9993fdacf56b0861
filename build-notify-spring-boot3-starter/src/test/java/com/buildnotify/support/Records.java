package com.buildnotify.support;

import com.buildnotify.model.ctx.MasterContext;
import com.buildnotify.model.entity.BuildRecord;
import com.buildnotify.model.entity.BuilderRecord;
import com.buildnotify.model.entity.BuildsetRecord;
import com.buildnotify.model.entity.PropertyValue;
import com.buildnotify.model.entity.SourceStamp;
import com.buildnotify.model.enums.BuildResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用记录构造
 */
public final class Records {

    private Records() {}

    public static MasterContext master() {
        return MasterContext.builder()
                .title("Buildbot")
                .buildbotUrl("http://localhost:8010/")
                .build();
    }

    public static SourceStamp stamp(String branch, String revision, String project) {
        return SourceStamp.builder()
                .branch(branch)
                .revision(revision)
                .project(project)
                .build();
    }

    public static BuildRecord build(BuildResult results, BuildResult previous, SourceStamp... stamps) {
        Map<String, PropertyValue> props = new LinkedHashMap<>();
        props.put("workername", PropertyValue.of("worker-1", "Worker"));
        props.put("reason", PropertyValue.of("force build", "Force Build Form"));
        return BuildRecord.builder()
                .buildid(100L)
                .number(42)
                .results(results)
                .stateString("failed test")
                .properties(props)
                .builder(BuilderRecord.builder().builderid(3).name("runtests").build())
                .buildset(BuildsetRecord.builder().bsid(7L).sourcestamps(List.of(stamps)).build())
                .prevBuild(previous == null ? null : BuildRecord.builder().number(41).results(previous).build())
                .build();
    }
}
