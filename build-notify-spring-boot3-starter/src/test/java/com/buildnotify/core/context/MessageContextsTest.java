package com.buildnotify.core.context;

import com.buildnotify.model.entity.BuildRecord;
import com.buildnotify.model.entity.WorkerRecord;
import com.buildnotify.model.enums.BuildResult;
import com.buildnotify.support.Records;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MessageContextsTest {

    @Test
    void buildContextCarriesComputedAndRawValues() {
        BuildRecord build = Records.build(BuildResult.FAILURE, BuildResult.SUCCESS,
                Records.stamp("main", "abc123", "proj"));
        Set<String> mode = Set.of("change");

        Map<String, Object> ctx = MessageContexts.ctxForBuild(mode, "runtests", build,
                BuildResult.SUCCESS, List.of("alice"), "proj",
                "http://localhost:8010/#builders/3/builds/42", "http://localhost:8010/");

        assertThat(ctx).containsOnlyKeys("results", "mode", "buildername", "workername", "buildset", "build",
                "projects", "previous_results", "status_detected", "build_url", "buildbot_url", "blamelist",
                "summary", "sourcestamps");
        assertThat(ctx)
                .containsEntry("results", BuildResult.FAILURE)
                .containsEntry("mode", mode)
                .containsEntry("workername", "worker-1")
                .containsEntry("build", build)
                .containsEntry("buildset", build.getBuildset())
                .containsEntry("previous_results", BuildResult.SUCCESS)
                .containsEntry("status_detected", "new failure")
                .containsEntry("summary", "BUILD FAILED: failed test")
                .containsEntry("sourcestamps", "Build Source Stamp: [branch main] abc123\n")
                .containsEntry("blamelist", List.of("alice"));
    }

    @Test
    void missingWorkernameFallsBackToUnknown() {
        BuildRecord build = Records.build(BuildResult.SUCCESS, null);
        build.getProperties().remove("workername");

        Map<String, Object> ctx = MessageContexts.ctxForBuild(Set.of("all"), "b", build, null,
                null, "t", "u", "bu");

        assertThat(ctx.get("workername")).isEqualTo("<unknown>");
        assertThat(ctx.get("blamelist")).isEqualTo(List.of());
        assertThat(ctx).containsEntry("previous_results", null);
    }

    @Test
    void previousResultsFromPrevBuild() {
        assertThat(MessageContexts.previousResults(Records.build(BuildResult.FAILURE, BuildResult.WARNINGS)))
                .isEqualTo(BuildResult.WARNINGS);
        assertThat(MessageContexts.previousResults(Records.build(BuildResult.FAILURE, null))).isNull();
    }

    @Test
    void missingWorkerContext() {
        WorkerRecord worker = WorkerRecord.builder().name("w1").build();

        Map<String, Object> ctx = MessageContexts.ctxForMissingWorker("Buildbot", "http://bb/", worker);

        assertThat(ctx).containsExactly(
                Map.entry("buildbot_title", "Buildbot"),
                Map.entry("buildbot_url", "http://bb/"),
                Map.entry("worker", worker));
    }
}
