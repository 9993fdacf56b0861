package com.buildnotify.core.formatter;

import com.buildnotify.model.MessageResult;
import com.buildnotify.model.ctx.MasterContext;
import com.buildnotify.model.entity.WorkerRecord;
import com.buildnotify.support.Records;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class MissingWorkerMessageFormatterTest {

    private WorkerRecord worker(Map<String, Object> info) {
        return WorkerRecord.builder()
                .workerid(5L)
                .name("linux-worker")
                .lastConnection("2024-05-01 10:00:00")
                .workerinfo(info)
                .build();
    }

    @Test
    void rendersBundledTemplateWithAdmin() {
        MessageResult result = new MissingWorkerMessageFormatter(FormatterConfig.builder().build())
                .formatMessageForMissingWorker(Records.master(), worker(Map.of("admin", "ops@example.org")))
                .join();

        assertThat(result.getType()).isEqualTo("plain");
        assertThat(result.getBody())
                .contains("The Buildbot working for 'Buildbot' has noticed that the worker named linux-worker went away.")
                .contains("It last disconnected at 2024-05-01 10:00:00.")
                .contains("was ops@example.org.")
                .contains("http://localhost:8010/");
    }

    @Test
    void adminLineOmittedWithoutAdmin() {
        String body = new MissingWorkerMessageFormatter(FormatterConfig.builder().build())
                .formatMessageForMissingWorker(Records.master(), worker(Map.of()))
                .join()
                .getBody();

        assertThat(body).doesNotContain("admin on record");
    }

    @Test
    void inlineTemplatesWithExtraContextAndSubject() {
        FormatterConfig config = FormatterConfig.builder()
                .template("{{ worker.name }} lost at {{ buildbot_title }} ({{ pager }})")
                .subject("worker {{ worker.name }} missing")
                .ctx(Map.of("pager", "on-call", "buildbot_title", "CI"))
                .build();
        MissingWorkerMessageFormatter f = new MissingWorkerMessageFormatter(config);

        MessageResult result = f.formatMessageForMissingWorker(Records.master(), worker(Map.of())).join();

        assertThat(result.getBody()).isEqualTo("linux-worker lost at CI (on-call)");
        assertThat(result.getSubject()).isEqualTo("worker linux-worker missing");
    }

    @Test
    void subclassHookAddsContext() {
        MissingWorkerMessageFormatter f = new MissingWorkerMessageFormatter(
                FormatterConfig.builder().template("{{ worker.name }}@{{ site }}").build()) {
            @Override
            protected CompletableFuture<Void> buildAdditionalContext(MasterContext master, Map<String, Object> ctx) {
                ctx.put("site", master.getTitle().toLowerCase());
                return CompletableFuture.completedFuture(null);
            }
        };

        assertThat(f.formatMessageForMissingWorker(Records.master(), worker(Map.of())).join().getBody())
                .isEqualTo("linux-worker@buildbot");
    }
}
