package com.buildnotify.core.formatter;

import com.buildnotify.core.context.MessageContexts;
import com.buildnotify.core.metric.FormatterMetrics;
import com.buildnotify.core.spi.ContextEnricher;
import com.buildnotify.core.template.TemplateStore;
import com.buildnotify.model.MessageResult;
import com.buildnotify.model.ctx.MasterContext;
import com.buildnotify.model.entity.WorkerRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * worker 掉线消息
 */
public class MissingWorkerMessageFormatter extends MessageFormatterBase {

    public static final String DEFAULT_TEMPLATE_FILENAME = "missing_mail.txt";

    public MissingWorkerMessageFormatter(FormatterConfig config) {
        this(config, new TemplateStore(), ContextEnricher.NOOP, FormatterMetrics.create(new SimpleMeterRegistry()));
    }

    public MissingWorkerMessageFormatter(FormatterConfig config,
                                         TemplateStore store,
                                         ContextEnricher enricher,
                                         FormatterMetrics metrics) {
        super(config, DEFAULT_TEMPLATE_FILENAME, store, enricher, metrics);
    }

    public CompletableFuture<MessageResult> formatMessageForMissingWorker(MasterContext master, WorkerRecord worker) {
        Map<String, Object> ctx = MessageContexts.ctxForMissingWorker(
                master.getTitle(), master.getBuildbotUrl(), worker);
        return formatMessage(master, ctx);
    }
}
