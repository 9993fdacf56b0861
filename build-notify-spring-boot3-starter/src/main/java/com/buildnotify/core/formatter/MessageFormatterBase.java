package com.buildnotify.core.formatter;

import com.buildnotify.core.metric.FormatterMetrics;
import com.buildnotify.core.render.MessageRenderer;
import com.buildnotify.core.spi.ContextEnricher;
import com.buildnotify.core.template.MessageTemplate;
import com.buildnotify.core.template.TemplateSource;
import com.buildnotify.core.template.TemplateStore;
import com.buildnotify.model.MessageResult;
import com.buildnotify.model.ctx.MasterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 格式化器骨架: 组装上下文 -> 扩展钩子 -> 合入附加上下文 -> 渲染
 * 实例不可变, 钩子可重入时可并发复用
 */
public abstract class MessageFormatterBase {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final MessageRenderer renderer;

    private final ContextEnricher enricher;

    private final FormatterMetrics metrics;

    protected MessageFormatterBase(FormatterConfig config,
                                   String defaultFilename,
                                   TemplateStore store,
                                   ContextEnricher enricher,
                                   FormatterMetrics metrics) {
        MessageTemplate body = store.resolve(config.getTemplate(), config.getTemplateDir(),
                config.getTemplateFilename(), defaultFilename);
        MessageTemplate subject = null;
        if (notEmpty(config.getSubjectFilename()) || notEmpty(config.getSubject())) {
            subject = store.resolve(config.getSubject(), config.getTemplateDir(),
                    config.getSubjectFilename(), defaultFilename);
        }
        this.renderer = new MessageRenderer(body, subject, config.getTemplateType(), config.getCtx());
        this.enricher = enricher == null ? ContextEnricher.NOOP : enricher;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * 扩展钩子, 默认委托给注入的 ContextEnricher; 子类可覆盖
     */
    protected CompletionStage<Void> buildAdditionalContext(MasterContext master, Map<String, Object> ctx) {
        return enricher.enrich(master, ctx);
    }

    /**
     * 钩子完成后再合入附加上下文并渲染; 钩子未完成时取消返回的 future 则不会渲染
     */
    protected CompletableFuture<MessageResult> formatMessage(MasterContext master, Map<String, Object> ctx) {
        return CompletableFuture.<Void>completedFuture(null)
                .thenCompose(v -> buildAdditionalContext(master, ctx))
                .whenComplete((v, e) -> {
                    if (e != null) {
                        metrics.incEnrichFailed();
                    }
                })
                .thenApply(v -> renderMessage(renderer.mergeExtraContext(ctx)));
    }

    protected MessageResult renderMessage(Map<String, Object> ctx) {
        long start = System.nanoTime();
        try {
            MessageResult result = renderer.render(ctx);
            metrics.incRendered();
            log.debug("[Format] rendered {} message, body={}", result.getType(), renderer.getBodyTemplate());
            return result;
        } catch (RuntimeException e) {
            metrics.incRenderFailed();
            log.error("[Format] render failed, body={}", renderer.getBodyTemplate(), e);
            throw e;
        } finally {
            metrics.recordRenderNanos(System.nanoTime() - start);
        }
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    public MessageRenderer getRenderer() {
        return renderer;
    }

    /**
     * 参与相等性比较的配置项
     */
    protected List<Object> compareAttrs() {
        MessageTemplate subject = renderer.getSubjectTemplate();
        TemplateSource subjectSource = subject == null ? null : subject.getSource();
        return Arrays.asList(renderer.getBodyTemplate().getSource(), subjectSource, renderer.getType());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return compareAttrs().equals(((MessageFormatterBase) o).compareAttrs());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), compareAttrs());
    }
}
