package com.buildnotify.core.formatter;

import com.buildnotify.core.context.MessageContexts;
import com.buildnotify.core.metric.FormatterMetrics;
import com.buildnotify.core.spi.BuildUrlResolver;
import com.buildnotify.core.spi.ContextEnricher;
import com.buildnotify.core.template.TemplateStore;
import com.buildnotify.core.text.StatusTexts;
import com.buildnotify.core.url.DefaultBuildUrlResolver;
import com.buildnotify.model.MessageResult;
import com.buildnotify.model.ctx.MasterContext;
import com.buildnotify.model.entity.BuildRecord;
import com.buildnotify.model.entity.BuilderRecord;
import com.buildnotify.model.entity.SourceStamp;
import com.buildnotify.model.enums.BuildResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * 构建结束消息
 */
public class MessageFormatter extends MessageFormatterBase {

    public static final String DEFAULT_TEMPLATE_FILENAME = "default_mail.txt";

    private final BuildUrlResolver urlResolver;

    private final boolean wantProperties;

    private final boolean wantSteps;

    private final boolean wantLogs;

    public MessageFormatter(FormatterConfig config) {
        this(config, new TemplateStore(), new DefaultBuildUrlResolver(), ContextEnricher.NOOP,
                FormatterMetrics.create(new SimpleMeterRegistry()));
    }

    public MessageFormatter(FormatterConfig config,
                            TemplateStore store,
                            BuildUrlResolver urlResolver,
                            ContextEnricher enricher,
                            FormatterMetrics metrics) {
        super(config, DEFAULT_TEMPLATE_FILENAME, store, enricher, metrics);
        this.urlResolver = Objects.requireNonNull(urlResolver, "urlResolver");
        this.wantProperties = config.isWantProperties();
        this.wantSteps = config.isWantSteps();
        this.wantLogs = config.isWantLogs();
    }

    /**
     * 生成构建结束消息
     *
     * @param mode        通知模式标签
     * @param builderName builder 展示名
     * @param build       已按 want* 提示填充的构建记录
     * @param master      master 共享信息
     * @param blamelist   责任人列表, 由调用方解析
     */
    public CompletableFuture<MessageResult> formatMessageForBuild(Set<String> mode,
                                                                  String builderName,
                                                                  BuildRecord build,
                                                                  MasterContext master,
                                                                  List<String> blamelist) {
        BuilderRecord builder = Objects.requireNonNull(build.getBuilder(), "build.builder");
        BuildResult previousResults = MessageContexts.previousResults(build);
        List<SourceStamp> stamps = MessageContexts.sourceStamps(build.getBuildset());

        Map<String, Object> ctx = MessageContexts.ctxForBuild(
                mode,
                builderName,
                build,
                previousResults,
                blamelist,
                StatusTexts.projectsText(stamps, master.getTitle()),
                urlResolver.buildUrl(master, builder.getBuilderid(), build.getNumber()),
                master.getBuildbotUrl());
        return formatMessage(master, ctx);
    }

    public boolean isWantProperties() {
        return wantProperties;
    }

    public boolean isWantSteps() {
        return wantSteps;
    }

    public boolean isWantLogs() {
        return wantLogs;
    }

    @Override
    protected List<Object> compareAttrs() {
        List<Object> attrs = new ArrayList<>(super.compareAttrs());
        attrs.add(wantProperties);
        attrs.add(wantSteps);
        attrs.add(wantLogs);
        return attrs;
    }
}
