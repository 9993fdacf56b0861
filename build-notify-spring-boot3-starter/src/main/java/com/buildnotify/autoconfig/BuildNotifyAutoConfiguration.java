package com.buildnotify.autoconfig;

import com.buildnotify.config.BuildNotifyProperties;
import com.buildnotify.core.formatter.FormatterConfig;
import com.buildnotify.core.formatter.MessageFormatter;
import com.buildnotify.core.formatter.MissingWorkerMessageFormatter;
import com.buildnotify.core.metric.FormatterMetrics;
import com.buildnotify.core.serializer.JacksonRecordSerializer;
import com.buildnotify.core.spi.BuildUrlResolver;
import com.buildnotify.core.spi.ContextEnricher;
import com.buildnotify.core.spi.RecordSerializer;
import com.buildnotify.core.template.TemplateStore;
import com.buildnotify.core.url.DefaultBuildUrlResolver;
import com.buildnotify.model.ctx.MasterContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * 消息格式化组件装配, 模板在容器启动时解析, 配置错误即启动失败
 */
@AutoConfiguration(after = BuildNotifyMetricsAutoConfiguration.class)
@EnableConfigurationProperties(BuildNotifyProperties.class)
@ConditionalOnProperty(prefix = "build.notify", name = "enabled", matchIfMissing = true)
public class BuildNotifyAutoConfiguration {

    /**
     * master 共享信息
     */
    @Bean
    @ConditionalOnMissingBean
    public MasterContext masterContext(BuildNotifyProperties props) {
        return MasterContext.builder()
                .title(props.getMaster().getTitle())
                .buildbotUrl(props.getMaster().getBuildbotUrl())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateStore templateStore() {
        return new TemplateStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public BuildUrlResolver buildUrlResolver() {
        return new DefaultBuildUrlResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordSerializer recordSerializer() {
        return new JacksonRecordSerializer();
    }

    /**
     * 构建结束消息格式化器
     */
    @Bean
    @ConditionalOnMissingBean
    public MessageFormatter messageFormatter(BuildNotifyProperties props,
                                             TemplateStore store,
                                             BuildUrlResolver urlResolver,
                                             ObjectProvider<ContextEnricher> enricher,
                                             FormatterMetrics metrics) {
        return new MessageFormatter(FormatterConfig.fromProperties(props.getBuild()), store, urlResolver,
                enricher.getIfAvailable(() -> ContextEnricher.NOOP), metrics);
    }

    /**
     * worker 掉线消息格式化器
     */
    @Bean
    @ConditionalOnMissingBean
    public MissingWorkerMessageFormatter missingWorkerMessageFormatter(BuildNotifyProperties props,
                                                                       TemplateStore store,
                                                                       ObjectProvider<ContextEnricher> enricher,
                                                                       FormatterMetrics metrics) {
        return new MissingWorkerMessageFormatter(FormatterConfig.fromProperties(props.getMissingWorker()), store,
                enricher.getIfAvailable(() -> ContextEnricher.NOOP), metrics);
    }
}
