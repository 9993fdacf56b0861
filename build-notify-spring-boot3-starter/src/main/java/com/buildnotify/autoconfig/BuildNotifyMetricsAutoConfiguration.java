package com.buildnotify.autoconfig;

import com.buildnotify.core.metric.FormatterMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * 格式化指标: 优先挂到业务侧唯一(或 primary)的 MeterRegistry,
 * 没有时落到本地 SimpleMeterRegistry, 指标仍可通过 FormatterMetrics 读取
 */
@AutoConfiguration
public class BuildNotifyMetricsAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BuildNotifyMetricsAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public FormatterMetrics formatterMetrics(ObjectProvider<MeterRegistry> registries) {
        MeterRegistry registry = registries.getIfUnique(() -> {
            log.info("[BuildNotify] no unique MeterRegistry found, formatter metrics kept in a local SimpleMeterRegistry");
            return new SimpleMeterRegistry();
        });
        return FormatterMetrics.create(registry);
    }
}
