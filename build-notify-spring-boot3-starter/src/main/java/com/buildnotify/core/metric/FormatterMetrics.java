package com.buildnotify.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class FormatterMetrics {
    private final Counter rendered;
    private final Counter renderFailed;
    private final Counter enrichFailed;
    private final Timer renderTimer;

    private FormatterMetrics(MeterRegistry reg) {
        this.rendered     = Counter.builder("buildnotify.render.success").description("messages rendered").register(reg);
        this.renderFailed = Counter.builder("buildnotify.render.failed").description("message render failed").register(reg);
        this.enrichFailed = Counter.builder("buildnotify.enrich.failed").description("context enricher failed").register(reg);
        this.renderTimer  = Timer.builder("buildnotify.render.time").description("template render time").register(reg);
    }

    public static FormatterMetrics create(MeterRegistry reg) { return new FormatterMetrics(reg); }

    public void incRendered(){     rendered.increment(); }
    public void incRenderFailed(){ renderFailed.increment(); }
    public void incEnrichFailed(){ enrichFailed.increment(); }
    public void recordRenderNanos(long nanos){ renderTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
