package com.buildnotify.core.spi;

import com.buildnotify.model.ctx.MasterContext;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 渲染前的扩展钩子, 可原地新增或覆盖上下文条目
 * 可异步取数, 格式化流程在返回的 stage 完成后才继续
 */
@FunctionalInterface
public interface ContextEnricher {

    /** 默认不做任何处理 */
    ContextEnricher NOOP = (master, ctx) -> CompletableFuture.completedFuture(null);

    CompletionStage<Void> enrich(MasterContext master, Map<String, Object> ctx);
}
