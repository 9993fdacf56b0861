package com.buildnotify.core.spi;

import com.buildnotify.model.ctx.MasterContext;

/**
 * 构建页面地址
 */
public interface BuildUrlResolver {

    String buildUrl(MasterContext master, long builderId, long buildNumber);
}
