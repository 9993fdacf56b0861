package com.buildnotify.core.url;

import com.buildnotify.core.spi.BuildUrlResolver;
import com.buildnotify.model.ctx.MasterContext;

/**
 * web UI 路由: {buildbotUrl}#builders/{builderid}/builds/{number}
 */
public class DefaultBuildUrlResolver implements BuildUrlResolver {

    @Override
    public String buildUrl(MasterContext master, long builderId, long buildNumber) {
        String prefix = master.getBuildbotUrl() == null ? "" : master.getBuildbotUrl();
        return String.format("%s#builders/%d/builds/%d", prefix, builderId, buildNumber);
    }
}
