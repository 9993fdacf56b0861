package com.buildnotify.core.spi;

import com.buildnotify.model.entity.BuildRecord;
import com.buildnotify.model.entity.WorkerRecord;

/**
 * 数据源记录反序列化
 */
public interface RecordSerializer {

    BuildRecord readBuild(String json);

    WorkerRecord readWorker(String json);
}
