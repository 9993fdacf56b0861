package com.buildnotify.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 掉线 worker 信息, 原样放入渲染上下文
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerRecord {

    private Long workerid;
    private String name;
    /** 最后一次断开时间, 由数据源格式化 */
    private String lastConnection;
    /** worker 自报信息, 如 admin / host */
    @Builder.Default
    private Map<String, Object> workerinfo = new LinkedHashMap<>();
}
