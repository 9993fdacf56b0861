package com.buildnotify.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个 codebase 的检出描述
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceStamp {

    private Long ssid;
    private String branch;
    private String revision;
    /** 非 null 即表示附带补丁, 内容不解析 */
    private Object patch;
    private String codebase;
    private String project;
    private String repository;
}
