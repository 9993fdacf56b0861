package com.buildnotify.model.entity;

import com.buildnotify.model.enums.BuildResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 构建记录, 由外部数据源填充, 格式化过程只读
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildRecord {

    private Long buildid;
    private long number;
    /** 未结束时为 null */
    private BuildResult results;
    private String stateString;
    @Builder.Default
    private Map<String, PropertyValue> properties = new LinkedHashMap<>();
    private BuilderRecord builder;
    private BuildsetRecord buildset;
    /** 同 builder 上一次构建, 至少带 results */
    private BuildRecord prevBuild;

    /**
     * 属性的实际值, 不存在时返回 defaultValue
     */
    public Object propertyValue(String name, Object defaultValue) {
        if (properties == null) {
            return defaultValue;
        }
        PropertyValue pv = properties.get(name);
        return pv == null ? defaultValue : pv.getValue();
    }
}
