package com.buildnotify.model.entity;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 构建属性值, JSON 形如 [value, source]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"value", "source"})
public class PropertyValue {

    private Object value;

    /** 属性来源, 如 Worker / Builder / Scheduler */
    private String source;
}
