package com.buildnotify.core.serializer;

import com.buildnotify.core.spi.RecordSerializer;
import com.buildnotify.model.entity.BuildRecord;
import com.buildnotify.model.entity.WorkerRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

public class JacksonRecordSerializer implements RecordSerializer {

    private final ObjectMapper mapper;

    /** 使用数据源约定的 snake_case 配置构造 */
    public JacksonRecordSerializer() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonRecordSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public BuildRecord readBuild(String json) {
        return read(json, BuildRecord.class);
    }

    @Override
    public WorkerRecord readWorker(String json) {
        return read(json, WorkerRecord.class);
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + " from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        // 数据源字段多于格式化所需, 忽略未知字段
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return m;
    }
}
