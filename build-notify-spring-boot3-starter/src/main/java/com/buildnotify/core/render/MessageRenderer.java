package com.buildnotify.core.render;

import com.buildnotify.core.template.MessageTemplate;
import com.buildnotify.model.MessageResult;
import com.buildnotify.model.enums.TemplateType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 持有正文/标题模板与附加上下文, 每次调用无状态
 */
public class MessageRenderer {

    private final MessageTemplate bodyTemplate;

    private final MessageTemplate subjectTemplate;

    private final TemplateType type;

    private final Map<String, Object> extraContext;

    public MessageRenderer(MessageTemplate bodyTemplate,
                           MessageTemplate subjectTemplate,
                           TemplateType type,
                           Map<String, Object> extraContext) {
        this.bodyTemplate = Objects.requireNonNull(bodyTemplate, "bodyTemplate");
        this.subjectTemplate = subjectTemplate;
        this.type = type == null ? TemplateType.PLAIN : type;
        this.extraContext = extraContext == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraContext));
    }

    /**
     * 附加上下文最后合入, 覆盖同名的计算值
     */
    public Map<String, Object> mergeExtraContext(Map<String, Object> context) {
        context.putAll(extraContext);
        return context;
    }

    public MessageResult render(Map<String, Object> context) {
        MessageResult.MessageResultBuilder b = MessageResult.builder()
                .body(bodyTemplate.render(context))
                .type(type.getTag());
        if (subjectTemplate != null) {
            b.subject(subjectTemplate.render(context));
        }
        return b.build();
    }

    public MessageTemplate getBodyTemplate() {
        return bodyTemplate;
    }

    public MessageTemplate getSubjectTemplate() {
        return subjectTemplate;
    }

    public TemplateType getType() {
        return type;
    }

    public Map<String, Object> getExtraContext() {
        return extraContext;
    }
}
