package com.buildnotify.core.template;

import com.buildnotify.exception.template.UndefinedContextKeyException;
import com.mitchellbosecke.pebble.error.AttributeNotFoundException;
import com.mitchellbosecke.pebble.template.PebbleTemplate;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;

/**
 * 编译后的模板, 不可变, 可并发渲染
 */
public final class MessageTemplate {

    private final TemplateSource source;

    private final PebbleTemplate template;

    MessageTemplate(TemplateSource source, PebbleTemplate template) {
        this.source = Objects.requireNonNull(source, "source");
        this.template = Objects.requireNonNull(template, "template");
    }

    public TemplateSource getSource() {
        return source;
    }

    /**
     * 渲染, 引用未定义的 key 时抛 UndefinedContextKeyException
     */
    public String render(Map<String, Object> context) {
        StringWriter writer = new StringWriter();
        try {
            template.evaluate(writer, context);
        } catch (AttributeNotFoundException e) {
            throw new UndefinedContextKeyException(source.describe(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to render " + source.describe(), e);
        }
        return writer.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageTemplate)) return false;
        return source.equals(((MessageTemplate) o).source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return "MessageTemplate[" + source.describe() + "]";
    }
}
