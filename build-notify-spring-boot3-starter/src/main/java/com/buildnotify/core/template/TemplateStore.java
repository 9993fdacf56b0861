package com.buildnotify.core.template;

import com.buildnotify.exception.template.TemplateConfigurationException;
import com.buildnotify.exception.template.TemplateNotFoundException;
import com.buildnotify.exception.template.TemplateSyntaxException;
import com.mitchellbosecke.pebble.PebbleEngine;
import com.mitchellbosecke.pebble.error.LoaderException;
import com.mitchellbosecke.pebble.error.ParserException;
import com.mitchellbosecke.pebble.loader.ClasspathLoader;
import com.mitchellbosecke.pebble.loader.FileLoader;
import com.mitchellbosecke.pebble.loader.Loader;
import com.mitchellbosecke.pebble.loader.StringLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模板解析与编译:
 * - 内联内容直接编译
 * - 否则按 目录 + 文件名 加载, 目录缺省为内置 classpath 目录
 * - 所有模板均为严格模式, 未定义变量渲染即失败
 * - 编译结果由 PebbleEngine 按来源缓存
 */
public class TemplateStore {

    private static final Logger log = LoggerFactory.getLogger(TemplateStore.class);

    /** 内置模板所在 classpath 目录 */
    public static final String BUNDLED_DIRECTORY = "templates/buildnotify";

    private final PebbleEngine inlineEngine;

    private final PebbleEngine bundledEngine;

    /** 搜索目录 -> engine */
    private final Map<String, PebbleEngine> directoryEngines = new ConcurrentHashMap<>(8);

    public TemplateStore() {
        this(TemplateStore.class.getClassLoader());
    }

    public TemplateStore(ClassLoader classLoader) {
        this.inlineEngine = newEngine(new StringLoader());
        ClasspathLoader bundled = new ClasspathLoader(classLoader);
        bundled.setPrefix(BUNDLED_DIRECTORY);
        this.bundledEngine = newEngine(bundled);
    }

    /**
     * 解析模板
     *
     * @param inlineContent   内联模板内容
     * @param searchDir       模板目录, 为空使用内置目录
     * @param filename        模板文件名, 为空使用 defaultFilename
     * @param defaultFilename 缺省文件名
     */
    public MessageTemplate resolve(String inlineContent, String searchDir, String filename, String defaultFilename) {
        boolean hasInline = notEmpty(inlineContent);
        if (hasInline && (notEmpty(filename) || notEmpty(searchDir))) {
            throw new TemplateConfigurationException("Only one of template or template path can be given");
        }
        if (hasInline) {
            return compile(inlineEngine, TemplateSource.inline(inlineContent), inlineContent);
        }

        String name = notEmpty(filename) ? filename : defaultFilename;
        if (!notEmpty(searchDir)) {
            return compile(bundledEngine, TemplateSource.bundled(name), name);
        }
        PebbleEngine engine = directoryEngines.computeIfAbsent(searchDir, dir -> {
            FileLoader loader = new FileLoader();
            loader.setPrefix(dir);
            return newEngine(loader);
        });
        return compile(engine, TemplateSource.directory(searchDir, name), name);
    }

    private MessageTemplate compile(PebbleEngine engine, TemplateSource source, String templateName) {
        try {
            MessageTemplate t = new MessageTemplate(source, engine.getTemplate(templateName));
            log.debug("[TemplateStore] compiled {}", source.describe());
            return t;
        } catch (LoaderException e) {
            String location = source.getKind() == TemplateSource.Kind.DIRECTORY
                    ? source.getDirectory() : "classpath:" + BUNDLED_DIRECTORY;
            throw new TemplateNotFoundException(source.getName(), location, e);
        } catch (ParserException e) {
            throw new TemplateSyntaxException(source.describe(), e);
        }
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    private static PebbleEngine newEngine(Loader<?> loader) {
        return new PebbleEngine.Builder()
                .loader(loader)
                .strictVariables(true)
                .autoEscaping(false)
                .newLineTrimming(false)
                .build();
    }
}
