package com.buildnotify.core.formatter;

import com.buildnotify.config.BuildNotifyProperties;
import com.buildnotify.model.enums.TemplateType;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;

/**
 * 单个格式化器的配置, 构造后不可变
 */
@Value
@Builder(toBuilder = true)
public class FormatterConfig {

    private static final Logger log = LoggerFactory.getLogger(FormatterConfig.class);

    /** 模板目录, 为空使用内置模板 */
    String templateDir;
    String templateFilename;
    /** 内联正文模板, 与 templateDir/templateFilename 互斥 */
    String template;
    String subjectFilename;
    /** 内联标题模板 */
    String subject;
    @Builder.Default
    TemplateType templateType = TemplateType.PLAIN;
    /** 附加上下文, 最后合入 */
    @Builder.Default
    Map<String, Object> ctx = Collections.emptyMap();

    /* 以下三项仅供外部取数组件参考 */
    @Builder.Default
    boolean wantProperties = true;
    boolean wantSteps;
    boolean wantLogs;

    /**
     * 由配置绑定结果构造, 旧的 template-name 转为 template-filename
     */
    public static FormatterConfig fromProperties(BuildNotifyProperties.Template props) {
        String templateFilename = props.getTemplateFilename();
        if (props.getTemplateName() != null) {
            log.warn("[FormatterConfig] template-name is deprecated, use template-filename");
            templateFilename = props.getTemplateName();
        }
        FormatterConfigBuilder b = FormatterConfig.builder()
                .templateDir(blankToNull(props.getTemplateDir()))
                .templateFilename(blankToNull(templateFilename))
                .template(blankToNull(props.getTemplate()))
                .subjectFilename(blankToNull(props.getSubjectFilename()))
                .subject(blankToNull(props.getSubject()))
                .templateType(TemplateType.of(props.getTemplateType()))
                .wantProperties(props.isWantProperties())
                .wantSteps(props.isWantSteps())
                .wantLogs(props.isWantLogs());
        if (props.getCtx() != null) {
            b.ctx(props.getCtx());
        }
        return b.build();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
