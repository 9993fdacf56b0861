package com.buildnotify.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.DeprecatedConfigurationProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通知消息格式化配置（绑定前缀：build.notify）
 *
 * YAML 示例：
 * build:
 *   notify:
 *     enabled: true
 *     master:
 *       title: Buildbot
 *       buildbot-url: http://localhost:8010/
 *     build:
 *       template-dir: /etc/buildbot/templates
 *       template-filename: default_mail.txt
 *       subject: "{{ summary }} on {{ buildername }}"
 *       template-type: plain
 *       want-properties: true
 *       ctx:
 *         footer: "-- ops team"
 *     missing-worker:
 *       template-type: plain
 */
@ConfigurationProperties(prefix = "build.notify")
public class BuildNotifyProperties {

    private boolean enabled = true;

    private Master master = new Master();

    private Template build = new Template();

    private Template missingWorker = new Template();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Master getMaster() {
        return master;
    }

    public void setMaster(Master master) {
        this.master = master;
    }

    public Template getBuild() {
        return build;
    }

    public void setBuild(Template build) {
        this.build = build;
    }

    public Template getMissingWorker() {
        return missingWorker;
    }

    public void setMissingWorker(Template missingWorker) {
        this.missingWorker = missingWorker;
    }

    // ----------------- 嵌套配置对象 -----------------

    public static class Master {

        /** 站点标题 */
        private String title = "Buildbot";

        /** 对外访问地址 */
        private String buildbotUrl = "http://localhost:8010/";

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getBuildbotUrl() {
            return buildbotUrl;
        }

        public void setBuildbotUrl(String buildbotUrl) {
            this.buildbotUrl = buildbotUrl;
        }
    }

    public static class Template {

        /** 模板目录, 缺省使用内置模板 */
        private String templateDir;

        private String templateFilename;

        /** 已废弃, 等价于 template-filename */
        private String templateName;

        /** 内联正文模板 */
        private String template;

        private String subjectFilename;

        /** 内联标题模板 */
        private String subject;

        /** plain | html */
        private String templateType = "plain";

        /** 附加上下文, 覆盖同名计算值 */
        private Map<String, Object> ctx = new LinkedHashMap<>();

        /** 以下三项提示外部取数组件需填充的内容 */
        private boolean wantProperties = true;

        private boolean wantSteps = false;

        private boolean wantLogs = false;

        public String getTemplateDir() {
            return templateDir;
        }

        public void setTemplateDir(String templateDir) {
            this.templateDir = templateDir;
        }

        public String getTemplateFilename() {
            return templateFilename;
        }

        public void setTemplateFilename(String templateFilename) {
            this.templateFilename = templateFilename;
        }

        @Deprecated
        @DeprecatedConfigurationProperty(reason = "use template-filename")
        public String getTemplateName() {
            return templateName;
        }

        @Deprecated
        public void setTemplateName(String templateName) {
            this.templateName = templateName;
        }

        public String getTemplate() {
            return template;
        }

        public void setTemplate(String template) {
            this.template = template;
        }

        public String getSubjectFilename() {
            return subjectFilename;
        }

        public void setSubjectFilename(String subjectFilename) {
            this.subjectFilename = subjectFilename;
        }

        public String getSubject() {
            return subject;
        }

        public void setSubject(String subject) {
            this.subject = subject;
        }

        public String getTemplateType() {
            return templateType;
        }

        public void setTemplateType(String templateType) {
            this.templateType = templateType;
        }

        public Map<String, Object> getCtx() {
            return ctx;
        }

        public void setCtx(Map<String, Object> ctx) {
            this.ctx = ctx;
        }

        public boolean isWantProperties() {
            return wantProperties;
        }

        public void setWantProperties(boolean wantProperties) {
            this.wantProperties = wantProperties;
        }

        public boolean isWantSteps() {
            return wantSteps;
        }

        public void setWantSteps(boolean wantSteps) {
            this.wantSteps = wantSteps;
        }

        public boolean isWantLogs() {
            return wantLogs;
        }

        public void setWantLogs(boolean wantLogs) {
            this.wantLogs = wantLogs;
        }
    }
}
