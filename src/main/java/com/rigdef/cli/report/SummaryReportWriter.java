package com.rigdef.cli.report;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a {@link RigSummary} as plain text using the {@code summary.ftl} template.
 */
public class SummaryReportWriter {
    private static final Logger log = LoggerFactory.getLogger(SummaryReportWriter.class);

    static final String TEMPLATE_NAME = "summary.ftl";

    private final Configuration freemarkerConfig;

    public SummaryReportWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(RigSummary summary) throws IOException {
        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        Map<String, Object> model = new HashMap<>();
        model.put("summary", summary);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    public void write(RigSummary summary, Path target) throws IOException {
        String text = render(summary);
        Files.writeString(target, text, StandardCharsets.UTF_8);
        log.debug("Wrote summary report for {} to {}", summary.getFileName(), target);
    }
}
