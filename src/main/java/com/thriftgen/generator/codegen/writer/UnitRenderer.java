package com.thriftgen.generator.codegen.writer;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.thriftgen.generator.codegen.model.output.GeneratedUnit;
import com.thriftgen.generator.codegen.model.output.GeneratorKind;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a {@link GeneratedUnit} to Java source with the {@code unit.ftl}
 * template.
 */
public class UnitRenderer {

    private static final String UNIT_TEMPLATE = "unit.ftl";

    private final Configuration freemarkerConfig;

    public UnitRenderer() {
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

    public String render(GeneratedUnit unit) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("packageName", unit.getPackageName());
        model.put("imports", unit.getImports().stream().sorted().toList());
        model.put("javadocLines", unit.getJavadoc() == null ? List.of() : unit.getJavadoc().lines().toList());
        model.put("declaration", unit.getDeclaration());
        model.put("enumConstants", unit.getEnumConstants());
        // An enum without constants still needs the terminator before its members.
        model.put("enumTerminator", unit.getGenerator() == GeneratorKind.ENUM
                && unit.getEnumConstants().isEmpty() && !unit.getMembers().isEmpty());
        model.put("members", unit.getMembers());

        Template template = freemarkerConfig.getTemplate(UNIT_TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + unit.getModuleName(), e);
        }
        return out.toString();
    }
}
