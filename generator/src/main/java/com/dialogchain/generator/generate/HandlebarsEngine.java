package com.dialogchain.generator.generate;

import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Handlebars template engine with custom helpers for code generation.
 *
 * <p>Templates live on the classpath under {@code /templates} with a
 * {@code .hbs} suffix. Output is never HTML-escaped since everything rendered
 * here is source code, shell or YAML.
 *
 * <p>Compiled templates are cached per instance. Not thread-safe.
 */
public class HandlebarsEngine {
    private final Handlebars handlebars;
    private final Map<String, Template> compiled = new HashMap<>();

    public HandlebarsEngine() {
        ClassPathTemplateLoader loader = new ClassPathTemplateLoader();
        loader.setPrefix("/templates");
        loader.setSuffix(".hbs");
        this.handlebars = new Handlebars(loader)
                .with(EscapingStrategy.NOOP)
                .prettyPrint(true);
        registerHelpers();
    }

    private void registerHelpers() {
        handlebars.registerHelper("titleCase", (Helper<String>) (value, options) -> titleCase(value));
    }

    /**
     * "main_processor" becomes "Main Processor".
     */
    static String titleCase(String value) {
        if (value == null || value.isEmpty()) return "";
        StringBuilder result = new StringBuilder();
        boolean capitalizeNext = true;
        for (char c : value.toCharArray()) {
            if (c == '_' || c == '-' || c == ' ') {
                if (result.length() > 0 && result.charAt(result.length() - 1) != ' ') {
                    result.append(' ');
                }
                capitalizeNext = true;
            } else if (capitalizeNext) {
                result.append(Character.toUpperCase(c));
                capitalizeNext = false;
            } else {
                result.append(Character.toLowerCase(c));
            }
        }
        return result.toString().trim();
    }

    public Template compile(String templateName) throws IOException {
        Template template = compiled.get(templateName);
        if (template == null) {
            template = handlebars.compile(templateName);
            compiled.put(templateName, template);
        }
        return template;
    }

    public String render(String templateName, Object context) throws IOException {
        Template template = compile(templateName);
        return template.apply(context);
    }
}
