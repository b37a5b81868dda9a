package com.github.salilvnair.researchengine.template;

import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders prompt templates in Thymeleaf TEXT mode. {@code {{name}}}, {@code #{expr}} and
 * {@code [${expr}]} are accepted as shorthands for the unescaped {@code [(${...})]}.
 */
@Component
public class ThymeleafTemplateRenderer {

    private static final Pattern DOUBLE_BRACE_VAR_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");
    private static final Pattern HASH_EXPR_PATTERN = Pattern.compile("#\\{\\s*([^{}]+?)\\s*}");
    private static final Pattern SINGLE_BRACKET_EXPR_PATTERN = Pattern.compile("(?<!\\[)\\[\\s*\\$\\{\\s*([^{}]+?)\\s*}\\s*](?!])");

    private final SpringTemplateEngine templateEngine;

    public ThymeleafTemplateRenderer() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(true);

        SpringTemplateEngine engine = new SpringTemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setEnableSpringELCompiler(true);
        this.templateEngine = engine;
    }

    public String render(String template, Map<String, Object> variables) {
        String raw = template == null ? "" : template;
        if (raw.isBlank()) {
            return raw;
        }
        Context context = new Context();
        context.setVariables(variables == null ? Map.of() : new LinkedHashMap<>(variables));
        String rendered = templateEngine.process(normalizeTemplate(raw), context);
        return rendered == null ? "" : rendered;
    }

    private String normalizeTemplate(String template) {
        String normalized = replacePattern(template, DOUBLE_BRACE_VAR_PATTERN, "[(${$1})]");
        normalized = replacePattern(normalized, HASH_EXPR_PATTERN, "[(${$1})]");
        normalized = replacePattern(normalized, SINGLE_BRACKET_EXPR_PATTERN, "[(${$1})]");
        return normalized;
    }

    private String replacePattern(String input, Pattern pattern, String replacement) {
        Matcher matcher = pattern.matcher(input);
        StringBuffer out = new StringBuffer();
        while (matcher.find()) {
            String resolvedReplacement = replacement.replace("$1", matcher.group(1).trim());
            matcher.appendReplacement(out, Matcher.quoteReplacement(resolvedReplacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
