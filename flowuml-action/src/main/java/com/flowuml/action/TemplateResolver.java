package com.flowuml.action;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {{name}}} markers with instance variable values. Names consist of letters, digits,
 * {@code _} and {@code .}; whitespace inside the braces is allowed. A marker whose variable is
 * missing resolves to the empty string.
 */
public final class TemplateResolver {

    private static final Pattern MARKER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.]+)\\s*\\}\\}");

    private TemplateResolver() {
    }

    public static String resolve(String template, Function<String, String> variables) {
        if (template == null || template.isEmpty()) return template;
        Matcher m = MARKER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = variables != null ? variables.apply(m.group(1)) : null;
            m.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : ""));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** Resolves every value of {@code params}; keys and iteration order are kept. */
    public static Map<String, String> resolveAll(Map<String, String> params, Function<String, String> variables) {
        Map<String, String> resolved = new LinkedHashMap<>();
        params.forEach((k, v) -> resolved.put(k, resolve(v, variables)));
        return resolved;
    }
}
