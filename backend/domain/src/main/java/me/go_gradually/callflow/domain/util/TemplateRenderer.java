package me.go_gradually.callflow.domain.util;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TemplateRenderer {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([\\w.\\-]+)\\s*}}");
    private static final Pattern SPACES = Pattern.compile("[ \\t]{2,}");

    private TemplateRenderer() {
    }

    /**
     * Replaces {{name}} placeholders. Unknown names render as empty text so they are never spoken.
     */
    public static String render(String template, Map<String, String> variables) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = variables == null ? null : variables.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(out);
        return SPACES.matcher(out.toString()).replaceAll(" ").trim();
    }
}
