package com.regressionsentinel.core.alerting;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal mustache-style renderer for alert templates.
 * <p>
 * Supports {@code {{key}}} substitution and
 * {@code {{#each key}}...{{this}}...{{/each}}} blocks over collections.
 * Placeholders without a value are left untouched.
 * </p>
 */
public final class TemplateRenderer {

    private static final Pattern EACH_BLOCK = Pattern.compile("\\{\\{#each (\\w+)}}(.*?)\\{\\{/each}}\\R?",
            Pattern.DOTALL);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");
    private static final Pattern BREAK_TAG = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private TemplateRenderer() {
    }

    public static String render(String template, Map<String, Object> data) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        String expanded = expandEachBlocks(template, data);

        Matcher matcher = PLACEHOLDER.matcher(expanded);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = data.containsKey(key)
                    ? String.valueOf(data.get(key))
                    : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Strip markup: {@code <br>} becomes a line break, other tags are removed
     * and the common entities are unescaped.
     */
    public static String toText(String html) {
        String text = BREAK_TAG.matcher(html).replaceAll("\n");
        text = TAG.matcher(text).replaceAll("");
        return text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&")
                .replaceAll("(?m)^[ \\t]+", "")
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }

    private static String expandEachBlocks(String template, Map<String, Object> data) {
        Matcher matcher = EACH_BLOCK.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            StringBuilder block = new StringBuilder();
            if (data.get(matcher.group(1)) instanceof Collection<?> items) {
                String body = matcher.group(2).replaceFirst("^\\R", "");
                for (Object item : items) {
                    block.append(body.replace("{{this}}", String.valueOf(item)));
                }
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(block.toString()));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
