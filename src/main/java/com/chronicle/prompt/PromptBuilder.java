package com.chronicle.prompt;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{placeholder}}} markers. Unknown placeholders are left as-is.
 */
public final class PromptBuilder {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_]+)\\s*}}");

    private PromptBuilder() {
    }

    public static BuiltPrompt build(PromptTemplate<?> template, Map<String, String> values) {
        return build(template.systemPrompt(), template.userTemplate(), values);
    }

    /**
     * Builds with the custom system/user text where the override provides one.
     */
    public static BuiltPrompt build(PromptTemplate<?> template,
                                    Map<String, String> values,
                                    CustomPromptText override) {
        if (override == null) {
            return build(template, values);
        }
        String system = override.systemPrompt() != null ? override.systemPrompt() : template.systemPrompt();
        String user = override.userTemplate() != null ? override.userTemplate() : template.userTemplate();
        return build(system, user, values);
    }

    public static BuiltPrompt build(String system, String user, Map<String, String> values) {
        return new BuiltPrompt(fill(system, values), fill(user, values));
    }

    static String fill(String text, Map<String, String> values) {
        if (text == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /** Replacement text for a prompt; either part may be null. */
    public interface CustomPromptText {
        String systemPrompt();

        String userTemplate();
    }
}
