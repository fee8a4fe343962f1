package com.chronicle.extractor;

import com.chronicle.prompt.PromptBuilder;

/**
 * User override for a named prompt. Any part may be null to keep the default.
 */
public record CustomPrompt(String systemPrompt, String userTemplate, Double temperature)
    implements PromptBuilder.CustomPromptText {

    public boolean overridesText() {
        return systemPrompt != null || userTemplate != null;
    }
}
