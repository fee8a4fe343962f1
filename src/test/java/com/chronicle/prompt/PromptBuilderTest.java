package com.chronicle.prompt;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private static final PromptTemplate<String> TEMPLATE = JsonPromptTemplate.of(
        "sample", "You track {{ subject }}.", "Messages:\n{{messages}}\nUnknown: {{missing}}", 0.5,
        node -> "ok");

    @Test
    void placeholders_areFilled_andUnknownOnesKept() {
        BuiltPrompt built = PromptBuilder.build(TEMPLATE, Map.of("subject", "time", "messages", "Luna: hi"));

        assertEquals("You track time.", built.system());
        assertEquals("Messages:\nLuna: hi\nUnknown: {{missing}}", built.user());
    }

    @Test
    void replacementText_isInsertedLiterally() {
        BuiltPrompt built = PromptBuilder.build("{{a}}", "{{b}}", Map.of("a", "$1 \\ cost", "b", ""));

        assertEquals("$1 \\ cost", built.system());
        assertEquals("", built.user());
    }

    @Test
    void customText_overridesOnlyTheGivenPart() {
        PromptBuilder.CustomPromptText override = new PromptBuilder.CustomPromptText() {
            @Override
            public String systemPrompt() {
                return "Custom system for {{subject}}.";
            }

            @Override
            public String userTemplate() {
                return null;
            }
        };

        BuiltPrompt built = PromptBuilder.build(TEMPLATE, Map.of("subject", "props", "messages", "m"), override);

        assertEquals("Custom system for props.", built.system());
        assertTrue(built.user().startsWith("Messages:\nm"));
    }
}
