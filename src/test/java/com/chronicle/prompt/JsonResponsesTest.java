package com.chronicle.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonResponsesTest {

    @Test
    void fencedObject_afterProse_isRead() {
        String response = "Sure! Here is the result:\n```json\n{\"changed\": true, \"hours\": 2}\n```\nHope it helps.";

        JsonNode node = JsonResponses.readObject(response).orElseThrow();

        assertTrue(JsonResponses.bool(node, "changed", false));
        assertEquals(2, JsonResponses.integer(node, "hours", 0));
    }

    @Test
    void lenientSyntax_isAccepted() {
        JsonNode node = JsonResponses.readObject("{mood: 'tired', added: ['a', 'b',],}").orElseThrow();

        assertEquals("tired", JsonResponses.text(node, "mood"));
        assertEquals(List.of("a", "b"), JsonResponses.strings(node, "added"));
    }

    @Test
    void arrayResponse_isNotAnObject() {
        assertTrue(JsonResponses.read("[[\"Luna\", \"Bob\"]]").isPresent());
        assertTrue(JsonResponses.readObject("[[\"Luna\", \"Bob\"]]").isEmpty());
    }

    @Test
    void garbage_isEmpty() {
        assertTrue(JsonResponses.read("I could not decide.").isEmpty());
        assertTrue(JsonResponses.read("   ").isEmpty());
        assertTrue(JsonResponses.read(null).isEmpty());
    }

    @Test
    void fieldHelpers_tolerateWrongTypes() {
        JsonNode node = JsonResponses.readObject(
            "{\"hours\": \"3\", \"flag\": \"TRUE\", \"blank\": \"  \", \"list\": [\"x\", 4, \" \"], \"obj\": {}}")
            .orElseThrow();

        assertEquals(3, JsonResponses.integer(node, "hours", 0));
        assertEquals(7, JsonResponses.integer(node, "missing", 7));
        assertTrue(JsonResponses.bool(node, "flag", false));
        assertNull(JsonResponses.text(node, "blank"));
        assertNull(JsonResponses.text(node, "obj"));
        assertEquals(List.of("x"), JsonResponses.strings(node, "list"));
        assertTrue(JsonResponses.objects(node, "list").isEmpty());
    }
}
