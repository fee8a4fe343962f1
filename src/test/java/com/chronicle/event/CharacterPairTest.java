package com.chronicle.event;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CharacterPairTest {

    @Test
    void membersAreOrdered_soPairsAreUnordered() {
        CharacterPair pair = CharacterPair.of("Luna", "Bob");

        assertEquals("Bob", pair.first());
        assertEquals("Luna", pair.second());
        assertEquals(CharacterPair.of("Bob", "Luna"), pair);
        assertEquals("Bob|Luna", pair.key());
        assertEquals("Bob/Luna", pair.label());
    }

    @Test
    void uniquePairs_skipDuplicatesAndSameName() {
        List<CharacterPair> pairs = CharacterPair.uniquePairs(List.of("Luna", "Bob", "Elena", "Bob"));

        assertEquals(List.of(
            CharacterPair.of("Bob", "Elena"),
            CharacterPair.of("Bob", "Luna"),
            CharacterPair.of("Elena", "Luna")), pairs);
    }

    @Test
    void uniquePairs_independentOfInputOrder() {
        assertEquals(CharacterPair.uniquePairs(List.of("C", "A", "B")),
            CharacterPair.uniquePairs(List.of("B", "C", "A")));
        assertTrue(CharacterPair.uniquePairs(List.of("Solo")).isEmpty());
    }

    @Test
    void nullMember_isRejected() {
        assertThrows(NullPointerException.class, () -> CharacterPair.of(null, "Bob"));
    }
}
