package com.chronicle.names;

import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.ProjectionReducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class TurnNameResolverTest {

    private static final MessageAndSwipe TURN = MessageAndSwipe.of(7, 0);

    private NarrativeState before;

    @BeforeEach
    void setUp() {
        MessageAndSwipe earlier = MessageAndSwipe.of(1, 0);
        before = ProjectionReducer.apply(NarrativeState.EMPTY, List.of(
            new NarrativeEvent.CharacterAppeared(NarrativeEvent.newId(), earlier, 0L, "Luna", null, null, null),
            new NarrativeEvent.CharacterAppeared(NarrativeEvent.newId(), earlier, 0L, "Bob", null, null, null),
            new NarrativeEvent.AkasAdded(NarrativeEvent.newId(), earlier, 0L, "Bob", List.of("Robert"))));
    }

    @Test
    void knownNames_resolveWithoutAsking() {
        NameDisambiguator disambiguator = mock(NameDisambiguator.class);
        TurnNameResolver resolver = new TurnNameResolver(disambiguator);

        List<NarrativeEvent> resolved = resolver.resolve(before, List.of(
            new NarrativeEvent.MoodAdded(NarrativeEvent.newId(), TURN, 0L, "robert", "tired")), TURN, 0L);

        assertEquals("Bob", ((NarrativeEvent.MoodAdded) resolved.get(0)).character());
        verifyNoInteractions(disambiguator);
    }

    @Test
    void characterAppearingThisTurn_isCanonical() {
        TurnNameResolver resolver = new TurnNameResolver(new SkippingNameDisambiguator());

        List<NarrativeEvent> resolved = resolver.resolve(before, List.of(
            new NarrativeEvent.CharacterAppeared(NarrativeEvent.newId(), TURN, 0L, "Elena", null, null, null),
            new NarrativeEvent.MoodAdded(NarrativeEvent.newId(), TURN, 0L, "elena", "shy")), TURN, 0L);

        assertEquals("Elena", ((NarrativeEvent.MoodAdded) resolved.get(1)).character());
    }

    @Test
    void acceptedMapping_rewritesAndRecordsAka() {
        NameDisambiguator disambiguator = mock(NameDisambiguator.class);
        when(disambiguator.resolve(anyList(), anyList()))
            .thenReturn(List.of(new UnresolvedNameMapping("the tall man", "Bob")));
        TurnNameResolver resolver = new TurnNameResolver(disambiguator);

        List<NarrativeEvent> resolved = resolver.resolve(before, List.of(
            new NarrativeEvent.MoodAdded(NarrativeEvent.newId(), TURN, 0L, "the tall man", "angry")), TURN, 42L);

        assertEquals(2, resolved.size());
        assertEquals("Bob", ((NarrativeEvent.MoodAdded) resolved.get(0)).character());
        NarrativeEvent.AkasAdded akas = (NarrativeEvent.AkasAdded) resolved.get(1);
        assertEquals("Bob", akas.character());
        assertEquals(List.of("Robert", "the tall man"), akas.akas());
        assertEquals(TURN, akas.source());
        assertEquals(42L, akas.timestamp());
        verify(disambiguator).resolve(List.of("the tall man"), List.of("Luna", "Bob"));
    }

    @Test
    void declinedName_staysAsExtracted() {
        TurnNameResolver resolver = new TurnNameResolver(new SkippingNameDisambiguator());

        List<NarrativeEvent> resolved = resolver.resolve(before, List.of(
            new NarrativeEvent.MoodAdded(NarrativeEvent.newId(), TURN, 0L, "Guard", "bored")), TURN, 0L);

        assertEquals(1, resolved.size());
        assertEquals("Guard", ((NarrativeEvent.MoodAdded) resolved.get(0)).character());
    }

    @Test
    void relationshipWithTwoAliasesOfOnePerson_isDropped() {
        TurnNameResolver resolver = new TurnNameResolver(new SkippingNameDisambiguator());

        List<NarrativeEvent> resolved = resolver.resolve(before, List.of(
            new NarrativeEvent.FeelingAdded(NarrativeEvent.newId(), TURN, 0L, "Robert", "Bob", "doubt"),
            new NarrativeEvent.FeelingAdded(NarrativeEvent.newId(), TURN, 0L, "Robert", "Luna", "trust")), TURN, 0L);

        assertEquals(1, resolved.size());
        NarrativeEvent.FeelingAdded kept = (NarrativeEvent.FeelingAdded) resolved.get(0);
        assertEquals("Bob", kept.fromCharacter());
        assertEquals("Luna", kept.towardCharacter());
    }

    @Test
    void emptyTurn_isReturnedAsIs() {
        NameDisambiguator disambiguator = mock(NameDisambiguator.class);

        assertTrue(new TurnNameResolver(disambiguator).resolve(before, List.of(), TURN, 0L).isEmpty());
        verify(disambiguator, never()).resolve(any(), any());
    }
}
