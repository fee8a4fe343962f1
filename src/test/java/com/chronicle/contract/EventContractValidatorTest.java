package com.chronicle.contract;

import com.chronicle.event.CharacterPair;
import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.event.OutfitSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventContractValidatorTest {

    private static final MessageAndSwipe SOURCE = MessageAndSwipe.of(3, 0);

    private EventContractValidator validator;

    @BeforeEach
    void setUp() {
        validator = new EventContractValidator();
    }

    @Nested
    @DisplayName("Envelope")
    class Envelope {

        @Test
        void nonUuidId_isRejected() {
            NarrativeEvent event = new NarrativeEvent.PropAdded("evt-1", SOURCE, 0L, "lamp");
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(event));
            assertTrue(ex.getMessage().contains("UUID"));
        }

        @Test
        void negativeSource_isRejected() {
            NarrativeEvent event = new NarrativeEvent.PropAdded(
                NarrativeEvent.newId(), MessageAndSwipe.of(-2, 0), 0L, "lamp");
            assertThrows(ContractViolationException.class, () -> validator.validate(event));
        }

        @Test
        void negativeTimestamp_isRejected() {
            NarrativeEvent event = new NarrativeEvent.PropAdded(NarrativeEvent.newId(), SOURCE, -1L, "lamp");
            assertThrows(ContractViolationException.class, () -> validator.validate(event));
        }

        @Test
        void wellFormedEvent_passes() {
            NarrativeEvent event = new NarrativeEvent.PropAdded(NarrativeEvent.newId(), SOURCE, 10L, "lamp");
            assertDoesNotThrow(() -> validator.validate(event));
        }
    }

    @Nested
    @DisplayName("Payload rules")
    class Payload {

        @Test
        void negativeTimeComponent_isRejected() {
            NarrativeEvent event = new NarrativeEvent.TimeDelta(NarrativeEvent.newId(), SOURCE, 0L, 0, -1, 0);
            assertThrows(ContractViolationException.class, () -> validator.validate(event));
        }

        @Test
        void emptyLocationMove_isRejected() {
            NarrativeEvent event = new NarrativeEvent.LocationMoved(
                NarrativeEvent.newId(), SOURCE, 0L, null, " ", null);
            assertThrows(ContractViolationException.class, () -> validator.validate(event));
        }

        @Test
        void emptyAkas_areRejected() {
            NarrativeEvent event = new NarrativeEvent.AkasAdded(
                NarrativeEvent.newId(), SOURCE, 0L, "Luna", List.of());
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(event));
            assertTrue(ex.getMessage().contains("akas"));
        }

        @Test
        void pairWithSameMember_isRejected() {
            NarrativeEvent event = new NarrativeEvent.StatusChanged(
                NarrativeEvent.newId(), SOURCE, 0L, CharacterPair.of("Luna", "Luna"), "friendly");
            assertThrows(ContractViolationException.class, () -> validator.validate(event));
        }

        @Test
        void feelingTowardSelf_isRejected() {
            NarrativeEvent event = new NarrativeEvent.FeelingAdded(
                NarrativeEvent.newId(), SOURCE, 0L, "Luna", "Luna", "pride");
            assertThrows(ContractViolationException.class, () -> validator.validate(event));
        }

        @Test
        void outfitRemoval_withNullValue_passes() {
            NarrativeEvent event = new NarrativeEvent.OutfitChanged(
                NarrativeEvent.newId(), SOURCE, 0L, "Luna", OutfitSlot.HEAD, null);
            assertDoesNotThrow(() -> validator.validate(event));
        }

        @Test
        void outfitWithoutSlot_isRejected() {
            NarrativeEvent event = new NarrativeEvent.OutfitChanged(
                NarrativeEvent.newId(), SOURCE, 0L, "Luna", null, "hat");
            assertThrows(ContractViolationException.class, () -> validator.validate(event));
        }

        @Test
        void chapterDescription_requiresTitle() {
            NarrativeEvent event = new NarrativeEvent.ChapterDescribed(
                NarrativeEvent.newId(), SOURCE, 0L, 0, "", "summary");
            assertThrows(ContractViolationException.class, () -> validator.validate(event));
        }
    }

    @Test
    void validateAll_stopsAtFirstViolation() {
        List<NarrativeEvent> batch = List.of(
            new NarrativeEvent.PropAdded(NarrativeEvent.newId(), SOURCE, 0L, "lamp"),
            new NarrativeEvent.PropAdded(NarrativeEvent.newId(), SOURCE, 0L, " "));
        ContractViolationException ex = assertThrows(ContractViolationException.class,
            () -> validator.validateAll(batch));
        assertTrue(ex.getMessage().contains("prop"));
    }
}
