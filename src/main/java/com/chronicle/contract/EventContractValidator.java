package com.chronicle.contract;

import com.chronicle.event.CharacterPair;
import com.chronicle.event.MessageAndSwipe;
import com.chronicle.event.NarrativeEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Structural checks applied to every event before it reaches the log.
 * A violation rejects the event; the store rejects the whole batch.
 */
@Component
public class EventContractValidator {

    public void validate(NarrativeEvent event) {
        requireNonNull(event, "event cannot be null");
        requireUuid(event.id(), "id must be a valid UUID");
        validateSource(event.source());
        if (event.timestamp() < 0) {
            throw new ContractViolationException("timestamp must be >= 0");
        }

        switch (event.type()) {
            case TIME_DELTA -> validateTimeDelta((NarrativeEvent.TimeDelta) event);
            case LOCATION_MOVED -> validateLocationMoved((NarrativeEvent.LocationMoved) event);
            case LOCATION_PROP_ADDED ->
                requireString(((NarrativeEvent.PropAdded) event).prop(), "prop is required");
            case LOCATION_PROP_REMOVED ->
                requireString(((NarrativeEvent.PropRemoved) event).prop(), "prop is required");
            case CHARACTER_APPEARED, CHARACTER_DEPARTED, CHARACTER_POSITION_CHANGED,
                 CHARACTER_ACTIVITY_CHANGED -> validateCharacter((NarrativeEvent.CharacterEvent) event);
            case CHARACTER_MOOD_ADDED -> {
                NarrativeEvent.MoodAdded mood = (NarrativeEvent.MoodAdded) event;
                validateCharacter(mood);
                requireString(mood.value(), "mood value is required");
            }
            case CHARACTER_MOOD_REMOVED -> {
                NarrativeEvent.MoodRemoved mood = (NarrativeEvent.MoodRemoved) event;
                validateCharacter(mood);
                requireString(mood.value(), "mood value is required");
            }
            case CHARACTER_OUTFIT_CHANGED -> {
                NarrativeEvent.OutfitChanged outfit = (NarrativeEvent.OutfitChanged) event;
                validateCharacter(outfit);
                requireNonNull(outfit.slot(), "outfit slot must be one of the known slots");
            }
            case CHARACTER_AKAS_ADD -> validateAkas((NarrativeEvent.AkasAdded) event);
            case RELATIONSHIP_STATUS_CHANGED -> {
                NarrativeEvent.StatusChanged status = (NarrativeEvent.StatusChanged) event;
                validatePair(status.pair());
                requireString(status.newStatus(), "newStatus is required");
            }
            case RELATIONSHIP_SUBJECT -> {
                NarrativeEvent.SubjectOccurred subject = (NarrativeEvent.SubjectOccurred) event;
                validatePair(subject.pair());
                requireString(subject.subject(), "subject is required");
            }
            case RELATIONSHIP_FEELING_ADDED, RELATIONSHIP_FEELING_REMOVED ->
                validateDirectional((NarrativeEvent.DirectionalRelationshipEvent) event);
            case SCENE_TENSION_CHANGED ->
                requireString(((NarrativeEvent.TensionChanged) event).level(), "tension level is required");
            case CHAPTER_ENDED -> {
                if (((NarrativeEvent.ChapterEnded) event).chapterIndex() < 0) {
                    throw new ContractViolationException("chapterIndex must be >= 0");
                }
            }
            case CHAPTER_DESCRIBED -> {
                NarrativeEvent.ChapterDescribed described = (NarrativeEvent.ChapterDescribed) event;
                if (described.chapterIndex() < 0) {
                    throw new ContractViolationException("chapterIndex must be >= 0");
                }
                requireString(described.title(), "chapter title is required");
            }
        }
    }

    public void validateAll(List<? extends NarrativeEvent> events) {
        requireNonNull(events, "events cannot be null");
        for (NarrativeEvent event : events) {
            validate(event);
        }
    }

    private void validateSource(MessageAndSwipe source) {
        requireNonNull(source, "source is required");
        if (source.messageId() < 0 || source.swipeId() < 0) {
            throw new ContractViolationException("source message and swipe ids must be >= 0");
        }
    }

    private void validateTimeDelta(NarrativeEvent.TimeDelta delta) {
        if (delta.days() < 0 || delta.hours() < 0 || delta.minutes() < 0) {
            throw new ContractViolationException("time delta components must be >= 0");
        }
    }

    private void validateLocationMoved(NarrativeEvent.LocationMoved moved) {
        if (isBlank(moved.newArea()) && isBlank(moved.newPlace()) && isBlank(moved.newPosition())) {
            throw new ContractViolationException("location move must name an area, place or position");
        }
    }

    private void validateCharacter(NarrativeEvent.CharacterEvent event) {
        requireString(event.character(), "character is required");
    }

    private void validateAkas(NarrativeEvent.AkasAdded akas) {
        validateCharacter(akas);
        if (akas.akas().isEmpty()) {
            throw new ContractViolationException("akas must contain at least 1 name");
        }
        for (String aka : akas.akas()) {
            requireString(aka, "akas must not contain blank names");
        }
    }

    private void validatePair(CharacterPair pair) {
        requireNonNull(pair, "pair is required");
        requireString(pair.first(), "pair members are required");
        requireString(pair.second(), "pair members are required");
        if (pair.first().equals(pair.second())) {
            throw new ContractViolationException("pair members must be distinct");
        }
    }

    private void validateDirectional(NarrativeEvent.DirectionalRelationshipEvent event) {
        requireString(event.fromCharacter(), "fromCharacter is required");
        requireString(event.towardCharacter(), "towardCharacter is required");
        if (event.fromCharacter().equals(event.towardCharacter())) {
            throw new ContractViolationException("fromCharacter and towardCharacter must differ");
        }
    }

    private String requireString(String value, String message) {
        if (isBlank(value)) {
            throw new ContractViolationException(message);
        }
        return value;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ContractViolationException(message);
        }
    }

    private void requireUuid(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(message);
        }
        try {
            UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new ContractViolationException(message);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
