package com.chronicle.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.UUID;

/**
 * Immutable narrative event, the only mutation primitive of the story state.
 *
 * The union is closed: every variant is a record nested in this interface and
 * tagged by an {@link EventType}. Character references are exposed through the
 * {@link CharacterEvent}, {@link DirectionalRelationshipEvent} and
 * {@link PairRelationshipEvent} facets so that name resolution can rewrite them
 * without knowing each variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = NarrativeEvent.TimeDelta.class, name = "time.delta"),
    @JsonSubTypes.Type(value = NarrativeEvent.LocationMoved.class, name = "location.moved"),
    @JsonSubTypes.Type(value = NarrativeEvent.PropAdded.class, name = "location.prop_added"),
    @JsonSubTypes.Type(value = NarrativeEvent.PropRemoved.class, name = "location.prop_removed"),
    @JsonSubTypes.Type(value = NarrativeEvent.CharacterAppeared.class, name = "character.appeared"),
    @JsonSubTypes.Type(value = NarrativeEvent.CharacterDeparted.class, name = "character.departed"),
    @JsonSubTypes.Type(value = NarrativeEvent.PositionChanged.class, name = "character.position_changed"),
    @JsonSubTypes.Type(value = NarrativeEvent.ActivityChanged.class, name = "character.activity_changed"),
    @JsonSubTypes.Type(value = NarrativeEvent.MoodAdded.class, name = "character.mood_added"),
    @JsonSubTypes.Type(value = NarrativeEvent.MoodRemoved.class, name = "character.mood_removed"),
    @JsonSubTypes.Type(value = NarrativeEvent.OutfitChanged.class, name = "character.outfit_changed"),
    @JsonSubTypes.Type(value = NarrativeEvent.AkasAdded.class, name = "character.akas_add"),
    @JsonSubTypes.Type(value = NarrativeEvent.StatusChanged.class, name = "relationship.status_changed"),
    @JsonSubTypes.Type(value = NarrativeEvent.SubjectOccurred.class, name = "relationship.subject"),
    @JsonSubTypes.Type(value = NarrativeEvent.FeelingAdded.class, name = "relationship.feeling_added"),
    @JsonSubTypes.Type(value = NarrativeEvent.FeelingRemoved.class, name = "relationship.feeling_removed"),
    @JsonSubTypes.Type(value = NarrativeEvent.TensionChanged.class, name = "scene.tension_changed"),
    @JsonSubTypes.Type(value = NarrativeEvent.ChapterEnded.class, name = "chapter.ended"),
    @JsonSubTypes.Type(value = NarrativeEvent.ChapterDescribed.class, name = "chapter.described")
})
@JsonIgnoreProperties(value = {"kind", "subkind"}, allowGetters = true)
public sealed interface NarrativeEvent {

    String id();

    MessageAndSwipe source();

    long timestamp();

    @JsonProperty("type")
    EventType type();

    @JsonProperty("kind")
    default EventKind kind() {
        return type().kind();
    }

    @JsonProperty("subkind")
    default String subkind() {
        return type().subkind();
    }

    static String newId() {
        return UUID.randomUUID().toString();
    }

    /** Event that references exactly one character by name. */
    sealed interface CharacterEvent extends NarrativeEvent {
        String character();

        CharacterEvent withCharacter(String character);
    }

    /** Relationship event with a direction: how {@code fromCharacter} feels toward {@code towardCharacter}. */
    sealed interface DirectionalRelationshipEvent extends NarrativeEvent {
        String fromCharacter();

        String towardCharacter();

        DirectionalRelationshipEvent withCharacters(String fromCharacter, String towardCharacter);
    }

    /** Relationship event about an unordered pair. */
    sealed interface PairRelationshipEvent extends NarrativeEvent {
        CharacterPair pair();

        PairRelationshipEvent withPair(CharacterPair pair);
    }

    record TimeDelta(String id, MessageAndSwipe source, long timestamp,
                     int days, int hours, int minutes) implements NarrativeEvent {
        @Override
        public EventType type() {
            return EventType.TIME_DELTA;
        }

        public long totalMinutes() {
            return days * 24L * 60L + hours * 60L + minutes;
        }
    }

    record LocationMoved(String id, MessageAndSwipe source, long timestamp,
                         String newArea, String newPlace, String newPosition) implements NarrativeEvent {
        @Override
        public EventType type() {
            return EventType.LOCATION_MOVED;
        }
    }

    record PropAdded(String id, MessageAndSwipe source, long timestamp, String prop) implements NarrativeEvent {
        @Override
        public EventType type() {
            return EventType.LOCATION_PROP_ADDED;
        }
    }

    record PropRemoved(String id, MessageAndSwipe source, long timestamp, String prop) implements NarrativeEvent {
        @Override
        public EventType type() {
            return EventType.LOCATION_PROP_REMOVED;
        }
    }

    record CharacterAppeared(String id, MessageAndSwipe source, long timestamp, String character,
                             String initialPosition, String initialActivity,
                             List<String> initialMood) implements CharacterEvent {
        public CharacterAppeared {
            initialMood = initialMood == null ? List.of() : List.copyOf(initialMood);
        }

        @Override
        public EventType type() {
            return EventType.CHARACTER_APPEARED;
        }

        @Override
        public CharacterAppeared withCharacter(String character) {
            return new CharacterAppeared(id, source, timestamp, character, initialPosition, initialActivity, initialMood);
        }
    }

    record CharacterDeparted(String id, MessageAndSwipe source, long timestamp,
                             String character) implements CharacterEvent {
        @Override
        public EventType type() {
            return EventType.CHARACTER_DEPARTED;
        }

        @Override
        public CharacterDeparted withCharacter(String character) {
            return new CharacterDeparted(id, source, timestamp, character);
        }
    }

    record PositionChanged(String id, MessageAndSwipe source, long timestamp,
                           String character, String newValue) implements CharacterEvent {
        @Override
        public EventType type() {
            return EventType.CHARACTER_POSITION_CHANGED;
        }

        @Override
        public PositionChanged withCharacter(String character) {
            return new PositionChanged(id, source, timestamp, character, newValue);
        }
    }

    record ActivityChanged(String id, MessageAndSwipe source, long timestamp,
                           String character, String newValue) implements CharacterEvent {
        @Override
        public EventType type() {
            return EventType.CHARACTER_ACTIVITY_CHANGED;
        }

        @Override
        public ActivityChanged withCharacter(String character) {
            return new ActivityChanged(id, source, timestamp, character, newValue);
        }
    }

    record MoodAdded(String id, MessageAndSwipe source, long timestamp,
                     String character, String value) implements CharacterEvent {
        @Override
        public EventType type() {
            return EventType.CHARACTER_MOOD_ADDED;
        }

        @Override
        public MoodAdded withCharacter(String character) {
            return new MoodAdded(id, source, timestamp, character, value);
        }
    }

    record MoodRemoved(String id, MessageAndSwipe source, long timestamp,
                       String character, String value) implements CharacterEvent {
        @Override
        public EventType type() {
            return EventType.CHARACTER_MOOD_REMOVED;
        }

        @Override
        public MoodRemoved withCharacter(String character) {
            return new MoodRemoved(id, source, timestamp, character, value);
        }
    }

    /** {@code newValue == null} means the slot was emptied. */
    record OutfitChanged(String id, MessageAndSwipe source, long timestamp,
                         String character, OutfitSlot slot, String newValue) implements CharacterEvent {
        @Override
        public EventType type() {
            return EventType.CHARACTER_OUTFIT_CHANGED;
        }

        @Override
        public OutfitChanged withCharacter(String character) {
            return new OutfitChanged(id, source, timestamp, character, slot, newValue);
        }
    }

    /** Defines aliases; never itself subject to alias resolution. */
    record AkasAdded(String id, MessageAndSwipe source, long timestamp,
                     String character, List<String> akas) implements CharacterEvent {
        public AkasAdded {
            akas = akas == null ? List.of() : List.copyOf(akas);
        }

        @Override
        public EventType type() {
            return EventType.CHARACTER_AKAS_ADD;
        }

        @Override
        public AkasAdded withCharacter(String character) {
            return new AkasAdded(id, source, timestamp, character, akas);
        }
    }

    record StatusChanged(String id, MessageAndSwipe source, long timestamp,
                         CharacterPair pair, String newStatus) implements PairRelationshipEvent {
        @Override
        public EventType type() {
            return EventType.RELATIONSHIP_STATUS_CHANGED;
        }

        @Override
        public StatusChanged withPair(CharacterPair pair) {
            return new StatusChanged(id, source, timestamp, pair, newStatus);
        }
    }

    record SubjectOccurred(String id, MessageAndSwipe source, long timestamp,
                           CharacterPair pair, String subject) implements PairRelationshipEvent {
        @Override
        public EventType type() {
            return EventType.RELATIONSHIP_SUBJECT;
        }

        @Override
        public SubjectOccurred withPair(CharacterPair pair) {
            return new SubjectOccurred(id, source, timestamp, pair, subject);
        }
    }

    record FeelingAdded(String id, MessageAndSwipe source, long timestamp,
                        String fromCharacter, String towardCharacter, String value)
        implements DirectionalRelationshipEvent {
        @Override
        public EventType type() {
            return EventType.RELATIONSHIP_FEELING_ADDED;
        }

        @Override
        public FeelingAdded withCharacters(String fromCharacter, String towardCharacter) {
            return new FeelingAdded(id, source, timestamp, fromCharacter, towardCharacter, value);
        }
    }

    record FeelingRemoved(String id, MessageAndSwipe source, long timestamp,
                          String fromCharacter, String towardCharacter, String value)
        implements DirectionalRelationshipEvent {
        @Override
        public EventType type() {
            return EventType.RELATIONSHIP_FEELING_REMOVED;
        }

        @Override
        public FeelingRemoved withCharacters(String fromCharacter, String towardCharacter) {
            return new FeelingRemoved(id, source, timestamp, fromCharacter, towardCharacter, value);
        }
    }

    record TensionChanged(String id, MessageAndSwipe source, long timestamp,
                          String level, String tensionType, String direction) implements NarrativeEvent {
        @Override
        public EventType type() {
            return EventType.SCENE_TENSION_CHANGED;
        }
    }

    record ChapterEnded(String id, MessageAndSwipe source, long timestamp,
                        int chapterIndex, String reason) implements NarrativeEvent {
        @Override
        public EventType type() {
            return EventType.CHAPTER_ENDED;
        }
    }

    record ChapterDescribed(String id, MessageAndSwipe source, long timestamp,
                            int chapterIndex, String title, String summary) implements NarrativeEvent {
        @Override
        public EventType type() {
            return EventType.CHAPTER_DESCRIBED;
        }
    }
}
