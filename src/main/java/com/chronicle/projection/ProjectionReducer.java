package com.chronicle.projection;

import com.chronicle.event.CharacterPair;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.event.OutfitSlot;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds ordered events into a {@link NarrativeState}.
 *
 * Pure: the input state is never modified and the result depends only on the
 * state and the event order.
 */
public final class ProjectionReducer {

    private ProjectionReducer() {
    }

    public static NarrativeState apply(NarrativeState base, List<? extends NarrativeEvent> events) {
        WorkingState working = new WorkingState(base);
        for (NarrativeEvent event : events) {
            working.apply(event);
        }
        return working.freeze();
    }

    private static final class WorkingState {
        private LocalDateTime time;
        private long elapsedMinutes;
        private String area;
        private String place;
        private String position;
        private final List<String> props;
        private final Map<String, MutableCharacter> characters = new LinkedHashMap<>();
        private final List<String> present;
        private final Map<String, MutableRelationship> relationships = new LinkedHashMap<>();
        private SceneState scene;
        private int currentChapter;
        private final TreeMap<Integer, ChapterState> chapters = new TreeMap<>();

        WorkingState(NarrativeState base) {
            time = base.time();
            elapsedMinutes = base.elapsedMinutes();
            area = base.location().area();
            place = base.location().place();
            position = base.location().position();
            props = new ArrayList<>(base.location().props());
            base.characters().forEach((name, state) -> characters.put(name, new MutableCharacter(state)));
            present = new ArrayList<>(base.charactersPresent());
            base.relationships().forEach((key, state) -> relationships.put(key, new MutableRelationship(state)));
            scene = base.scene();
            currentChapter = base.currentChapter();
            base.chapters().forEach(chapter -> chapters.put(chapter.index(), chapter));
        }

        void apply(NarrativeEvent event) {
            switch (event.type()) {
                case TIME_DELTA -> {
                    NarrativeEvent.TimeDelta delta = (NarrativeEvent.TimeDelta) event;
                    elapsedMinutes += delta.totalMinutes();
                    if (time != null) {
                        time = time.plusMinutes(delta.totalMinutes());
                    }
                }
                case LOCATION_MOVED -> {
                    NarrativeEvent.LocationMoved moved = (NarrativeEvent.LocationMoved) event;
                    boolean placeChanged = changes(area, moved.newArea()) || changes(place, moved.newPlace());
                    area = coalesce(moved.newArea(), area);
                    place = coalesce(moved.newPlace(), place);
                    position = coalesce(moved.newPosition(), position);
                    if (placeChanged) {
                        props.clear();
                    }
                }
                case LOCATION_PROP_ADDED -> addIgnoringCase(props, ((NarrativeEvent.PropAdded) event).prop());
                case LOCATION_PROP_REMOVED -> removeIgnoringCase(props, ((NarrativeEvent.PropRemoved) event).prop());
                case CHARACTER_APPEARED -> {
                    NarrativeEvent.CharacterAppeared appeared = (NarrativeEvent.CharacterAppeared) event;
                    MutableCharacter character = character(appeared.character());
                    character.position = coalesce(appeared.initialPosition(), character.position);
                    character.activity = coalesce(appeared.initialActivity(), character.activity);
                    appeared.initialMood().forEach(mood -> addIgnoringCase(character.mood, mood));
                    if (!present.contains(appeared.character())) {
                        present.add(appeared.character());
                    }
                }
                case CHARACTER_DEPARTED -> present.remove(((NarrativeEvent.CharacterDeparted) event).character());
                case CHARACTER_POSITION_CHANGED -> {
                    NarrativeEvent.PositionChanged changed = (NarrativeEvent.PositionChanged) event;
                    character(changed.character()).position = changed.newValue();
                }
                case CHARACTER_ACTIVITY_CHANGED -> {
                    NarrativeEvent.ActivityChanged changed = (NarrativeEvent.ActivityChanged) event;
                    character(changed.character()).activity = changed.newValue();
                }
                case CHARACTER_MOOD_ADDED -> {
                    NarrativeEvent.MoodAdded mood = (NarrativeEvent.MoodAdded) event;
                    addIgnoringCase(character(mood.character()).mood, mood.value());
                }
                case CHARACTER_MOOD_REMOVED -> {
                    NarrativeEvent.MoodRemoved mood = (NarrativeEvent.MoodRemoved) event;
                    removeIgnoringCase(character(mood.character()).mood, mood.value());
                }
                case CHARACTER_OUTFIT_CHANGED -> {
                    NarrativeEvent.OutfitChanged outfit = (NarrativeEvent.OutfitChanged) event;
                    MutableCharacter character = character(outfit.character());
                    if (outfit.newValue() == null) {
                        character.outfit.remove(outfit.slot());
                    } else {
                        character.outfit.put(outfit.slot(), outfit.newValue());
                    }
                }
                case CHARACTER_AKAS_ADD -> {
                    NarrativeEvent.AkasAdded akas = (NarrativeEvent.AkasAdded) event;
                    MutableCharacter character = character(akas.character());
                    for (String aka : akas.akas()) {
                        if (!aka.equalsIgnoreCase(character.name)) {
                            addIgnoringCase(character.akas, aka);
                        }
                    }
                }
                case RELATIONSHIP_STATUS_CHANGED -> {
                    NarrativeEvent.StatusChanged status = (NarrativeEvent.StatusChanged) event;
                    relationship(status.pair()).status = status.newStatus();
                }
                case RELATIONSHIP_SUBJECT -> {
                    NarrativeEvent.SubjectOccurred subject = (NarrativeEvent.SubjectOccurred) event;
                    addIgnoringCase(relationship(subject.pair()).subjects, subject.subject());
                }
                case RELATIONSHIP_FEELING_ADDED -> {
                    NarrativeEvent.FeelingAdded feeling = (NarrativeEvent.FeelingAdded) event;
                    MutableRelationship relationship =
                        relationship(CharacterPair.of(feeling.fromCharacter(), feeling.towardCharacter()));
                    addIgnoringCase(relationship.feelingsOf(feeling.fromCharacter()), feeling.value());
                }
                case RELATIONSHIP_FEELING_REMOVED -> {
                    NarrativeEvent.FeelingRemoved feeling = (NarrativeEvent.FeelingRemoved) event;
                    MutableRelationship relationship =
                        relationship(CharacterPair.of(feeling.fromCharacter(), feeling.towardCharacter()));
                    removeIgnoringCase(relationship.feelingsOf(feeling.fromCharacter()), feeling.value());
                }
                case SCENE_TENSION_CHANGED -> {
                    NarrativeEvent.TensionChanged tension = (NarrativeEvent.TensionChanged) event;
                    scene = scene.withTension(
                        new SceneState.Tension(tension.level(), tension.tensionType(), tension.direction()));
                }
                case CHAPTER_ENDED -> {
                    NarrativeEvent.ChapterEnded ended = (NarrativeEvent.ChapterEnded) event;
                    ChapterState chapter = chapters.getOrDefault(ended.chapterIndex(),
                        ChapterState.open(ended.chapterIndex()));
                    chapters.put(ended.chapterIndex(), new ChapterState(chapter.index(), chapter.title(),
                        chapter.summary(), ended.source().messageId(), ended.reason()));
                    currentChapter = Math.max(currentChapter, ended.chapterIndex() + 1);
                }
                case CHAPTER_DESCRIBED -> {
                    NarrativeEvent.ChapterDescribed described = (NarrativeEvent.ChapterDescribed) event;
                    ChapterState chapter = chapters.getOrDefault(described.chapterIndex(),
                        ChapterState.open(described.chapterIndex()));
                    chapters.put(described.chapterIndex(), new ChapterState(chapter.index(), described.title(),
                        described.summary(), chapter.endedAtMessage(), chapter.endReason()));
                }
            }
        }

        NarrativeState freeze() {
            Map<String, CharacterState> frozenCharacters = new LinkedHashMap<>();
            characters.forEach((name, character) -> frozenCharacters.put(name, character.freeze()));
            Map<String, RelationshipState> frozenRelationships = new LinkedHashMap<>();
            relationships.forEach((key, relationship) -> frozenRelationships.put(key, relationship.freeze()));
            return new NarrativeState(
                time,
                elapsedMinutes,
                new LocationState(area, place, position, props),
                frozenCharacters,
                present,
                frozenRelationships,
                scene,
                currentChapter,
                new ArrayList<>(chapters.values())
            );
        }

        private MutableCharacter character(String name) {
            return characters.computeIfAbsent(name, n -> new MutableCharacter(CharacterState.named(n)));
        }

        private MutableRelationship relationship(CharacterPair pair) {
            return relationships.computeIfAbsent(pair.key(), k -> new MutableRelationship(RelationshipState.of(pair)));
        }
    }

    private static final class MutableCharacter {
        private final String name;
        private String position;
        private String activity;
        private final List<String> mood;
        private final String physicalState;
        private final Map<OutfitSlot, String> outfit = new EnumMap<>(OutfitSlot.class);
        private final List<String> akas;

        MutableCharacter(CharacterState state) {
            name = state.name();
            position = state.position();
            activity = state.activity();
            mood = new ArrayList<>(state.mood());
            physicalState = state.physicalState();
            outfit.putAll(state.outfit());
            akas = new ArrayList<>(state.akas());
        }

        CharacterState freeze() {
            return new CharacterState(name, position, activity, mood, physicalState, outfit, akas);
        }
    }

    private static final class MutableRelationship {
        private final CharacterPair pair;
        private String status;
        private final List<String> subjects;
        private final Map<String, List<String>> feelings = new TreeMap<>();

        MutableRelationship(RelationshipState state) {
            pair = state.pair();
            status = state.status();
            subjects = new ArrayList<>(state.subjects());
            state.feelings().forEach((holder, values) -> feelings.put(holder, new ArrayList<>(values)));
        }

        List<String> feelingsOf(String holder) {
            return feelings.computeIfAbsent(holder, h -> new ArrayList<>());
        }

        RelationshipState freeze() {
            Map<String, List<String>> nonEmpty = new TreeMap<>();
            feelings.forEach((holder, values) -> {
                if (!values.isEmpty()) {
                    nonEmpty.put(holder, values);
                }
            });
            return new RelationshipState(pair, status, subjects, nonEmpty);
        }
    }

    private static boolean changes(String current, String next) {
        return next != null && !next.isBlank() && !next.equalsIgnoreCase(current);
    }

    private static String coalesce(String next, String current) {
        return next == null || next.isBlank() ? current : next;
    }

    private static void addIgnoringCase(List<String> values, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        boolean exists = values.stream().anyMatch(v -> v.toLowerCase(Locale.ROOT).equals(normalized));
        if (!exists) {
            values.add(value.trim());
        }
    }

    private static void removeIgnoringCase(List<String> values, String value) {
        if (value == null) {
            return;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        values.removeIf(v -> v.toLowerCase(Locale.ROOT).equals(normalized));
    }
}
