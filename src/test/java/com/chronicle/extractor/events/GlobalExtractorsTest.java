package com.chronicle.extractor.events;

import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.ErrorKind;
import com.chronicle.projection.NarrativeState;
import com.chronicle.projection.ProjectionReducer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExtractorsTest {

    @Nested
    @DisplayName("Time")
    class Time {

        private final ExtractorFixture fixture = new ExtractorFixture(NarrativeState.EMPTY);
        private final TimeChangeExtractor extractor = new TimeChangeExtractor();

        @Test
        void elapsedTime_becomesDelta() {
            fixture.respond("{\"changed\": true, \"delta\": {\"days\": 0, \"hours\": 2, \"minutes\": 15}}");

            List<NarrativeEvent> events = extractor.run(fixture.request(3));

            assertEquals(1, events.size());
            NarrativeEvent.TimeDelta delta = (NarrativeEvent.TimeDelta) events.get(0);
            assertEquals(135L, delta.totalMinutes());
        }

        @Test
        void unchangedOrZero_noEvent() {
            fixture.respond("{\"changed\": true, \"delta\": {\"days\": 0, \"hours\": 0, \"minutes\": 0}}");
            assertTrue(extractor.run(fixture.request(3)).isEmpty());

            fixture.respond("{\"changed\": false, \"delta\": {\"minutes\": 20}}");
            assertTrue(extractor.run(fixture.request(4)).isEmpty());
        }

        @Test
        void negativeDelta_isParseFailure() {
            fixture.respond("{\"changed\": true, \"delta\": {\"hours\": -3}}");

            assertTrue(extractor.run(fixture.request(3)).isEmpty());
            assertEquals(ErrorKind.PARSE_FAILURE, fixture.diagnostics.errors().get(0).kind());
            assertEquals("timeChange", fixture.diagnostics.errors().get(0).extractor());
        }
    }

    @Nested
    @DisplayName("Presence")
    class Presence {

        private final ExtractorFixture fixture = ExtractorFixture.withEvents(
            ExtractorFixture.appeared("Luna"), ExtractorFixture.appeared("Bob"));
        private final PresenceChangeExtractor extractor = new PresenceChangeExtractor();

        @Test
        void newArrival_withFullName_getsAkas() {
            fixture.respond("""
                {"appeared": [{"character": "Elena", "fullName": "Elena Vance", "position": "at the door",
                               "mood": ["wary"]}],
                 "departed": []}""");

            List<NarrativeEvent> events = extractor.run(fixture.request(3));

            assertEquals(2, events.size());
            NarrativeEvent.CharacterAppeared appeared = (NarrativeEvent.CharacterAppeared) events.get(0);
            assertEquals("Elena", appeared.character());
            assertEquals("at the door", appeared.initialPosition());
            assertEquals(List.of("wary"), appeared.initialMood());
            NarrativeEvent.AkasAdded akas = (NarrativeEvent.AkasAdded) events.get(1);
            assertEquals(List.of("Elena Vance", "Vance"), akas.akas());
        }

        @Test
        void presentOrRepeatedArrivals_areSkipped() {
            fixture.respond("""
                {"appeared": [{"character": "luna"}, {"character": "Mira"}, {"character": "MIRA"}],
                 "departed": []}""");

            List<NarrativeEvent> events = extractor.run(fixture.request(3));

            assertEquals(1, events.size());
            assertEquals("Mira", ((NarrativeEvent.CharacterAppeared) events.get(0)).character());
        }

        @Test
        void departures_useStoredNames_andIgnoreAbsentCharacters() {
            fixture.respond("{\"appeared\": [], \"departed\": [\"bob\", \"Ghost\"]}");

            List<NarrativeEvent> events = extractor.run(fixture.request(3));

            assertEquals(1, events.size());
            assertEquals("Bob", ((NarrativeEvent.CharacterDeparted) events.get(0)).character());
        }
    }

    @Nested
    @DisplayName("Tension")
    class Tension {

        private final TensionChangeExtractor extractor = new TensionChangeExtractor();

        @Test
        void newTension_isRecorded_inLowerCase() {
            ExtractorFixture fixture = new ExtractorFixture(NarrativeState.EMPTY);
            fixture.respond("{\"level\": \"Tense\", \"type\": \"Confrontation\", \"direction\": \"escalating\"}");

            List<NarrativeEvent> events = extractor.run(fixture.request(3));

            NarrativeEvent.TensionChanged changed = (NarrativeEvent.TensionChanged) events.get(0);
            assertEquals("tense", changed.level());
            assertEquals("confrontation", changed.tensionType());
            assertEquals("escalating", changed.direction());
        }

        @Test
        void sameTension_noEvent() {
            NarrativeState tense = ProjectionReducer.apply(NarrativeState.EMPTY, List.of(
                new NarrativeEvent.TensionChanged(NarrativeEvent.newId(), ExtractorFixture.SETUP, 0L,
                    "tense", "confrontation", "stable")));
            ExtractorFixture fixture = new ExtractorFixture(tense);
            fixture.respond("{\"level\": \"tense\", \"type\": \"confrontation\", \"direction\": \"stable\"}");

            assertTrue(extractor.run(fixture.request(3)).isEmpty());
        }

        @Test
        void unknownLevel_isParseFailure() {
            ExtractorFixture fixture = new ExtractorFixture(NarrativeState.EMPTY);
            fixture.respond("{\"level\": \"spicy\", \"type\": \"romantic\", \"direction\": \"stable\"}");

            assertTrue(extractor.run(fixture.request(3)).isEmpty());
            assertEquals("tensionChange", fixture.diagnostics.errors().get(0).extractor());
        }
    }
}
