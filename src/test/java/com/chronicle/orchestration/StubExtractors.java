package com.chronicle.orchestration;

import com.chronicle.event.CharacterPair;
import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.BatchAttempt;
import com.chronicle.extractor.BatchCapable;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.GlobalExtractor;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.PerCharacterExtractor;
import com.chronicle.extractor.PerPairExtractor;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Extractors with scripted behavior for orchestration tests.
 */
final class StubExtractors {

    private StubExtractors() {
    }

    abstract static class Base {
        private final String name;
        private final ExtractionPhase phase;
        private final TrackCategory category;

        Base(String name, ExtractionPhase phase, TrackCategory category) {
            this.name = name;
            this.phase = phase;
            this.category = category;
        }

        public String name() {
            return name;
        }

        public String displayName() {
            return name;
        }

        public TrackCategory category() {
            return category;
        }

        public ExtractionPhase phase() {
            return phase;
        }

        public RunStrategy runStrategy() {
            return RunStrategy.everyMessage();
        }

        public MessageWindowStrategy messageStrategy() {
            return MessageWindowStrategy.fixedNumber(2);
        }

        public double defaultTemperature() {
            return 0.5;
        }
    }

    static final class Global extends Base implements GlobalExtractor {
        private final Function<ExtractionRequest, List<NarrativeEvent>> body;

        Global(String name, ExtractionPhase phase, Function<ExtractionRequest, List<NarrativeEvent>> body) {
            this(name, phase, TrackCategory.NARRATIVE, body);
        }

        Global(String name, ExtractionPhase phase, TrackCategory category,
               Function<ExtractionRequest, List<NarrativeEvent>> body) {
            super(name, phase, category);
            this.body = body;
        }

        @Override
        public List<NarrativeEvent> run(ExtractionRequest request) {
            return body.apply(request);
        }
    }

    static class PerCharacter extends Base implements PerCharacterExtractor {
        private final BiFunction<ExtractionRequest, String, List<NarrativeEvent>> body;

        PerCharacter(String name, BiFunction<ExtractionRequest, String, List<NarrativeEvent>> body) {
            super(name, ExtractionPhase.PER_CHARACTER, TrackCategory.CHARACTERS);
            this.body = body;
        }

        @Override
        public List<NarrativeEvent> run(ExtractionRequest request, String character) {
            return body.apply(request, character);
        }
    }

    static final class Batching extends PerCharacter implements BatchCapable {
        private final BiFunction<ExtractionRequest, List<String>, BatchAttempt> batch;

        Batching(String name,
                 BiFunction<ExtractionRequest, List<String>, BatchAttempt> batch,
                 BiFunction<ExtractionRequest, String, List<NarrativeEvent>> single) {
            super(name, single);
            this.batch = batch;
        }

        @Override
        public BatchAttempt runBatch(ExtractionRequest request, List<String> characters) {
            return batch.apply(request, characters);
        }
    }

    static final class PerPair extends Base implements PerPairExtractor {
        private final BiFunction<ExtractionRequest, CharacterPair, List<NarrativeEvent>> body;

        PerPair(String name, BiFunction<ExtractionRequest, CharacterPair, List<NarrativeEvent>> body) {
            super(name, ExtractionPhase.PER_PAIR, TrackCategory.RELATIONSHIPS);
            this.body = body;
        }

        @Override
        public List<NarrativeEvent> run(ExtractionRequest request, CharacterPair pair) {
            return body.apply(request, pair);
        }
    }
}
