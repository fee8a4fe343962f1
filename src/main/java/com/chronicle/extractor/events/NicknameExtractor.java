package com.chronicle.extractor.events;

import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.AbstractLlmExtractor;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.GlobalExtractor;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.names.AkaComputation;
import com.chronicle.names.AkaLookup;
import com.chronicle.names.CharacterNameResolver;
import com.chronicle.prompt.JsonPromptTemplate;
import com.chronicle.prompt.JsonResponses;
import com.chronicle.prompt.Reasoned;
import com.chronicle.projection.CharacterState;
import com.chronicle.projection.NarrativeState;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects nicknames, pet names and cover identities that characters are
 * called by, so later events using them resolve to the right character.
 */
public class NicknameExtractor extends AbstractLlmExtractor implements GlobalExtractor {

    record Nicknames(String character, List<String> names) {
    }

    record NicknameResult(String reasoning, List<Nicknames> nicknames) implements Reasoned {
    }

    static final JsonPromptTemplate<NicknameResult> PROMPT = JsonPromptTemplate.of(
        "nickname_extraction",
        """
            You collect the names characters are called by in a roleplay: shortened names, pet names, \
            titles used as a name, aliases and cover identities. Attribute every name to the character it \
            refers to, not to the speaker. Ignore canonical names already listed and narrative descriptions \
            such as "the detective".

            Return strict JSON:
            {"reasoning": "short explanation", "nicknames": [{"character": "Name", "names": ["..."]}]}""",
        """
            Characters present: {{characters}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> {
            if (!json.has("nicknames")) {
                return null;
            }
            List<Nicknames> nicknames = new ArrayList<>();
            for (JsonNode item : JsonResponses.objects(json, "nicknames")) {
                String character = JsonResponses.text(item, "character");
                if (character != null) {
                    nicknames.add(new Nicknames(character, JsonResponses.strings(item, "names")));
                }
            }
            return new NicknameResult(JsonResponses.text(json, "reasoning"), nicknames);
        });

    public NicknameExtractor() {
        super("nicknameExtraction", "nicknames", TrackCategory.CHARACTERS, ExtractionPhase.CHARACTER_PRESENCE,
            RunStrategy.everyNMessages(8), MessageWindowStrategy.fixedNumber(8), 0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request) {
        NarrativeState state = request.currentState();
        if (state.charactersPresent().isEmpty()) {
            return List.of();
        }
        NicknameResult result = prompt(request, name(), PROMPT, baseValues(request, state)).orElse(null);
        if (result == null) {
            return List.of();
        }
        AkaLookup lookup = AkaLookup.fromCharacters(state.characters().values());
        List<String> allNames = new ArrayList<>(state.characters().keySet());

        Map<String, List<String>> newAkas = new LinkedHashMap<>();
        for (Nicknames nicknames : result.nicknames()) {
            String canonical = CharacterNameResolver.resolve(nicknames.character(), lookup).orElse(null);
            if (canonical == null) {
                continue;
            }
            List<String> known = state.character(canonical).map(CharacterState::akas).orElse(List.of());
            for (String aka : AkaComputation.computeAkas(canonical, null, nicknames.names(), allNames)) {
                List<String> pending = newAkas.computeIfAbsent(canonical, c -> new ArrayList<>());
                if (!containsIgnoreCase(known, aka) && !containsIgnoreCase(pending, aka)) {
                    pending.add(aka);
                }
            }
        }

        List<NarrativeEvent> events = new ArrayList<>();
        newAkas.forEach((character, akas) -> {
            if (!akas.isEmpty()) {
                events.add(new NarrativeEvent.AkasAdded(NarrativeEvent.newId(), request.currentMessage(),
                    request.timestamp(), character, akas));
            }
        });
        return events;
    }
}
