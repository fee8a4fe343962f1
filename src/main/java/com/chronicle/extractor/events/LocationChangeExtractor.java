package com.chronicle.extractor.events;

import com.chronicle.event.NarrativeEvent;
import com.chronicle.extractor.AbstractLlmExtractor;
import com.chronicle.extractor.ExtractionPhase;
import com.chronicle.extractor.ExtractionRequest;
import com.chronicle.extractor.GlobalExtractor;
import com.chronicle.extractor.MessageWindowStrategy;
import com.chronicle.extractor.RunStrategy;
import com.chronicle.extractor.TrackCategory;
import com.chronicle.prompt.JsonPromptTemplate;
import com.chronicle.prompt.JsonResponses;
import com.chronicle.prompt.Reasoned;
import com.chronicle.projection.LocationState;
import com.chronicle.projection.NarrativeState;

import java.util.List;

/**
 * Detects the scene moving to another area, place or position.
 */
public class LocationChangeExtractor extends AbstractLlmExtractor implements GlobalExtractor {

    record LocationChange(String reasoning, boolean changed, String area, String place, String position)
        implements Reasoned {
    }

    static final JsonPromptTemplate<LocationChange> PROMPT = JsonPromptTemplate.of(
        "location_change",
        """
            You track where a roleplay scene takes place. A location has three levels: area (city or \
            region), place (building or site) and position (spot within the place). Decide whether the \
            latest messages move the scene. Leave a level null when it does not change.

            Return strict JSON:
            {"reasoning": "short explanation", "changed": true/false, "newArea": null, "newPlace": null, "newPosition": null}""",
        """
            Current location: {{location}}

            Messages:
            {{messages}}

            Return JSON only.""",
        0.5,
        json -> json.has("changed")
            ? new LocationChange(JsonResponses.text(json, "reasoning"), JsonResponses.bool(json, "changed", false),
                JsonResponses.text(json, "newArea"), JsonResponses.text(json, "newPlace"),
                JsonResponses.text(json, "newPosition"))
            : null);

    public LocationChangeExtractor() {
        super("locationChange", "location", TrackCategory.LOCATION, ExtractionPhase.CORE,
            RunStrategy.everyMessage(), MessageWindowStrategy.fixedNumber(2), 0.5);
    }

    @Override
    public List<NarrativeEvent> run(ExtractionRequest request) {
        NarrativeState state = request.currentState();
        LocationChange change = prompt(request, name(), PROMPT, baseValues(request, state)).orElse(null);
        if (change == null || !change.changed()) {
            return List.of();
        }
        LocationState current = state.location();
        String area = differing(change.area(), current.area());
        String place = differing(change.place(), current.place());
        String position = differing(change.position(), current.position());
        if (area == null && place == null && position == null) {
            return List.of();
        }
        return List.of(new NarrativeEvent.LocationMoved(NarrativeEvent.newId(), request.currentMessage(),
            request.timestamp(), area, place, position));
    }

    private static String differing(String next, String current) {
        return next == null || next.equalsIgnoreCase(current) ? null : next;
    }
}
