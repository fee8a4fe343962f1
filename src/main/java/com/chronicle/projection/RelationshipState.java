package com.chronicle.projection;

import com.chronicle.event.CharacterPair;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * State of one unordered pair. {@code feelings} is keyed by the member who
 * holds the feelings (toward the other member).
 */
public record RelationshipState(CharacterPair pair,
                                String status,
                                List<String> subjects,
                                Map<String, List<String>> feelings) {

    public RelationshipState {
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
        if (feelings == null || feelings.isEmpty()) {
            feelings = Map.of();
        } else {
            Map<String, List<String>> copy = new TreeMap<>();
            feelings.forEach((holder, values) -> copy.put(holder, List.copyOf(values)));
            feelings = Collections.unmodifiableMap(copy);
        }
    }

    public static RelationshipState of(CharacterPair pair) {
        return new RelationshipState(pair, null, List.of(), Map.of());
    }

    public List<String> feelingsOf(String holder) {
        return feelings.getOrDefault(holder, List.of());
    }
}
