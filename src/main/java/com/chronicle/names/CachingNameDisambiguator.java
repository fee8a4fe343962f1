package com.chronicle.names;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers every answer, declines included, so the same name is never asked
 * twice within a session. Answers can also be registered up front.
 */
public class CachingNameDisambiguator implements NameDisambiguator {

    private final NameDisambiguator delegate;
    // lowercased surface name -> mapping; a null resolvedTo records a decline
    private final Map<String, UnresolvedNameMapping> answers = new ConcurrentHashMap<>();

    public CachingNameDisambiguator(NameDisambiguator delegate) {
        this.delegate = delegate;
    }

    /**
     * @throws IllegalArgumentException when the mapping has no name to map
     */
    public void register(UnresolvedNameMapping mapping) {
        if (mapping == null || mapping.unresolvedName() == null || mapping.unresolvedName().isBlank()) {
            throw new IllegalArgumentException("unresolvedName must not be blank");
        }
        answers.put(mapping.unresolvedName().toLowerCase(Locale.ROOT), mapping);
    }

    public Optional<UnresolvedNameMapping> known(String name) {
        return Optional.ofNullable(answers.get(name.toLowerCase(Locale.ROOT)));
    }

    public Map<String, UnresolvedNameMapping> answers() {
        return Map.copyOf(answers);
    }

    @Override
    public List<UnresolvedNameMapping> resolve(List<String> unresolvedNames, List<String> canonicalNames) {
        Map<String, UnresolvedNameMapping> result = new LinkedHashMap<>();
        List<String> unknown = new ArrayList<>();
        for (String name : unresolvedNames) {
            Optional<UnresolvedNameMapping> answer = known(name);
            if (answer.isPresent()) {
                result.put(name, new UnresolvedNameMapping(name, answer.get().resolvedTo()));
            } else {
                unknown.add(name);
            }
        }

        if (!unknown.isEmpty()) {
            List<UnresolvedNameMapping> asked = delegate.resolve(unknown, canonicalNames);
            for (String name : unknown) {
                UnresolvedNameMapping mapping = asked.stream()
                    .filter(m -> m != null && name.equalsIgnoreCase(m.unresolvedName()))
                    .findFirst()
                    .orElse(new UnresolvedNameMapping(name, null));
                register(mapping);
                result.put(name, new UnresolvedNameMapping(name, mapping.resolvedTo()));
            }
        }

        List<UnresolvedNameMapping> ordered = new ArrayList<>();
        for (String name : unresolvedNames) {
            ordered.add(result.get(name));
        }
        return ordered;
    }
}
