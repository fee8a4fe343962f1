package com.chronicle.names;

import java.util.List;

/**
 * Asks someone (a user, a rule set) which canonical character each
 * unresolved name refers to.
 */
public interface NameDisambiguator {

    List<UnresolvedNameMapping> resolve(List<String> unresolvedNames, List<String> canonicalNames);
}
