package com.triagesentinel.analyzer.signature;

import java.util.List;
import java.util.Set;

/**
 * Quantified condition: at least {@code required} of the listed strings must
 * match. An empty identifier list means "them", i.e. every string of the rule.
 *
 * <pre>
 * any of them     -> required = 1,  identifiers = []
 * all of them     -> required = -1, identifiers = []
 * 2 of them       -> required = 2,  identifiers = []
 * $a              -> required = 1,  identifiers = [$a]
 * $a and $b       -> required = 2,  identifiers = [$a, $b]
 * $a or $b        -> required = 1,  identifiers = [$a, $b]
 * </pre>
 *
 * @author Naveed Gung
 */
public record RuleCondition(int required, List<String> identifiers) {

    /** Marker for "all of the candidate strings". */
    public static final int ALL = -1;

    public boolean isSatisfied(List<String> allIdentifiers, Set<String> matched) {
        List<String> candidates = identifiers.isEmpty() ? allIdentifiers : identifiers;
        if (candidates.isEmpty()) {
            return false;
        }
        long hits = candidates.stream().filter(matched::contains).count();
        int needed = required == ALL ? candidates.size() : required;
        return hits >= needed;
    }
}
