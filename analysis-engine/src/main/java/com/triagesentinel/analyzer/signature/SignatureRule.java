package com.triagesentinel.analyzer.signature;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A compiled rule.
 *
 * @author Naveed Gung
 */
public record SignatureRule(
        String name,
        List<String> tags,
        Map<String, String> meta,
        List<RuleString> strings,
        RuleCondition condition) {

    /**
     * Evaluate the rule.
     *
     * @return identifiers of the strings that matched when the rule fires,
     *         otherwise an empty list
     */
    public List<String> evaluate(byte[] data, int length) {
        Set<String> matched = new LinkedHashSet<>();
        List<String> all = new ArrayList<>(strings.size());
        for (RuleString string : strings) {
            all.add(string.identifier());
            if (string.matches(data, length)) {
                matched.add(string.identifier());
            }
        }
        if (!condition.isSatisfied(all, matched)) {
            return List.of();
        }
        return List.copyOf(matched);
    }
}
