package com.triagesentinel.analyzer.signature;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Locale;

/**
 * One rule that fired against a file.
 *
 * @param ruleName       rule identifier
 * @param severity       HIGH when the rule name mentions malware, otherwise
 *                       MEDIUM
 * @param matchedStrings identifiers of the strings that matched
 * @param sourceRule     file the rule was loaded from
 *
 * @author Naveed Gung
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SignatureMatch(
        String ruleName,
        Severity severity,
        List<String> matchedStrings,
        String sourceRule) {

    public enum Severity {
        HIGH, MEDIUM
    }

    public static SignatureMatch of(SignatureRule rule, String sourceRule, List<String> matchedStrings) {
        return new SignatureMatch(rule.name(), severityFor(rule.name()), List.copyOf(matchedStrings), sourceRule);
    }

    static Severity severityFor(String ruleName) {
        return ruleName.toLowerCase(Locale.ROOT).contains("malware") ? Severity.HIGH : Severity.MEDIUM;
    }
}
