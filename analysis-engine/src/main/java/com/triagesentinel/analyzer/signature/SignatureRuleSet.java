package com.triagesentinel.analyzer.signature;

import java.util.List;

/**
 * Rules compiled from a single source file.
 *
 * @param source file name the rules were loaded from
 * @param rules  compiled rules in declaration order
 */
public record SignatureRuleSet(String source, List<SignatureRule> rules) {

    public SignatureRuleSet {
        rules = List.copyOf(rules);
    }
}
