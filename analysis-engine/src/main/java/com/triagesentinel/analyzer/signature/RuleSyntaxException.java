package com.triagesentinel.analyzer.signature;

/**
 * A rule file that cannot be compiled. The loader skips the whole file.
 *
 * @author Naveed Gung
 */
public class RuleSyntaxException extends Exception {

    private final String origin;
    private final int line;

    public RuleSyntaxException(String origin, int line, String message) {
        super(origin + ":" + line + ": " + message);
        this.origin = origin;
        this.line = line;
    }

    public String getOrigin() {
        return origin;
    }

    public int getLine() {
        return line;
    }
}
