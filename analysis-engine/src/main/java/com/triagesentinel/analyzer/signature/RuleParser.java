package com.triagesentinel.analyzer.signature;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Compiler for the supported subset of the YARA rule language.
 *
 * <pre>
 * [private|global] rule NAME [: TAG ...] {
 *     meta:
 *         key = "value" | 123 | true
 *     strings:
 *         $a = "text" [nocase] [ascii] [wide]
 *         $b = { 4D 5A ?? 00 4? }
 *     condition:
 *         any of them | all of them | N of them | N of ($a, $b)
 *         | $a | $a and $b ... | $a or $b ...
 * }
 * </pre>
 *
 * <p>
 * {@code import} statements are accepted and ignored. Regular expressions,
 * jumps, alternations, {@code include} and any other condition syntax are
 * rejected with a {@link RuleSyntaxException}.
 * </p>
 *
 * @author Naveed Gung
 */
public final class RuleParser {

    private enum Type {
        IDENT, NUMBER, STRING, VAR, HEX, PUNCT, EOF
    }

    private record Token(Type type, String text, int line) {
        boolean is(Type t, String value) {
            return type == t && text.equals(value);
        }
    }

    private final String origin;
    private final List<Token> tokens;
    private int pos;

    private RuleParser(String origin, List<Token> tokens) {
        this.origin = origin;
        this.tokens = tokens;
    }

    /**
     * Compile every rule in a source file.
     *
     * @param source rule text
     * @param origin file name used in error messages and match records
     */
    public static List<SignatureRule> parse(String source, String origin) throws RuleSyntaxException {
        RuleParser parser = new RuleParser(origin, new Lexer(source, origin).tokenize());
        return parser.rules();
    }

    private List<SignatureRule> rules() throws RuleSyntaxException {
        List<SignatureRule> rules = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        while (peek().type() != Type.EOF) {
            Token head = next();
            if (head.is(Type.IDENT, "import")) {
                expect(Type.STRING, "module name");
                continue;
            }
            if (head.is(Type.IDENT, "include")) {
                throw error(head, "include is not supported");
            }
            while (head.is(Type.IDENT, "private") || head.is(Type.IDENT, "global")) {
                head = next();
            }
            if (!head.is(Type.IDENT, "rule")) {
                throw error(head, "expected 'rule' but found '" + head.text() + "'");
            }
            SignatureRule rule = rule();
            if (!names.add(rule.name())) {
                throw error(head, "duplicate rule name " + rule.name());
            }
            rules.add(rule);
        }
        return rules;
    }

    private SignatureRule rule() throws RuleSyntaxException {
        String name = expect(Type.IDENT, "rule name").text();
        List<String> tags = new ArrayList<>();
        if (peek().is(Type.PUNCT, ":")) {
            next();
            while (peek().type() == Type.IDENT) {
                tags.add(next().text());
            }
        }
        expectPunct("{");

        Map<String, String> meta = new LinkedHashMap<>();
        List<RuleString> strings = new ArrayList<>();
        RuleCondition condition = null;

        while (!peek().is(Type.PUNCT, "}")) {
            Token section = expect(Type.IDENT, "section name");
            expectPunct(":");
            switch (section.text()) {
                case "meta" -> meta(meta);
                case "strings" -> strings(strings);
                case "condition" -> condition = condition(strings);
                default -> throw error(section, "unknown section '" + section.text() + "'");
            }
        }
        Token close = expectPunct("}");
        if (condition == null) {
            throw error(close, "rule " + name + " has no condition");
        }
        return new SignatureRule(name, List.copyOf(tags), Map.copyOf(meta), List.copyOf(strings), condition);
    }

    private void meta(Map<String, String> meta) throws RuleSyntaxException {
        while (peek().type() == Type.IDENT && peekAt(1).is(Type.PUNCT, "=")) {
            String key = next().text();
            next();
            Token value = next();
            if (value.type() != Type.STRING && value.type() != Type.NUMBER && value.type() != Type.IDENT) {
                throw error(value, "invalid meta value for " + key);
            }
            meta.put(key, value.text());
        }
    }

    private void strings(List<RuleString> strings) throws RuleSyntaxException {
        Set<String> seen = new LinkedHashSet<>();
        while (peek().type() == Type.VAR) {
            Token id = next();
            if (!seen.add(id.text())) {
                throw error(id, "duplicate string identifier " + id.text());
            }
            expectPunct("=");
            Token value = next();
            if (value.type() == Type.STRING) {
                boolean nocase = false;
                boolean ascii = false;
                boolean wide = false;
                while (peek().type() == Type.IDENT && isModifier(peek().text())) {
                    switch (next().text()) {
                        case "nocase" -> nocase = true;
                        case "ascii" -> ascii = true;
                        case "wide" -> wide = true;
                        default -> {
                            // fullword and private narrow nothing this matcher can express
                        }
                    }
                }
                if (value.text().isEmpty()) {
                    throw error(value, "empty string " + id.text());
                }
                strings.add(RuleString.text(id.text(), value.text(), nocase, ascii, wide));
            } else if (value.type() == Type.HEX) {
                strings.add(hexString(id, value));
            } else {
                throw error(value, "unsupported string value for " + id.text());
            }
        }
    }

    private static boolean isModifier(String text) {
        return switch (text) {
            case "nocase", "ascii", "wide", "fullword", "private" -> true;
            default -> false;
        };
    }

    private RuleString hexString(Token id, Token hex) throws RuleSyntaxException {
        String body = hex.text().replaceAll("\\s+", "");
        if (body.isEmpty() || body.length() % 2 != 0) {
            throw error(hex, "malformed hex string " + id.text());
        }
        byte[] bytes = new byte[body.length() / 2];
        byte[] mask = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            char hi = body.charAt(i * 2);
            char lo = body.charAt(i * 2 + 1);
            int value = 0;
            int m = 0;
            if (hi != '?') {
                value |= nibble(hi, hex) << 4;
                m |= 0xF0;
            }
            if (lo != '?') {
                value |= nibble(lo, hex);
                m |= 0x0F;
            }
            bytes[i] = (byte) value;
            mask[i] = (byte) m;
        }
        return RuleString.hex(id.text(), bytes, mask);
    }

    private int nibble(char c, Token at) throws RuleSyntaxException {
        int v = Character.digit(c, 16);
        if (v < 0) {
            throw error(at, "unsupported hex token '" + c + "' (jumps and alternatives are not supported)");
        }
        return v;
    }

    private RuleCondition condition(List<RuleString> strings) throws RuleSyntaxException {
        List<Token> expr = new ArrayList<>();
        while (!peek().is(Type.PUNCT, "}") && peek().type() != Type.EOF) {
            expr.add(next());
        }
        if (expr.isEmpty()) {
            throw error(peek(), "empty condition");
        }
        Set<String> defined = new LinkedHashSet<>();
        strings.forEach(s -> defined.add(s.identifier()));

        Token first = expr.get(0);
        if (expr.size() >= 3 && expr.get(1).is(Type.IDENT, "of")) {
            int required = quantifier(first);
            List<String> ids = ofTarget(expr.subList(2, expr.size()), defined);
            int candidates = ids.isEmpty() ? defined.size() : ids.size();
            if (required != RuleCondition.ALL && required > candidates) {
                throw error(first, "quantifier " + required + " exceeds " + candidates + " strings");
            }
            if (candidates == 0) {
                throw error(first, "condition refers to strings but the rule defines none");
            }
            return new RuleCondition(required, ids);
        }

        List<String> ids = new ArrayList<>();
        String joiner = null;
        for (int i = 0; i < expr.size(); i++) {
            Token t = expr.get(i);
            if (i % 2 == 0) {
                ids.add(reference(t, defined));
            } else {
                String op = t.text().toLowerCase(Locale.ROOT);
                if (t.type() != Type.IDENT || !(op.equals("and") || op.equals("or"))) {
                    throw error(t, "unsupported condition operator '" + t.text() + "'");
                }
                if (joiner != null && !joiner.equals(op)) {
                    throw error(t, "mixed and/or conditions are not supported");
                }
                joiner = op;
            }
        }
        if (expr.size() % 2 == 0) {
            throw error(expr.get(expr.size() - 1), "dangling operator in condition");
        }
        int required = "or".equals(joiner) ? 1 : ids.size();
        return new RuleCondition(required, List.copyOf(ids));
    }

    private int quantifier(Token t) throws RuleSyntaxException {
        if (t.is(Type.IDENT, "any")) {
            return 1;
        }
        if (t.is(Type.IDENT, "all")) {
            return RuleCondition.ALL;
        }
        if (t.type() == Type.NUMBER) {
            int n = Integer.parseInt(t.text());
            if (n < 1) {
                throw error(t, "quantifier must be at least 1");
            }
            return n;
        }
        throw error(t, "unsupported quantifier '" + t.text() + "'");
    }

    private List<String> ofTarget(List<Token> target, Set<String> defined) throws RuleSyntaxException {
        Token head = target.get(0);
        if (target.size() == 1 && head.is(Type.IDENT, "them")) {
            return List.of();
        }
        if (!head.is(Type.PUNCT, "(") || !target.get(target.size() - 1).is(Type.PUNCT, ")")) {
            throw error(head, "expected 'them' or a parenthesised string list");
        }
        List<String> ids = new ArrayList<>();
        List<Token> inner = target.subList(1, target.size() - 1);
        for (int i = 0; i < inner.size(); i++) {
            Token t = inner.get(i);
            if (i % 2 == 0) {
                ids.add(reference(t, defined));
            } else if (!t.is(Type.PUNCT, ",")) {
                throw error(t, "expected ',' in string list");
            }
        }
        if (ids.isEmpty() || inner.size() % 2 == 0) {
            throw error(head, "malformed string list");
        }
        return List.copyOf(ids);
    }

    private String reference(Token t, Set<String> defined) throws RuleSyntaxException {
        if (t.type() != Type.VAR) {
            throw error(t, "unsupported condition term '" + t.text() + "'");
        }
        if (!defined.contains(t.text())) {
            throw error(t, "undefined string identifier " + t.text());
        }
        return t.text();
    }

    private Token peek() {
        return peekAt(0);
    }

    private Token peekAt(int offset) {
        int i = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token next() {
        Token t = peek();
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return t;
    }

    private Token expect(Type type, String what) throws RuleSyntaxException {
        Token t = next();
        if (t.type() != type) {
            throw error(t, "expected " + what + " but found '" + t.text() + "'");
        }
        return t;
    }

    private Token expectPunct(String punct) throws RuleSyntaxException {
        Token t = next();
        if (!t.is(Type.PUNCT, punct)) {
            throw error(t, "expected '" + punct + "' but found '" + t.text() + "'");
        }
        return t;
    }

    private RuleSyntaxException error(Token at, String message) {
        return new RuleSyntaxException(origin, at.line(), message);
    }

    /** Character-level scanner. A '{' directly after '=' opens a hex string. */
    private static final class Lexer {

        private final String src;
        private final String origin;
        private int pos;
        private int line = 1;

        Lexer(String src, String origin) {
            this.src = src;
            this.origin = origin;
        }

        List<Token> tokenize() throws RuleSyntaxException {
            List<Token> out = new ArrayList<>();
            while (true) {
                skipTrivia();
                if (pos >= src.length()) {
                    out.add(new Token(Type.EOF, "<eof>", line));
                    return out;
                }
                char c = src.charAt(pos);
                Token previous = out.isEmpty() ? null : out.get(out.size() - 1);
                if (c == '{' && previous != null && previous.is(Type.PUNCT, "=")) {
                    out.add(hex());
                } else if (c == '"') {
                    out.add(string());
                } else if (c == '$') {
                    out.add(variable());
                } else if (Character.isDigit(c)) {
                    out.add(run(Type.NUMBER, Character::isDigit));
                } else if (Character.isLetter(c) || c == '_') {
                    out.add(run(Type.IDENT, ch -> Character.isLetterOrDigit(ch) || ch == '_'));
                } else if ("{}:=(),".indexOf(c) >= 0) {
                    out.add(new Token(Type.PUNCT, String.valueOf(c), line));
                    pos++;
                } else if (c == '/') {
                    throw new RuleSyntaxException(origin, line, "regular expressions are not supported");
                } else {
                    throw new RuleSyntaxException(origin, line, "unexpected character '" + c + "'");
                }
            }
        }

        private void skipTrivia() throws RuleSyntaxException {
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '\n') {
                    line++;
                    pos++;
                } else if (Character.isWhitespace(c)) {
                    pos++;
                } else if (src.startsWith("//", pos)) {
                    while (pos < src.length() && src.charAt(pos) != '\n') {
                        pos++;
                    }
                } else if (src.startsWith("/*", pos)) {
                    int end = src.indexOf("*/", pos + 2);
                    if (end < 0) {
                        throw new RuleSyntaxException(origin, line, "unterminated comment");
                    }
                    line += (int) src.substring(pos, end).chars().filter(ch -> ch == '\n').count();
                    pos = end + 2;
                } else {
                    return;
                }
            }
        }

        private Token run(Type type, java.util.function.IntPredicate accept) {
            int start = pos;
            while (pos < src.length() && accept.test(src.charAt(pos))) {
                pos++;
            }
            return new Token(type, src.substring(start, pos), line);
        }

        private Token variable() {
            int start = pos++;
            while (pos < src.length()
                    && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
            return new Token(Type.VAR, src.substring(start, pos), line);
        }

        private Token hex() throws RuleSyntaxException {
            int startLine = line;
            int end = src.indexOf('}', pos);
            if (end < 0) {
                throw new RuleSyntaxException(origin, line, "unterminated hex string");
            }
            String body = src.substring(pos + 1, end);
            line += (int) body.chars().filter(ch -> ch == '\n').count();
            pos = end + 1;
            return new Token(Type.HEX, body, startLine);
        }

        private Token string() throws RuleSyntaxException {
            int startLine = line;
            StringBuilder value = new StringBuilder();
            pos++;
            while (true) {
                if (pos >= src.length() || src.charAt(pos) == '\n') {
                    throw new RuleSyntaxException(origin, startLine, "unterminated string");
                }
                char c = src.charAt(pos++);
                if (c == '"') {
                    return new Token(Type.STRING, value.toString(), startLine);
                }
                if (c != '\\') {
                    value.append(c);
                    continue;
                }
                if (pos >= src.length()) {
                    throw new RuleSyntaxException(origin, startLine, "unterminated escape");
                }
                char e = src.charAt(pos++);
                switch (e) {
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case '"', '\\' -> value.append(e);
                    case 'x' -> {
                        if (pos + 2 > src.length()) {
                            throw new RuleSyntaxException(origin, startLine, "truncated \\x escape");
                        }
                        try {
                            value.append((char) Integer.parseInt(src.substring(pos, pos + 2), 16));
                        } catch (NumberFormatException ex) {
                            throw new RuleSyntaxException(origin, startLine, "invalid \\x escape");
                        }
                        pos += 2;
                    }
                    default -> throw new RuleSyntaxException(origin, startLine, "unknown escape \\" + e);
                }
            }
        }
    }
}
