package com.github.dominikschlosser.federation.dynamicgroup;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses dynamic group matching rules.
 *
 * <pre>
 * rule    := group | clause
 * group   := ("ALL" | "ANY") "{" rule ("," rule)* "}"
 * clause  := attribute ("=" | "==") value
 *          | attribute "in" "(" value ("," value)* ")"
 * value   := 'quoted string' | token
 * </pre>
 *
 * <p>Examples: {@code compartment == clinical-dev},
 * {@code ANY {compartment = 'clinical-dev', compartment in (clinical-test, clinical-qa)}}.
 * Keywords are case-insensitive; attribute names and values are not. Groups nest at most
 * {@value #MAX_DEPTH} levels deep.
 */
public final class MatchingRuleParser {

    public static final int MAX_DEPTH = 16;

    private final String input;
    private int pos;
    private int depth;

    private MatchingRuleParser(String input) {
        this.input = input;
    }

    /**
     * @throws IllegalArgumentException with the offending position if the rule is malformed
     */
    public static MatchingRule parse(String rule) {
        if (rule == null || rule.isBlank()) {
            throw new IllegalArgumentException("Matching rule is empty");
        }
        MatchingRuleParser parser = new MatchingRuleParser(rule);
        MatchingRule result = parser.parseRule();
        parser.skipWhitespace();
        if (parser.pos < rule.length()) {
            throw parser.error("unexpected trailing input");
        }
        return result;
    }

    private MatchingRule parseRule() {
        skipWhitespace();
        int start = pos;
        String word = readToken();
        String keyword = word.toUpperCase(Locale.ROOT);
        skipWhitespace();
        if ((keyword.equals("ALL") || keyword.equals("ANY")) && peek() == '{') {
            if (depth == MAX_DEPTH) {
                pos = start;
                throw error("groups nested deeper than " + MAX_DEPTH + " levels");
            }
            pos++;
            depth++;
            List<MatchingRule> rules = new ArrayList<>();
            rules.add(parseRule());
            skipWhitespace();
            while (peek() == ',') {
                pos++;
                rules.add(parseRule());
                skipWhitespace();
            }
            expect('}');
            depth--;
            return keyword.equals("ALL") ? MatchingRules.all(rules) : MatchingRules.any(rules);
        }
        if (word.isEmpty()) {
            pos = start;
            throw error("expected attribute name");
        }
        return parseClause(word);
    }

    private MatchingRule parseClause(String attribute) {
        skipWhitespace();
        if (peek() == '=') {
            pos++;
            if (peek() == '=') {
                pos++;
            }
            return MatchingRules.equalTo(attribute, readValue());
        }
        int start = pos;
        String operator = readToken();
        if (!operator.equalsIgnoreCase("in")) {
            pos = start;
            throw error("expected '=', '==' or 'in' after attribute '" + attribute + "'");
        }
        skipWhitespace();
        expect('(');
        Set<String> values = new LinkedHashSet<>();
        values.add(readValue());
        skipWhitespace();
        while (peek() == ',') {
            pos++;
            values.add(readValue());
            skipWhitespace();
        }
        expect(')');
        return MatchingRules.in(attribute, values);
    }

    private String readValue() {
        skipWhitespace();
        if (peek() == '\'') {
            int end = input.indexOf('\'', pos + 1);
            if (end < 0) {
                throw error("unterminated quoted value");
            }
            String value = input.substring(pos + 1, end);
            pos = end + 1;
            return value;
        }
        String token = readToken();
        if (token.isEmpty()) {
            throw error("expected value");
        }
        return token;
    }

    private String readToken() {
        int start = pos;
        while (pos < input.length() && isTokenChar(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private void expect(char c) {
        skipWhitespace();
        if (peek() != c) {
            throw error("expected '" + c + "'");
        }
        pos++;
    }

    private char peek() {
        return pos < input.length() ? input.charAt(pos) : 0;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isTokenChar(char c) {
        return Character.isLetterOrDigit(c) || c == '.' || c == '_' || c == '-' || c == ':' || c == '/' || c == '@';
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(
                "Invalid matching rule at position " + pos + ": " + message + " in \"" + input + "\"");
    }
}
