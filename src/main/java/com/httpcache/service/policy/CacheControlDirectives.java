package com.httpcache.service.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed {@code Cache-Control} header: directive names (lower-cased) to their
 * parameter, or null for bare directives.
 */
public final class CacheControlDirectives {

    /**
     * Largest delta-seconds value kept; larger values mean "as long as possible".
     */
    public static final long MAX_DELTA_SECONDS = 2_147_483_648L;

    private static final CacheControlDirectives EMPTY = new CacheControlDirectives(Collections.emptyMap());

    private final Map<String, String> directives;

    private CacheControlDirectives(Map<String, String> directives) {
        this.directives = directives;
    }

    /**
     * Parse a comma-separated list of cache control directives. Quoted
     * parameters are unquoted; a null or blank header yields no directives.
     */
    public static CacheControlDirectives parse(String value) {
        if (value == null || value.isBlank()) {
            return EMPTY;
        }

        Map<String, String> directives = new LinkedHashMap<>();
        int pos = 0;
        while (pos < value.length()) {
            int tokenStart = pos;
            pos = skipUntil(value, pos, "=,;");
            String directive = value.substring(tokenStart, pos).trim().toLowerCase(Locale.ROOT);

            if (pos == value.length() || value.charAt(pos) == ',' || value.charAt(pos) == ';') {
                pos++; // consume ',' or ';'
                if (!directive.isEmpty()) {
                    directives.putIfAbsent(directive, null);
                }
                continue;
            }

            pos++; // consume '='
            pos = skipWhitespace(value, pos);

            String parameter;
            if (pos < value.length() && value.charAt(pos) == '"') {
                pos++;
                int parameterStart = pos;
                pos = skipUntil(value, pos, "\"");
                if (pos == value.length()) {
                    throw new PolicyException("Unterminated quoted parameter in Cache-Control: " + value);
                }
                parameter = value.substring(parameterStart, pos);
                pos++; // consume closing quote
                pos = skipUntil(value, pos, ",;");
                pos++;
            } else {
                int parameterStart = pos;
                pos = skipUntil(value, pos, ",;");
                parameter = value.substring(parameterStart, pos).trim();
                pos++;
            }

            if (directive.isEmpty()) {
                throw new PolicyException("Parameter without directive in Cache-Control: " + value);
            }
            directives.putIfAbsent(directive, parameter);
        }
        return new CacheControlDirectives(directives);
    }

    public boolean has(String directive) {
        return directives.containsKey(directive);
    }

    /**
     * Delta-seconds value of a directive.
     *
     * @return the value, clamped to {@code [0, MAX_DELTA_SECONDS]}, or -1 if the directive is absent
     * @throws PolicyException if the directive is present without a numeric value
     */
    public long seconds(String directive) {
        if (!directives.containsKey(directive)) {
            return -1;
        }
        String parameter = directives.get(directive);
        if (parameter == null || parameter.isEmpty()) {
            throw new PolicyException("Directive " + directive + " requires a value");
        }
        return deltaSeconds(parameter, directive);
    }

    /**
     * Parse a delta-seconds value, clamped to {@code [0, MAX_DELTA_SECONDS]}.
     *
     * @param what header or directive name for the error message
     * @throws PolicyException if the value is not an integer
     */
    public static long deltaSeconds(String value, String what) {
        String trimmed = value.trim();
        try {
            return Math.max(0, Math.min(MAX_DELTA_SECONDS, Long.parseLong(trimmed)));
        } catch (NumberFormatException e) {
            if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
                // overflow: treat as "forever"
                return MAX_DELTA_SECONDS;
            }
            throw new PolicyException("Invalid delta-seconds for " + what + ": " + value, e);
        }
    }

    public boolean isEmpty() {
        return directives.isEmpty();
    }

    @Override
    public String toString() {
        return directives.toString();
    }

    private static int skipUntil(String input, int pos, String characters) {
        for (; pos < input.length(); pos++) {
            if (characters.indexOf(input.charAt(pos)) != -1) {
                break;
            }
        }
        return pos;
    }

    private static int skipWhitespace(String input, int pos) {
        for (; pos < input.length(); pos++) {
            char c = input.charAt(pos);
            if (c != ' ' && c != '\t') {
                break;
            }
        }
        return pos;
    }
}
