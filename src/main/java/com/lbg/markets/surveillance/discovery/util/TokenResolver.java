package com.lbg.markets.surveillance.discovery.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands date placeholders in path and filename templates.
 * Supported tokens (case-insensitive): {yyyy}, {yy}, {mm}, {dd}.
 * Anything else, including unknown placeholders, is copied through as literal text.
 */
public final class TokenResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]*)}");

    private TokenResolver() {
        // Utility class
    }

    public static String resolve(String pattern, Instant at) {
        return resolve(pattern, at, ZoneOffset.UTC);
    }

    public static String resolve(String pattern, Instant at, ZoneId zone) {
        if (pattern == null || pattern.isEmpty()) {
            return pattern;
        }
        return resolve(pattern, LocalDate.ofInstant(at, zone));
    }

    public static String resolve(String pattern, LocalDate date) {
        if (pattern == null || pattern.isEmpty()) {
            return pattern;
        }
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        StringBuilder out = new StringBuilder(pattern.length());
        while (matcher.find()) {
            String value = valueFor(matcher.group(1), date);
            String replacement = value != null ? value : matcher.group(0);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public static boolean containsTokens(String pattern) {
        if (pattern == null) {
            return false;
        }
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        while (matcher.find()) {
            if (isKnown(matcher.group(1))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Placeholders in braces that are not supported date tokens, e.g. {hh}.
     */
    public static List<String> unknownTokens(String pattern) {
        List<String> unknown = new ArrayList<>();
        if (pattern == null) {
            return unknown;
        }
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        while (matcher.find()) {
            if (!isKnown(matcher.group(1))) {
                unknown.add(matcher.group(0));
            }
        }
        return unknown;
    }

    private static boolean isKnown(String token) {
        return valueFor(token, LocalDate.EPOCH) != null;
    }

    private static String valueFor(String token, LocalDate date) {
        switch (token.toLowerCase(Locale.ROOT)) {
            case "yyyy":
                return String.format("%04d", date.getYear());
            case "yy":
                return String.format("%02d", date.getYear() % 100);
            case "mm":
                return String.format("%02d", date.getMonthValue());
            case "dd":
                return String.format("%02d", date.getDayOfMonth());
            default:
                return null;
        }
    }
}
