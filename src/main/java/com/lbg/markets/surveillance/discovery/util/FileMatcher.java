package com.lbg.markets.surveillance.discovery.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Filename filtering shared by the protocol adapters: a glob on the name
 * ({@code *} and {@code ?}, case-insensitive) plus an optional extension.
 */
public final class FileMatcher {

    private FileMatcher() {
        // Utility class
    }

    public static boolean matches(String filename, String namePattern, String extension) {
        return matchesGlob(filename, namePattern) && matchesExtension(filename, extension);
    }

    public static boolean matchesGlob(String filename, String pattern) {
        if (pattern == null || pattern.isEmpty() || "*".equals(pattern)) {
            return true;
        }
        return toRegex(pattern).matcher(filename).matches();
    }

    /**
     * Extension comparison ignores case and an optional leading dot.
     */
    public static boolean matchesExtension(String filename, String extension) {
        if (extension == null || extension.isBlank()) {
            return true;
        }
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        return filename.toLowerCase(Locale.ROOT).endsWith("." + ext.toLowerCase(Locale.ROOT));
    }

    public static boolean hasWildcards(String pattern) {
        return pattern != null && (pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0);
    }

    private static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }
}
