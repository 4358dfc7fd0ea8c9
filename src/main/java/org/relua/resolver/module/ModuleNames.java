package org.relua.resolver.module;

import java.util.regex.Pattern;

/**
 * Syntax of logical module identifiers ({@code luci.controller.api.xqnetwork}).
 */
public final class ModuleNames {

    /** Segment separator inside a logical identifier. */
    public static final char SEPARATOR = '.';

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_-]+(?:\\.[A-Za-z0-9_-]+)*");

    private ModuleNames() {}

    /**
     * Checks whether the given text is a statically usable module identifier.
     * Empty segments, path separators and {@code ..} never match.
     */
    public static boolean isValid(String identifier) {
        return identifier != null && IDENTIFIER.matcher(identifier).matches();
    }

    /**
     * Splits a valid identifier into its path segments.
     *
     * @throws IllegalArgumentException if the identifier is not valid.
     */
    public static String[] segments(String identifier) {
        if (!isValid(identifier)) {
            throw new IllegalArgumentException("Not a module identifier: " + identifier);
        }
        return identifier.split("\\.");
    }
}
