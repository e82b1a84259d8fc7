package br.edu.ifba.storygraph.core;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic entity id derivation.
 *
 * <p>"Sarah O'Neil" and "sarah oneil" both map to {@code entity_sarah_oneil}, so repeated
 * mentions across scenes resolve to the same node.</p>
 */
public final class EntityIds {

    public static final String PREFIX = "entity_";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private EntityIds() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static String fromName(@NotNull String name) {
        return PREFIX + normalize(name);
    }

    /**
     * Lowercases, strips non-alphanumerics and collapses whitespace to underscores.
     */
    @NotNull
    public static String normalize(@NotNull String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        String stripped = NON_ALPHANUMERIC.matcher(lowered).replaceAll("");
        return WHITESPACE.matcher(stripped.trim()).replaceAll("_");
    }
}
