package br.edu.ifba.scholargraph.core;

import java.util.Locale;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;

/**
 * Name normalization used wherever entity identity is compared.
 *
 * <p>Two names denote the same entity if and only if their canonical forms are
 * equal. The canonical form is lowercase, keeps only letters, digits, hyphens
 * and single spaces, and has no leading or trailing whitespace. The function
 * is idempotent.</p>
 */
public final class Canonicalizer {

    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private Canonicalizer() {
    }

    /**
     * Computes the canonical form of a name.
     *
     * @param name raw name, as written by an author or returned by the extractor
     * @return canonical name, empty when no allowed character survives
     */
    @NotNull
    public static String normalize(@NotNull String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        // strip first so removed characters never leave a double space behind
        String stripped = DISALLOWED.matcher(lowered).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * @return true when both names canonicalize to the same non-empty form
     */
    public static boolean sameEntity(@NotNull String first, @NotNull String second) {
        String canonical = normalize(first);
        return !canonical.isEmpty() && canonical.equals(normalize(second));
    }
}
