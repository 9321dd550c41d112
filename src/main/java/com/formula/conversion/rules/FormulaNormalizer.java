package com.formula.conversion.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Maps a formula to the canonical form used as its cache key.
 *
 * <p>Formulas that differ only in superficial spacing are considered equal:</p>
 * <ul>
 *   <li>an empty group {@code {}} becomes a single space</li>
 *   <li>tabs become spaces</li>
 *   <li>runs of spaces collapse to one space</li>
 *   <li>leading and trailing whitespace is removed</li>
 * </ul>
 *
 * <p>The mapping is idempotent: {@code normalize(normalize(f)).equals(normalize(f))}.</p>
 */
public final class FormulaNormalizer {

    static final String EMPTY_GROUP = "{}";

    private static final Pattern SPACE_RUN = Pattern.compile(" {2,}");

    private FormulaNormalizer() {
        // utility class
    }

    /**
     * Normalizes the given formula.
     *
     * @param formula the raw formula
     * @return the canonical form
     * @throws NullPointerException if formula is null
     */
    public static String normalize(String formula) {
        Objects.requireNonNull(formula, "formula is required");
        String result = formula.replace(EMPTY_GROUP, " ")
                .replace('\t', ' ');
        result = SPACE_RUN.matcher(result).replaceAll(" ");
        return result.strip();
    }

    /**
     * Checks whether two formulas share the same canonical form.
     */
    public static boolean areEquivalent(String formula1, String formula2) {
        return normalize(formula1).equals(normalize(formula2));
    }
}
