package co.oaskcl.generators.kcl.regex;

import co.oaskcl.generators.kcl.predicate.KclLiterals;

import java.util.List;

/**
 * Result of translating an ECMA pattern.
 *
 * @param source   the pattern as written in the schema
 * @param pattern  the equivalent in the generated code's regex dialect
 * @param warnings constructs that could not be carried over; empty when the translation is exact
 */
public record TranslatedPattern(String source, String pattern, List<String> warnings) {

    public TranslatedPattern {
        warnings = List.copyOf(warnings);
    }

    public boolean isLossy() {
        return !warnings.isEmpty();
    }

    /** The translated pattern escaped for a double-quoted KCL string, quotes included. */
    public String literal() {
        return KclLiterals.string(pattern);
    }
}
