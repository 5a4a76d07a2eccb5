package co.oaskcl.generators.kcl.format;

import java.util.Optional;
import java.util.Set;

/**
 * How one string {@code format} is validated in generated code.
 *
 * @param format      the JSON Schema format name
 * @param schemaName  name of the dedicated validator schema generated for the format
 * @param description one-line description used as the validator's docstring
 * @param pattern     the regex the format is checked against, or null when the predicate does not
 *                    reduce to one
 * @param template    predicate expression with a {@value #VALUE} placeholder
 * @param imports     KCL modules the predicate needs
 */
public record FormatTemplate(
    String format,
    String schemaName,
    String description,
    String pattern,
    String template,
    Set<String> imports
) {
    public static final String VALUE = "{value}";

    public FormatTemplate {
        imports = Set.copyOf(imports);
    }

    /** The predicate applied to {@code valueExpr}. */
    public String predicate(String valueExpr) {
        return template.replace(VALUE, valueExpr);
    }

    public Optional<String> regex() {
        return Optional.ofNullable(pattern);
    }
}
