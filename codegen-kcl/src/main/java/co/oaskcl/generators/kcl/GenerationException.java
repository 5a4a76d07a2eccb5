package co.oaskcl.generators.kcl;

import co.oaskcl.core.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/** Raised by {@link GenerationResult#orThrow()} with every error of the run. */
public class GenerationException extends RuntimeException {

    private final List<Diagnostic> errors;

    public GenerationException(List<Diagnostic> errors) {
        super(errors.size() + " generation error(s):\n"
            + errors.stream().map(Diagnostic::toString).collect(Collectors.joining("\n")));
        this.errors = List.copyOf(errors);
    }

    public List<Diagnostic> errors() {
        return errors;
    }
}
