package co.oaskcl.generators.kcl;

import co.oaskcl.core.Diagnostic;

import java.util.List;
import java.util.Optional;

/** Artifacts of one generation run plus everything it reported. */
public record GenerationResult(List<GeneratedArtifact> artifacts, List<Diagnostic> diagnostics) {

    public GenerationResult {
        artifacts = List.copyOf(artifacts);
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<GeneratedArtifact> artifact(String name) {
        return artifacts.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    public List<String> names() {
        return artifacts.stream().map(GeneratedArtifact::name).toList();
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /** This result, or a {@link GenerationException} when any error was collected. */
    public GenerationResult orThrow() {
        if (hasErrors()) throw new GenerationException(errors());
        return this;
    }
}
