package com.github.lusitano;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.github.lusitano.diagnostics.Diagnostic;
import com.github.lusitano.diagnostics.Diagnostic.Phase;

/**
 * Outcome of compiling one program. {@code python} is present whenever code generation ran, which
 * includes programs with semantic errors. A program succeeded when no diagnostic is an error;
 * warnings are reported but do not fail it.
 */
public record CompilationResult(List<Diagnostic> diagnostics, Optional<String> python) {

    public CompilationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean succeeded() {
        return errors().isEmpty();
    }

    /** Diagnostics grouped by phase, phases in pipeline order, each group in report order. */
    public Map<Phase, List<Diagnostic>> byPhase() {
        return diagnostics.stream()
                .collect(Collectors.groupingBy(Diagnostic::phase, () -> new EnumMap<>(Phase.class), Collectors.toList()));
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream()
                .filter(Diagnostic::isError)
                .toList();
    }
}
