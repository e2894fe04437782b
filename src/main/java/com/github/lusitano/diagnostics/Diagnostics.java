package com.github.lusitano.diagnostics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.lusitano.diagnostics.Diagnostic.Kind;
import com.github.lusitano.diagnostics.Diagnostic.Phase;
import com.github.lusitano.diagnostics.Diagnostic.Severity;

/**
 * Collects the diagnostics of one compilation in the order they were reported. Every phase
 * writes into the same collector so the driver can look at them per phase afterwards.
 */
public class Diagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        LOG.trace("reported {}", diagnostic);
        diagnostics.add(diagnostic);
    }

    public void report(Kind kind, String message, int line, int column) {
        report(new Diagnostic(kind, message, line, column));
    }

    public void reportSyntaxError(String message, String expected, String found, int line, int column) {
        report(new Diagnostic(Kind.SYNTAX_ERROR, Severity.ERROR, message, line, column,
                Optional.of(expected), Optional.of(found)));
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasErrors(Phase... phases) {
        var wanted = Arrays.asList(phases);
        return diagnostics.stream()
                .anyMatch(d -> d.isError() && wanted.contains(d.phase()));
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int size() {
        return diagnostics.size();
    }
}
