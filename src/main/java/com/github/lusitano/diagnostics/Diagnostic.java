package com.github.lusitano.diagnostics;

import java.util.Optional;

/**
 * One problem found while compiling. Syntax errors additionally carry a description of the
 * token the parser expected and the token it found.
 */
public record Diagnostic(
        Kind kind,
        Severity severity,
        String message,
        int line,
        int column,
        Optional<String> expected,
        Optional<String> found) {

    public Diagnostic(Kind kind, String message, int line, int column) {
        this(kind, kind.defaultSeverity, message, line, column, Optional.empty(), Optional.empty());
    }

    public Phase phase() {
        return kind.phase;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder()
                .append(phase()).append(' ').append(severity)
                .append(" [").append(line).append(':').append(column).append("] ")
                .append(kind).append(": ").append(message);
        expected.ifPresent(e -> sb.append(" (expected ").append(e));
        found.ifPresent(f -> sb.append(expected.isPresent() ? ", found " : " (found ").append(f));
        if (expected.isPresent() || found.isPresent()) {
            sb.append(')');
        }
        return sb.toString();
    }

    public enum Phase {
        LEXICAL, SYNTAX, SEMANTIC
    }

    public enum Severity {
        ERROR, WARNING
    }

    public enum Kind {
        LEXICAL_ERROR(Phase.LEXICAL),
        SYNTAX_ERROR(Phase.SYNTAX),

        DUPLICATE_DECLARATION(Phase.SEMANTIC),
        UNDECLARED_IDENTIFIER(Phase.SEMANTIC),
        TYPE_MISMATCH(Phase.SEMANTIC),
        CONSTANT_REASSIGNMENT(Phase.SEMANTIC),
        RETURN_TYPE_MISMATCH(Phase.SEMANTIC),
        ARGUMENT_COUNT_MISMATCH(Phase.SEMANTIC),
        NOT_CALLABLE(Phase.SEMANTIC),
        RETURN_OUTSIDE_FUNCTION(Phase.SEMANTIC),
        MISSING_RETURN(Phase.SEMANTIC, Severity.WARNING);

        final Phase phase;
        final Severity defaultSeverity;

        private Kind(Phase phase) {
            this(phase, Severity.ERROR);
        }
        private Kind(Phase phase, Severity defaultSeverity) {
            this.phase = phase;
            this.defaultSeverity = defaultSeverity;
        }

        public Phase phase() {
            return phase;
        }
    }
}
