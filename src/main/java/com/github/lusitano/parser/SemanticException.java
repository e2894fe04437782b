package com.github.lusitano.parser;

import com.github.lusitano.diagnostics.Diagnostic.Kind;

import lombok.Getter;
import lombok.experimental.Accessors;

/** A scope manager failure that the analyzer turns into a diagnostic of {@link #kind()}. */
@Getter
@Accessors(fluent = true)
public abstract class SemanticException extends RuntimeException {

    private final Kind kind;

    protected SemanticException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    @Getter
    @Accessors(fluent = true)
    public static class DuplicateDeclarationException extends SemanticException {
        private final Symbol existing;
        private final Symbol rejected;

        public DuplicateDeclarationException(Symbol existing, Symbol rejected) {
            super(Kind.DUPLICATE_DECLARATION, "'" + rejected.name() + "' is already declared in this scope (line "
                    + existing.line() + ")");
            this.existing = existing;
            this.rejected = rejected;
        }
    }

    @Getter
    @Accessors(fluent = true)
    public static class UndeclaredIdentifierException extends SemanticException {
        private final String name;

        public UndeclaredIdentifierException(String name) {
            super(Kind.UNDECLARED_IDENTIFIER, "'" + name + "' is not declared");
            this.name = name;
        }
    }
}
