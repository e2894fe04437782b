package com.github.lusitano.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.lusitano.parser.SemanticException.DuplicateDeclarationException;
import com.github.lusitano.parser.SemanticException.UndeclaredIdentifierException;
import com.github.lusitano.parser.Symbol.Category;

/**
 * Lexical scopes of one analyzer run, kept in an arena and addressed by index. Scope
 * {@value #GLOBAL} is the global scope; every other scope points to its parent.
 */
public class Scopes {

    public static final int GLOBAL = 0;

    private final List<Scope> scopes = new ArrayList<>();
    private int current;

    public Scopes() {
        scopes.add(new Scope(-1, 1));
        current = GLOBAL;
    }

    public int enter() {
        scopes.add(new Scope(current, depth() + 1));
        current = scopes.size() - 1;
        return current;
    }

    public void exit() {
        if (current == GLOBAL) {
            throw new IllegalStateException("cannot exit the global scope");
        }
        current = scopes.get(current).parent;
    }

    /**
     * Declares {@code name} in the current scope and returns the new symbol.
     *
     * @throws DuplicateDeclarationException if the current scope already holds {@code name}
     */
    public Symbol declare(String name, Type type, Category category, int line, int column) {
        var symbol = new Symbol(name, type, category, current, line, column);
        var symbols = scopes.get(current).symbols;
        var existing = symbols.get(name);
        if (existing != null) {
            throw new DuplicateDeclarationException(existing, symbol);
        }
        symbols.put(name, symbol);
        return symbol;
    }

    /**
     * Finds the innermost visible declaration of {@code name}.
     *
     * @throws UndeclaredIdentifierException if no enclosing scope declares it
     */
    public Symbol resolve(String name) {
        return lookup(name).orElseThrow(() -> new UndeclaredIdentifierException(name));
    }

    public Optional<Symbol> lookup(String name) {
        int scope = current;
        while (scope >= 0) {
            var s = scopes.get(scope);
            var symbol = s.symbols.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
            scope = s.parent;
        }
        return Optional.empty();
    }

    /** Nesting depth of the current scope, 1 for the global scope. */
    public int depth() {
        return scopes.get(current).depth;
    }

    public int current() {
        return current;
    }

    private static class Scope {
        final int parent;
        final int depth;
        final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(int parent, int depth) {
            this.parent = parent;
            this.depth = depth;
        }
    }
}
