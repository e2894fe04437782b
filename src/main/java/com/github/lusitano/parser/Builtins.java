package com.github.lusitano.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.lusitano.parser.Symbol.Category;
import com.github.lusitano.parser.Type.Builtin;
import com.github.lusitano.parser.Type.FunctionType;

/** Functions every program can call without declaring them. */
public final class Builtins {

    public static final Map<String, FunctionType> SIGNATURES = signatures();

    private Builtins() {}

    private static Map<String, FunctionType> signatures() {
        Map<String, FunctionType> m = new LinkedHashMap<>();
        m.put("tamanho", Type.function(Builtin.INTEIRO, List.of(Builtin.TEXTO)));
        m.put("raiz", Type.function(Builtin.REAL, List.of(Builtin.REAL)));
        m.put("absoluto", Type.function(Builtin.REAL, List.of(Builtin.REAL)));
        m.put("arredonda", Type.function(Builtin.INTEIRO, List.of(Builtin.REAL)));
        m.put("paraInteiro", Type.function(Builtin.INTEIRO, List.of(Builtin.ANY)));
        m.put("paraReal", Type.function(Builtin.REAL, List.of(Builtin.ANY)));
        m.put("paraTexto", Type.function(Builtin.TEXTO, List.of(Builtin.ANY)));
        return Collections.unmodifiableMap(m);
    }

    /** Declares all built-ins in the current scope of {@code scopes}, which must be the global scope. */
    static void declareAll(Scopes scopes) {
        if (scopes.current() != Scopes.GLOBAL) {
            throw new IllegalStateException("built-ins belong to the global scope");
        }
        SIGNATURES.forEach((name, type) -> scopes.declare(name, type, Category.BUILTIN, 0, 0));
    }
}
