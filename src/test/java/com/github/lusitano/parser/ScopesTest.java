package com.github.lusitano.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.lusitano.diagnostics.Diagnostic.Kind;
import com.github.lusitano.parser.SemanticException.DuplicateDeclarationException;
import com.github.lusitano.parser.SemanticException.UndeclaredIdentifierException;
import com.github.lusitano.parser.Symbol.Category;

public class ScopesTest {

    @Test
    void globalScopeHasDepthOne() {
        var scopes = new Scopes();

        assertEquals(1, scopes.depth());
        assertEquals(Scopes.GLOBAL, scopes.current());
    }

    @Test
    void enterAndExit() {
        var scopes = new Scopes();
        int inner = scopes.enter();
        scopes.enter();

        assertEquals(3, scopes.depth());
        scopes.exit();
        assertEquals(inner, scopes.current());
        scopes.exit();
        assertEquals(Scopes.GLOBAL, scopes.current());
    }

    @Test
    void exitingTheGlobalScopeFails() {
        assertThrows(IllegalStateException.class, () -> new Scopes().exit());
    }

    @Test
    void resolveSearchesEnclosingScopes() {
        var scopes = new Scopes();
        var x = scopes.declare("x", Type.Builtin.INTEIRO, Category.VARIABLE, 1, 5);
        scopes.enter();
        scopes.enter();

        assertEquals(x, scopes.resolve("x"));
        assertEquals(Scopes.GLOBAL, scopes.resolve("x").scope());
    }

    @Test
    void innerDeclarationShadowsOuter() {
        var scopes = new Scopes();
        var outer = scopes.declare("x", Type.Builtin.INTEIRO, Category.VARIABLE, 1, 5);
        scopes.enter();
        var inner = scopes.declare("x", Type.Builtin.TEXTO, Category.VARIABLE, 3, 9);

        assertEquals(inner, scopes.resolve("x"));
        assertEquals(Type.Builtin.TEXTO, scopes.resolve("x").type());
        scopes.exit();
        assertEquals(outer, scopes.resolve("x"));
    }

    @Test
    void duplicateInSameScope() {
        var scopes = new Scopes();
        scopes.declare("x", Type.Builtin.INTEIRO, Category.VARIABLE, 1, 5);

        var e = assertThrows(DuplicateDeclarationException.class,
                () -> scopes.declare("x", Type.Builtin.REAL, Category.CONSTANT, 2, 7));
        assertEquals(Kind.DUPLICATE_DECLARATION, e.kind());
        assertEquals(1, e.existing().line());
        assertEquals(2, e.rejected().line());
        assertEquals("'x' is already declared in this scope (line 1)", e.getMessage());
        assertEquals(Type.Builtin.INTEIRO, scopes.resolve("x").type());
    }

    @Test
    void undeclaredName() {
        var scopes = new Scopes();
        scopes.enter();
        scopes.declare("y", Type.Builtin.LOGICO, Category.VARIABLE, 1, 1);
        scopes.exit();

        var e = assertThrows(UndeclaredIdentifierException.class, () -> scopes.resolve("y"));
        assertEquals(Kind.UNDECLARED_IDENTIFIER, e.kind());
        assertEquals("y", e.name());
        assertTrue(scopes.lookup("y").isEmpty());
    }

    @Test
    void builtinsLiveInTheGlobalScope() {
        var scopes = new Scopes();
        Builtins.declareAll(scopes);

        var tamanho = scopes.resolve("tamanho");
        assertEquals(Category.BUILTIN, tamanho.category());
        var type = (Type.FunctionType) tamanho.type();
        assertEquals(Type.Builtin.INTEIRO, type.returnType());
        assertEquals(List.of(Type.Builtin.TEXTO), type.parameters());

        scopes.enter();
        assertThrows(IllegalStateException.class, () -> Builtins.declareAll(scopes));
    }
}
