package com.github.lusitano.parser;

import java.util.List;
import java.util.Optional;

import com.github.lusitano.Tokenizer.TokenType;
import com.github.lusitano.parser.CompilationUnit.Position;

/**
 * The typed mirror of {@link CompilationUnit}. Every expression knows its static type, which is
 * {@link Type.Builtin#ERROR} where type checking failed, and every name carries the symbol it
 * resolved to, if any.
 */
public record TCompilationUnit(List<TStatement> statements) {

    public sealed interface TStatement {}

    public record TExpressionStatement(TExpression expression) implements TStatement {}
    public record TBlock(List<TStatement> statements) implements TStatement {}
    public record TIfStatement(TExpression condition, TBlock thenBranch, Optional<TStatement> elseBranch) implements TStatement {}
    public record TWhileStatement(TExpression condition, TBlock body) implements TStatement {}
    public record TForStatement(Symbol variable, TExpression from, TExpression to, Optional<TExpression> step, TBlock body) implements TStatement {}
    /** {@code function} is empty for a return outside any function. */
    public record TReturnStatement(Optional<TExpression> value, Optional<Symbol> function) implements TStatement {}
    public record TPrintStatement(List<TExpression> arguments) implements TStatement {}
    public record TReadStatement(Optional<TExpression> prompt, TVariableExpression target) implements TStatement {}
    public record TErrorStatement(String message, Position position) implements TStatement {}

    public record TFunctionDeclaration(Symbol symbol, List<Symbol> parameters, TBlock body) implements TStatement {
        public Type returnType() {
            return ((Type.FunctionType) symbol.type()).returnType();
        }
    }
    public record TVariableDeclaration(Symbol symbol, Optional<TExpression> initializer) implements TStatement {}
    public record TConstantDeclaration(Symbol symbol, TExpression initializer) implements TStatement {}

    public sealed interface TExpression {
        Type type();
    }

    public record TAssignmentExpression(TVariableExpression target, TExpression value, Type type) implements TExpression {}
    public record TBinaryExpression(TExpression left, TokenType operator, TExpression right, Type type) implements TExpression {}
    public record TUnaryExpression(TokenType operator, TExpression operand, Type type) implements TExpression {}
    public record TFunctionEvaluationExpression(String name, Optional<Symbol> symbol, List<TExpression> arguments, Type type) implements TExpression {}
    public record TVariableExpression(String name, Optional<Symbol> symbol, Type type) implements TExpression {}

    public record TIntegerExpression(long value) implements TExpression {
        public Type type() { return Type.Builtin.INTEIRO; }
    }
    public record TRealExpression(double value) implements TExpression {
        public Type type() { return Type.Builtin.REAL; }
    }
    public record TStringExpression(String string) implements TExpression {
        public Type type() { return Type.Builtin.TEXTO; }
    }
    public record TBooleanExpression(boolean value) implements TExpression {
        public Type type() { return Type.Builtin.LOGICO; }
    }
}
