package com.github.lusitano.parser;

import java.util.List;
import java.util.Optional;

import com.github.lusitano.Tokenizer.Token;
import com.github.lusitano.Tokenizer.TokenType;

public record CompilationUnit(List<Statement> statements) {

    public record Position(int line, int column) {
        public static Position of(Token token) {
            return new Position(token.line(), token.column());
        }
    }

    public sealed interface Node {
        Position position();
    }

    public sealed interface Statement extends Node {}

    public record ExpressionStatement(Expression expression) implements Statement {
        @Override
        public Position position() {
            return expression.position();
        }
    }
    public record Block(List<Statement> statements, Position position) implements Statement {}
    public record IfStatement(Expression condition, Block thenBranch, Optional<Statement> elseBranch, Position position) implements Statement {}
    public record WhileStatement(Expression condition, Block body, Position position) implements Statement {}
    public record ForStatement(String variable, Expression from, Expression to, Optional<Expression> step, Block body, Position position) implements Statement {}
    public record ReturnStatement(Optional<Expression> value, Position position) implements Statement {}
    public record PrintStatement(List<Expression> arguments, Position position) implements Statement {}
    public record ReadStatement(Optional<Expression> prompt, VariableExpression target, Position position) implements Statement {}

    /** Stands in for a region the parser could not make sense of. */
    public record ErrorStatement(String message, Position position) implements Statement {}

    public record FunctionDeclaration(String name, List<Parameter> parameters, String returnType, Block body, Position position) implements Statement {}
    public record Parameter(String name, String type, Position position) {}

    public record VariableDeclaration(String name, String type, Optional<Expression> initializer, Position position) implements Statement {}
    public record ConstantDeclaration(String name, String type, Expression initializer, Position position) implements Statement {}

    public sealed interface Expression extends Node {}

    public record AssignmentExpression(VariableExpression target, Expression value, Position position) implements Expression {}
    public record BinaryExpression(Expression left, TokenType operator, Expression right, Position position) implements Expression {}
    public record UnaryExpression(TokenType operator, Expression operand, Position position) implements Expression {}
    public record FunctionEvaluationExpression(String name, List<Expression> arguments, Position position) implements Expression {}
    public record VariableExpression(String name, Position position) implements Expression {}

    public record IntegerExpression(long value, Position position) implements Expression {}
    public record RealExpression(double value, Position position) implements Expression {}
    public record StringExpression(String string, Position position) implements Expression {}
    public record BooleanExpression(boolean value, Position position) implements Expression {}

}
