package com.github.lusitano.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.lusitano.SyntaxErrorException;
import com.github.lusitano.Tokenizer.Token;
import com.github.lusitano.Tokenizer.TokenType;
import com.github.lusitano.Tokenizer.Tokens;
import com.github.lusitano.diagnostics.Diagnostics;
import com.github.lusitano.parser.CompilationUnit.AssignmentExpression;
import com.github.lusitano.parser.CompilationUnit.BinaryExpression;
import com.github.lusitano.parser.CompilationUnit.Block;
import com.github.lusitano.parser.CompilationUnit.BooleanExpression;
import com.github.lusitano.parser.CompilationUnit.ConstantDeclaration;
import com.github.lusitano.parser.CompilationUnit.ErrorStatement;
import com.github.lusitano.parser.CompilationUnit.Expression;
import com.github.lusitano.parser.CompilationUnit.ExpressionStatement;
import com.github.lusitano.parser.CompilationUnit.ForStatement;
import com.github.lusitano.parser.CompilationUnit.FunctionDeclaration;
import com.github.lusitano.parser.CompilationUnit.FunctionEvaluationExpression;
import com.github.lusitano.parser.CompilationUnit.IfStatement;
import com.github.lusitano.parser.CompilationUnit.IntegerExpression;
import com.github.lusitano.parser.CompilationUnit.Parameter;
import com.github.lusitano.parser.CompilationUnit.Position;
import com.github.lusitano.parser.CompilationUnit.PrintStatement;
import com.github.lusitano.parser.CompilationUnit.ReadStatement;
import com.github.lusitano.parser.CompilationUnit.RealExpression;
import com.github.lusitano.parser.CompilationUnit.ReturnStatement;
import com.github.lusitano.parser.CompilationUnit.Statement;
import com.github.lusitano.parser.CompilationUnit.StringExpression;
import com.github.lusitano.parser.CompilationUnit.UnaryExpression;
import com.github.lusitano.parser.CompilationUnit.VariableDeclaration;
import com.github.lusitano.parser.CompilationUnit.VariableExpression;
import com.github.lusitano.parser.CompilationUnit.WhileStatement;

import lombok.RequiredArgsConstructor;

/**
 * Recursive descent parser, one method per production. Syntax errors are reported to the
 * diagnostics and the parser resynchronizes at the next statement boundary, so the returned
 * unit may contain {@link ErrorStatement}s.
 */
@RequiredArgsConstructor
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> SYNC_TOKENS = EnumSet.of(
            TokenType.FUNCAO, TokenType.VAR, TokenType.CONST,
            TokenType.SE, TokenType.ENQUANTO, TokenType.PARA,
            TokenType.ESCREVA, TokenType.LEIA, TokenType.RETORNA,
            TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF);

    private static final Map<TokenType, TokenType> ASSIGNMENT_OPERATORS = Map.of(
            TokenType.EQUALS, TokenType.EQUALS,
            TokenType.PLUS_EQUALS, TokenType.PLUS,
            TokenType.MINUS_EQUALS, TokenType.MINUS,
            TokenType.STAR_EQUALS, TokenType.STAR,
            TokenType.SLASH_EQUALS, TokenType.SLASH);

    private final Diagnostics diagnostics;

    public CompilationUnit parseCompilationUnit(Tokens tokens) {
        List<Statement> statements = new ArrayList<>();

        while (!tokens.matches(TokenType.EOF)) {
            if (tokens.skip(TokenType.SEMICOLON)) {
                continue;
            }
            statements.add(parseDeclaration(tokens));
        }

        LOG.debug("parsed {} top-level declarations", statements.size());
        return new CompilationUnit(statements);
    }

    Statement parseDeclaration(Tokens tokens) {
        int start = tokens.position();
        var startToken = tokens.peek();

        try {
            return switch (startToken.type()) {
                case FUNCAO -> parseFunctionDeclaration(tokens);
                case VAR -> parseVariableDeclaration(tokens);
                case CONST -> parseConstantDeclaration(tokens);
                default -> parseStatement(tokens);
            };
        } catch (SyntaxErrorException e) {
            var found = e.found();
            diagnostics.reportSyntaxError(e.getMessage(), e.expected(), found.describe(), found.line(), found.column());
            synchronize(tokens, start);
            return new ErrorStatement(e.getMessage(), Position.of(startToken));
        }
    }

    // skips to the next statement keyword or block delimiter, making progress at least once
    private void synchronize(Tokens tokens, int start) {
        if (tokens.position() == start) {
            tokens.next();
        }
        while (!SYNC_TOKENS.contains(tokens.peek().type())) {
            tokens.next();
        }
    }

    // <> funcao name "(" (name ":" type ("," name ":" type)*)? ")" (":" type)? block
    private FunctionDeclaration parseFunctionDeclaration(Tokens tokens) {
        var funcaoToken = tokens.next(TokenType.FUNCAO);
        var nameToken = tokens.next(TokenType.IDENTIFIER);

        List<Parameter> parameters = new ArrayList<>();
        tokens.next(TokenType.LPAREN);
        if (!tokens.matches(TokenType.RPAREN)) {
            do {
                var parameterToken = tokens.next(TokenType.IDENTIFIER);
                tokens.next(TokenType.COLON);
                var type = parseType(tokens);
                parameters.add(new Parameter(parameterToken.image(), type, Position.of(parameterToken)));
            } while (tokens.skip(TokenType.COMMA));
        }
        tokens.next(TokenType.RPAREN);

        String returnType;
        if (tokens.skip(TokenType.COLON)) {
            returnType = parseType(tokens);
        } else {
            returnType = "vazio";
        }

        var body = parseBlock(tokens);
        return new FunctionDeclaration(nameToken.image(), parameters, returnType, body, Position.of(funcaoToken));
    }

    private VariableDeclaration parseVariableDeclaration(Tokens tokens) {
        tokens.next(TokenType.VAR);
        var nameToken = tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.COLON);
        var type = parseType(tokens);

        Optional<Expression> initializer = Optional.empty();
        if (tokens.skip(TokenType.EQUALS)) {
            initializer = Optional.of(parseExpression(tokens));
        }
        tokens.skip(TokenType.SEMICOLON);
        return new VariableDeclaration(nameToken.image(), type, initializer, Position.of(nameToken));
    }

    private ConstantDeclaration parseConstantDeclaration(Tokens tokens) {
        tokens.next(TokenType.CONST);
        var nameToken = tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.COLON);
        var type = parseType(tokens);
        tokens.next(TokenType.EQUALS);
        var initializer = parseExpression(tokens);
        tokens.skip(TokenType.SEMICOLON);
        return new ConstantDeclaration(nameToken.image(), type, initializer, Position.of(nameToken));
    }

    private String parseType(Tokens tokens) {
        var token = tokens.peek();
        return switch (token.type()) {
            case INTEIRO, REAL, TEXTO, LOGICO, VAZIO -> tokens.next().image();
            default -> throw new SyntaxErrorException("expected a type but found " + token.describe(), "type", token);
        };
    }

    Statement parseStatement(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case SE -> parseIfStatement(tokens);
            case ENQUANTO -> parseWhileStatement(tokens);
            case PARA -> parseForStatement(tokens);
            case ESCREVA -> parsePrintStatement(tokens);
            case LEIA -> parseReadStatement(tokens);
            case RETORNA -> parseReturnStatement(tokens);
            case LBRACE -> parseBlock(tokens);
            default -> {
                var expression = parseExpression(tokens);
                tokens.skip(TokenType.SEMICOLON);
                yield new ExpressionStatement(expression);
            }
        };
    }

    private Block parseBlock(Tokens tokens) {
        var lbrace = tokens.next(TokenType.LBRACE);
        List<Statement> statements = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE, TokenType.EOF)) {
            if (tokens.skip(TokenType.SEMICOLON)) {
                continue;
            }
            statements.add(parseDeclaration(tokens));
        }
        tokens.next(TokenType.RBRACE);
        return new Block(statements, Position.of(lbrace));
    }

    private IfStatement parseIfStatement(Tokens tokens) {
        var seToken = tokens.next(TokenType.SE);
        return parseConditional(tokens, seToken);
    }

    // <> "(" condition ")" block (senao (block | se ...) | senaose ...)?
    private IfStatement parseConditional(Tokens tokens, Token keyword) {
        tokens.next(TokenType.LPAREN);
        var condition = parseExpression(tokens);
        tokens.next(TokenType.RPAREN);
        var thenBranch = parseBlock(tokens);

        Optional<Statement> elseBranch = Optional.empty();
        if (tokens.skip(TokenType.SENAO)) {
            if (tokens.matches(TokenType.SE)) {
                elseBranch = Optional.of(parseIfStatement(tokens));
            } else {
                elseBranch = Optional.of(parseBlock(tokens));
            }
        } else if (tokens.matches(TokenType.SENAOSE)) {
            var senaoseToken = tokens.next();
            elseBranch = Optional.of(parseConditional(tokens, senaoseToken));
        }
        return new IfStatement(condition, thenBranch, elseBranch, Position.of(keyword));
    }

    private WhileStatement parseWhileStatement(Tokens tokens) {
        var enquantoToken = tokens.next(TokenType.ENQUANTO);
        tokens.next(TokenType.LPAREN);
        var condition = parseExpression(tokens);
        tokens.next(TokenType.RPAREN);
        var body = parseBlock(tokens);
        return new WhileStatement(condition, body, Position.of(enquantoToken));
    }

    // <> para name de from ate to (passo step)? block
    private ForStatement parseForStatement(Tokens tokens) {
        var paraToken = tokens.next(TokenType.PARA);
        var variableToken = tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.DE);
        var from = parseExpression(tokens);
        tokens.next(TokenType.ATE);
        var to = parseExpression(tokens);
        Optional<Expression> step = Optional.empty();
        if (tokens.skip(TokenType.PASSO)) {
            step = Optional.of(parseExpression(tokens));
        }
        var body = parseBlock(tokens);
        return new ForStatement(variableToken.image(), from, to, step, body, Position.of(paraToken));
    }

    private PrintStatement parsePrintStatement(Tokens tokens) {
        var escrevaToken = tokens.next(TokenType.ESCREVA);
        var arguments = parseArguments(tokens);
        tokens.skip(TokenType.SEMICOLON);
        return new PrintStatement(arguments, Position.of(escrevaToken));
    }

    private ReadStatement parseReadStatement(Tokens tokens) {
        var leiaToken = tokens.next(TokenType.LEIA);
        tokens.next(TokenType.LPAREN);

        Optional<Expression> prompt = Optional.empty();
        boolean bareTarget = tokens.matches(TokenType.IDENTIFIER) && tokens.peek(1).type() == TokenType.RPAREN;
        if (!bareTarget) {
            prompt = Optional.of(parseExpression(tokens));
            tokens.next(TokenType.COMMA);
        }
        var targetToken = tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.RPAREN);
        tokens.skip(TokenType.SEMICOLON);

        var target = new VariableExpression(targetToken.image(), Position.of(targetToken));
        return new ReadStatement(prompt, target, Position.of(leiaToken));
    }

    private ReturnStatement parseReturnStatement(Tokens tokens) {
        var retornaToken = tokens.next(TokenType.RETORNA);
        Optional<Expression> value = Optional.empty();
        if (!tokens.matches(TokenType.SEMICOLON, TokenType.RBRACE, TokenType.EOF)) {
            value = Optional.of(parseExpression(tokens));
        }
        tokens.skip(TokenType.SEMICOLON);
        return new ReturnStatement(value, Position.of(retornaToken));
    }

    Expression parseExpression(Tokens tokens) {
        return parseAssignment(tokens);
    }

    private Expression parseAssignment(Tokens tokens) {
        if (tokens.matches(TokenType.IDENTIFIER) && ASSIGNMENT_OPERATORS.containsKey(tokens.peek(1).type())) {
            var nameToken = tokens.next();
            var operatorToken = tokens.next();
            var target = new VariableExpression(nameToken.image(), Position.of(nameToken));

            var value = parseAssignment(tokens);
            var operator = ASSIGNMENT_OPERATORS.get(operatorToken.type());
            if (operator != TokenType.EQUALS) {
                // x op= v  ==>  x = x op v
                value = new BinaryExpression(target, operator, value, Position.of(operatorToken));
            }
            return new AssignmentExpression(target, value, Position.of(nameToken));
        }

        var expr = parseOr(tokens);

        var token = tokens.peek();
        if (ASSIGNMENT_OPERATORS.containsKey(token.type())) {
            throw new SyntaxErrorException("invalid assignment target before " + token.describe(),
                    "variable name", token);
        }
        return expr;
    }

    private Expression parseOr(Tokens tokens) {
        var expr = parseAnd(tokens);

        while (tokens.matches(TokenType.OU)) {
            var operator = tokens.next();
            var right = parseAnd(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, Position.of(operator));
        }
        return expr;
    }

    private Expression parseAnd(Tokens tokens) {
        var expr = parseEquality(tokens);

        while (tokens.matches(TokenType.E)) {
            var operator = tokens.next();
            var right = parseEquality(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, Position.of(operator));
        }
        return expr;
    }

    private Expression parseEquality(Tokens tokens) {
        var expr = parseComparison(tokens);

        while (tokens.matches(TokenType.EQUALS_EQUALS, TokenType.NOT_EQUALS)) {
            var operator = tokens.next();
            var right = parseComparison(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, Position.of(operator));
        }
        return expr;
    }

    private Expression parseComparison(Tokens tokens) {
        var expr = parsePlus(tokens);

        while (tokens.matches(TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE)) {
            var operator = tokens.next();
            var right = parsePlus(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, Position.of(operator));
        }
        return expr;
    }

    private Expression parsePlus(Tokens tokens) {
        var expr = parseTimes(tokens);

        while (tokens.matches(TokenType.PLUS, TokenType.MINUS)) {
            var operator = tokens.next();
            var right = parseTimes(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, Position.of(operator));
        }
        return expr;
    }

    private Expression parseTimes(Tokens tokens) {
        var expr = parsePower(tokens);

        while (tokens.matches(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            var operator = tokens.next();
            var right = parsePower(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, Position.of(operator));
        }
        return expr;
    }

    // right associative: 2 ** 3 ** 2 == 2 ** (3 ** 2)
    private Expression parsePower(Tokens tokens) {
        var expr = parseUnary(tokens);

        if (tokens.matches(TokenType.STAR_STAR)) {
            var operator = tokens.next();
            var right = parsePower(tokens);
            expr = new BinaryExpression(expr, operator.type(), right, Position.of(operator));
        }
        return expr;
    }

    private Expression parseUnary(Tokens tokens) {
        if (tokens.matches(TokenType.MINUS, TokenType.NAO)) {
            var operator = tokens.next();
            var operand = parseUnary(tokens);
            return new UnaryExpression(operator.type(), operand, Position.of(operator));
        }
        return parseAtom(tokens);
    }

    private Expression parseAtom(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case VERDADEIRO, FALSO -> {
                var booleanToken = tokens.next();
                yield new BooleanExpression(booleanToken.type() == TokenType.VERDADEIRO, Position.of(booleanToken));
            }
            case IDENTIFIER -> parseNameExpression(tokens);
            case NUMBER -> {
                var numberToken = tokens.next();
                yield new IntegerExpression((Long) numberToken.value(), Position.of(numberToken));
            }
            case DECIMAL -> {
                var decimalToken = tokens.next();
                yield new RealExpression((Double) decimalToken.value(), Position.of(decimalToken));
            }
            case STRING -> {
                var stringToken = tokens.next();
                yield new StringExpression((String) stringToken.value(), Position.of(stringToken));
            }
            case LPAREN -> {
                tokens.next(TokenType.LPAREN);
                var e = parseExpression(tokens);
                tokens.next(TokenType.RPAREN);
                yield e;
            }
            default -> throw new SyntaxErrorException("expected an expression but found " + token.describe(),
                    "expression", token);
        };
    }

    private Expression parseNameExpression(Tokens tokens) {
        var nameToken = tokens.next(TokenType.IDENTIFIER);

        if (tokens.matches(TokenType.LPAREN)) {
            var arguments = parseArguments(tokens);
            return new FunctionEvaluationExpression(nameToken.image(), arguments, Position.of(nameToken));
        }
        return new VariableExpression(nameToken.image(), Position.of(nameToken));
    }

    // <> "(" (expression ("," expression)*)? ")"
    private List<Expression> parseArguments(Tokens tokens) {
        tokens.next(TokenType.LPAREN);

        List<Expression> arguments = new ArrayList<>();
        if (tokens.skip(TokenType.RPAREN)) {
            return arguments;
        }

        arguments.add(parseExpression(tokens));
        while (!tokens.matches(TokenType.RPAREN)) {
            tokens.next(TokenType.COMMA);
            arguments.add(parseExpression(tokens));
        }
        tokens.next(TokenType.RPAREN);
        return arguments;
    }

}
