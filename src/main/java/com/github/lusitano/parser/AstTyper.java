package com.github.lusitano.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.lusitano.Tokenizer.TokenType;
import com.github.lusitano.diagnostics.Diagnostic.Kind;
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
import com.github.lusitano.parser.SemanticException.DuplicateDeclarationException;
import com.github.lusitano.parser.SemanticException.UndeclaredIdentifierException;
import com.github.lusitano.parser.Symbol.Category;
import com.github.lusitano.parser.TCompilationUnit.TAssignmentExpression;
import com.github.lusitano.parser.TCompilationUnit.TBinaryExpression;
import com.github.lusitano.parser.TCompilationUnit.TBlock;
import com.github.lusitano.parser.TCompilationUnit.TBooleanExpression;
import com.github.lusitano.parser.TCompilationUnit.TConstantDeclaration;
import com.github.lusitano.parser.TCompilationUnit.TErrorStatement;
import com.github.lusitano.parser.TCompilationUnit.TExpression;
import com.github.lusitano.parser.TCompilationUnit.TExpressionStatement;
import com.github.lusitano.parser.TCompilationUnit.TForStatement;
import com.github.lusitano.parser.TCompilationUnit.TFunctionDeclaration;
import com.github.lusitano.parser.TCompilationUnit.TFunctionEvaluationExpression;
import com.github.lusitano.parser.TCompilationUnit.TIfStatement;
import com.github.lusitano.parser.TCompilationUnit.TIntegerExpression;
import com.github.lusitano.parser.TCompilationUnit.TPrintStatement;
import com.github.lusitano.parser.TCompilationUnit.TReadStatement;
import com.github.lusitano.parser.TCompilationUnit.TRealExpression;
import com.github.lusitano.parser.TCompilationUnit.TReturnStatement;
import com.github.lusitano.parser.TCompilationUnit.TStatement;
import com.github.lusitano.parser.TCompilationUnit.TStringExpression;
import com.github.lusitano.parser.TCompilationUnit.TUnaryExpression;
import com.github.lusitano.parser.TCompilationUnit.TVariableDeclaration;
import com.github.lusitano.parser.TCompilationUnit.TVariableExpression;
import com.github.lusitano.parser.TCompilationUnit.TWhileStatement;
import com.github.lusitano.parser.Type.Builtin;
import com.github.lusitano.parser.Type.FunctionType;

import lombok.RequiredArgsConstructor;

/**
 * Resolves names and checks types, producing the typed tree. Violations are reported to the
 * diagnostics and the offending node is typed {@link Builtin#ERROR}; the walk always completes.
 * An instance types exactly one compilation unit.
 */
@RequiredArgsConstructor
public class AstTyper {

    private static final Logger LOG = LoggerFactory.getLogger(AstTyper.class);

    private static final Set<TokenType> ARITHMETIC_OPERATORS = Set.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH,
            TokenType.PERCENT, TokenType.STAR_STAR);
    private static final Set<TokenType> COMPARISON_OPERATORS = Set.of(
            TokenType.EQUALS_EQUALS, TokenType.NOT_EQUALS,
            TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE);
    private static final Set<TokenType> LOGICAL_OPERATORS = Set.of(TokenType.E, TokenType.OU);

    private final Diagnostics diagnostics;

    private final Scopes scopes = new Scopes();
    private final Map<FunctionDeclaration, Symbol> hoistedFunctions = new IdentityHashMap<>();
    // x += 1 references x twice at the same position
    private final Set<Position> reportedUndeclared = new HashSet<>();

    private Optional<Symbol> currentFunction = Optional.empty();

    public TCompilationUnit typeCompilationUnit(CompilationUnit compilationUnit) {
        Builtins.declareAll(scopes);
        collectFunctions(compilationUnit.statements());

        var statements = typeStatements(compilationUnit.statements());
        LOG.debug("typed {} top-level statements", statements.size());
        return new TCompilationUnit(statements);
    }

    Scopes scopes() {
        return scopes;
    }

    // top-level functions are visible before their declaration
    private void collectFunctions(List<Statement> statements) {
        for (var statement : statements) {
            if (statement instanceof FunctionDeclaration fd) {
                hoistedFunctions.put(fd, declareFunction(fd));
            }
        }
    }

    private Symbol declareFunction(FunctionDeclaration fd) {
        // a vazio parameter is reported with the body; ERROR keeps call sites quiet
        var parameterTypes = fd.parameters().stream()
                .map(p -> typeNamed(p.type()))
                .map(t -> t == Builtin.VAZIO ? Builtin.ERROR : t)
                .toList();
        var type = Type.function(typeNamed(fd.returnType()), parameterTypes);
        return declare(fd.name(), type, Category.FUNCTION, fd.position());
    }

    private Symbol declare(String name, Type type, Category category, Position position) {
        try {
            return scopes.declare(name, type, category, position.line(), position.column());
        } catch (DuplicateDeclarationException e) {
            report(e.kind(), e.getMessage(), position);
            return e.rejected();
        }
    }

    private Optional<Symbol> resolve(String name, Position position) {
        try {
            return Optional.of(scopes.resolve(name));
        } catch (UndeclaredIdentifierException e) {
            if (reportedUndeclared.add(position)) {
                report(e.kind(), e.getMessage(), position);
            }
            return Optional.empty();
        }
    }

    private void report(Kind kind, String message, Position position) {
        diagnostics.report(kind, message, position.line(), position.column());
    }

    private static Type typeNamed(String keyword) {
        return Type.named(keyword)
                .orElseThrow(() -> new IllegalStateException("unknown type keyword " + keyword));
    }

    private List<TStatement> typeStatements(List<Statement> statements) {
        List<TStatement> typed = new ArrayList<>();
        for (var statement : statements) {
            typed.add(typeStatement(statement));
        }
        return typed;
    }

    private TStatement typeStatement(Statement statement) {
        if (statement instanceof ExpressionStatement es) {
            return new TExpressionStatement(typeExpression(es.expression()));
        } else if (statement instanceof VariableDeclaration vd) {
            return typeVariableDeclaration(vd);
        } else if (statement instanceof ConstantDeclaration cd) {
            return typeConstantDeclaration(cd);
        } else if (statement instanceof FunctionDeclaration fd) {
            return typeFunctionDeclaration(fd);
        } else if (statement instanceof Block b) {
            return typeBlock(b);
        } else if (statement instanceof IfStatement is) {
            return typeIfStatement(is);
        } else if (statement instanceof WhileStatement ws) {
            var condition = typeCondition(ws.condition(), "enquanto");
            return new TWhileStatement(condition, typeBlock(ws.body()));
        } else if (statement instanceof ForStatement fs) {
            return typeForStatement(fs);
        } else if (statement instanceof ReturnStatement rs) {
            return typeReturnStatement(rs);
        } else if (statement instanceof PrintStatement ps) {
            return typePrintStatement(ps);
        } else if (statement instanceof ReadStatement rs) {
            return typeReadStatement(rs);
        } else if (statement instanceof ErrorStatement es) {
            return new TErrorStatement(es.message(), es.position());
        }
        throw new IllegalStateException("unsupported statement " + statement);
    }

    private TFunctionDeclaration typeFunctionDeclaration(FunctionDeclaration fd) {
        var symbol = hoistedFunctions.get(fd);
        if (symbol == null) {
            // nested functions are declared where they appear, before the body for recursion
            symbol = declareFunction(fd);
        }
        var type = (FunctionType) symbol.type();

        scopes.enter();
        List<Symbol> parameters = new ArrayList<>();
        for (int i = 0; i < fd.parameters().size(); i++) {
            var p = fd.parameters().get(i);
            if (typeNamed(p.type()) == Builtin.VAZIO) {
                report(Kind.TYPE_MISMATCH, "parameter '" + p.name() + "' cannot have type vazio", p.position());
            }
            parameters.add(declare(p.name(), type.parameters().get(i), Category.PARAMETER, p.position()));
        }

        var enclosingFunction = currentFunction;
        currentFunction = Optional.of(symbol);
        // the body shares the scope of the parameters
        var body = new TBlock(typeStatements(fd.body().statements()));
        currentFunction = enclosingFunction;
        scopes.exit();

        if (type.returnType() != Builtin.VAZIO && !definitelyReturns(fd.body())) {
            report(Kind.MISSING_RETURN, "function '" + fd.name() + "' may finish without returning a value of type "
                    + type.returnType(), fd.position());
        }

        LOG.trace("typed function {}: {}", fd.name(), type);
        return new TFunctionDeclaration(symbol, parameters, body);
    }

    private static boolean definitelyReturns(Statement statement) {
        if (statement instanceof ReturnStatement) {
            return true;
        } else if (statement instanceof Block b) {
            return b.statements().stream().anyMatch(AstTyper::definitelyReturns);
        } else if (statement instanceof IfStatement is) {
            return definitelyReturns(is.thenBranch())
                    && is.elseBranch().map(AstTyper::definitelyReturns).orElse(false);
        } else if (statement instanceof WhileStatement ws) {
            // there is no break, so enquanto (verdadeiro) is only left through retorna
            return ws.condition() instanceof BooleanExpression be && be.value();
        }
        return false;
    }

    private TVariableDeclaration typeVariableDeclaration(VariableDeclaration vd) {
        var initializer = vd.initializer().map(this::typeExpression);
        var type = declaredType(vd.name(), vd.type(), vd.position());
        initializer.ifPresent(i -> checkAssignable(type, i.type(), Kind.TYPE_MISMATCH,
                "cannot initialize '" + vd.name() + "' of type " + type + " with a value of type " + i.type(),
                vd.position()));
        var symbol = declare(vd.name(), type, Category.VARIABLE, vd.position());
        return new TVariableDeclaration(symbol, initializer);
    }

    private TConstantDeclaration typeConstantDeclaration(ConstantDeclaration cd) {
        var initializer = typeExpression(cd.initializer());
        var type = declaredType(cd.name(), cd.type(), cd.position());
        checkAssignable(type, initializer.type(), Kind.TYPE_MISMATCH,
                "cannot initialize constant '" + cd.name() + "' of type " + type + " with a value of type "
                        + initializer.type(),
                cd.position());
        var symbol = declare(cd.name(), type, Category.CONSTANT, cd.position());
        return new TConstantDeclaration(symbol, initializer);
    }

    private Type declaredType(String name, String keyword, Position position) {
        var type = typeNamed(keyword);
        if (type == Builtin.VAZIO) {
            report(Kind.TYPE_MISMATCH, "'" + name + "' cannot have type vazio", position);
            return Builtin.ERROR;
        }
        return type;
    }

    // strict: no implicit inteiro -> real widening
    private void checkAssignable(Type expected, Type actual, Kind kind, String message, Position position) {
        if (expected.isError() || actual.isError()) {
            return;
        }
        if (expected == Builtin.ANY ? actual == Builtin.VAZIO : expected != actual) {
            report(kind, message, position);
        }
    }

    private TBlock typeBlock(Block block) {
        scopes.enter();
        var statements = typeStatements(block.statements());
        scopes.exit();
        return new TBlock(statements);
    }

    private TIfStatement typeIfStatement(IfStatement is) {
        var condition = typeCondition(is.condition(), "se");
        var thenBranch = typeBlock(is.thenBranch());
        var elseBranch = is.elseBranch().map(this::typeStatement);
        return new TIfStatement(condition, thenBranch, elseBranch);
    }

    private TExpression typeCondition(Expression expression, String keyword) {
        var condition = typeExpression(expression);
        checkAssignable(Builtin.LOGICO, condition.type(), Kind.TYPE_MISMATCH,
                "condition of '" + keyword + "' must be logico but is " + condition.type(), expression.position());
        return condition;
    }

    private TForStatement typeForStatement(ForStatement fs) {
        var from = typeBound(fs.from(), "start");
        var to = typeBound(fs.to(), "end");
        var step = fs.step().map(s -> typeBound(s, "step"));

        scopes.enter();
        var variable = declare(fs.variable(), Builtin.INTEIRO, Category.VARIABLE, fs.position());
        var body = typeBlock(fs.body());
        scopes.exit();

        return new TForStatement(variable, from, to, step, body);
    }

    private TExpression typeBound(Expression expression, String what) {
        var bound = typeExpression(expression);
        checkAssignable(Builtin.INTEIRO, bound.type(), Kind.TYPE_MISMATCH,
                "loop " + what + " must be inteiro but is " + bound.type(), expression.position());
        return bound;
    }

    private TReturnStatement typeReturnStatement(ReturnStatement rs) {
        var value = rs.value().map(this::typeExpression);

        if (currentFunction.isEmpty()) {
            report(Kind.RETURN_OUTSIDE_FUNCTION, "'retorna' outside of a function", rs.position());
            return new TReturnStatement(value, Optional.empty());
        }

        var function = currentFunction.get();
        var returnType = ((FunctionType) function.type()).returnType();
        if (value.isPresent()) {
            var valueType = value.get().type();
            if (returnType == Builtin.VAZIO) {
                if (!valueType.isError()) {
                    report(Kind.RETURN_TYPE_MISMATCH, "function '" + function.name()
                            + "' has no return type and cannot return a value", rs.position());
                }
            } else {
                checkAssignable(returnType, valueType, Kind.RETURN_TYPE_MISMATCH, "function '" + function.name()
                        + "' must return " + returnType + " but returns " + valueType, rs.position());
            }
        } else if (returnType != Builtin.VAZIO) {
            report(Kind.RETURN_TYPE_MISMATCH, "function '" + function.name() + "' must return a value of type "
                    + returnType, rs.position());
        }
        return new TReturnStatement(value, currentFunction);
    }

    private TPrintStatement typePrintStatement(PrintStatement ps) {
        List<TExpression> arguments = new ArrayList<>();
        for (var argument : ps.arguments()) {
            var typed = typeExpression(argument);
            if (typed.type() == Builtin.VAZIO) {
                report(Kind.TYPE_MISMATCH, "cannot print a value of type vazio", argument.position());
            }
            arguments.add(typed);
        }
        return new TPrintStatement(arguments);
    }

    private TReadStatement typeReadStatement(ReadStatement rs) {
        var prompt = rs.prompt().map(this::typeExpression);
        prompt.ifPresent(p -> checkAssignable(Builtin.TEXTO, p.type(), Kind.TYPE_MISMATCH,
                "prompt of 'leia' must be texto but is " + p.type(), rs.prompt().get().position()));

        var target = typeAssignmentTarget(rs.target());
        return new TReadStatement(prompt, target);
    }

    private TExpression typeExpression(Expression expression) {
        if (expression instanceof IntegerExpression ie) {
            return new TIntegerExpression(ie.value());
        } else if (expression instanceof RealExpression re) {
            return new TRealExpression(re.value());
        } else if (expression instanceof StringExpression se) {
            return new TStringExpression(se.string());
        } else if (expression instanceof BooleanExpression be) {
            return new TBooleanExpression(be.value());
        } else if (expression instanceof VariableExpression ve) {
            return typeVariableExpression(ve);
        } else if (expression instanceof AssignmentExpression ae) {
            var value = typeExpression(ae.value());
            var target = typeAssignmentTarget(ae.target());
            checkAssignable(target.type(), value.type(), Kind.TYPE_MISMATCH,
                    "cannot assign a value of type " + value.type() + " to '" + target.name() + "' of type "
                            + target.type(),
                    ae.position());
            return new TAssignmentExpression(target, value, target.type());
        } else if (expression instanceof BinaryExpression be) {
            return typeBinaryExpression(be);
        } else if (expression instanceof UnaryExpression ue) {
            return typeUnaryExpression(ue);
        } else if (expression instanceof FunctionEvaluationExpression fee) {
            return typeFunctionEvaluation(fee);
        }
        throw new IllegalStateException("unsupported expression " + expression);
    }

    private TVariableExpression typeVariableExpression(VariableExpression ve) {
        var symbol = resolve(ve.name(), ve.position());
        if (symbol.isEmpty()) {
            return new TVariableExpression(ve.name(), symbol, Builtin.ERROR);
        }
        if (symbol.get().category().isCallable()) {
            report(Kind.TYPE_MISMATCH, "function '" + ve.name() + "' cannot be used as a value", ve.position());
            return new TVariableExpression(ve.name(), symbol, Builtin.ERROR);
        }
        return new TVariableExpression(ve.name(), symbol, symbol.get().type());
    }

    // target of an assignment or of 'leia'
    private TVariableExpression typeAssignmentTarget(VariableExpression target) {
        var symbol = resolve(target.name(), target.position());
        if (symbol.isEmpty()) {
            return new TVariableExpression(target.name(), symbol, Builtin.ERROR);
        }
        var category = symbol.get().category();
        if (category == Category.CONSTANT) {
            report(Kind.CONSTANT_REASSIGNMENT, "cannot assign to constant '" + target.name() + "'", target.position());
            return new TVariableExpression(target.name(), symbol, Builtin.ERROR);
        }
        if (!category.isAssignable()) {
            report(Kind.TYPE_MISMATCH, "cannot assign to function '" + target.name() + "'", target.position());
            return new TVariableExpression(target.name(), symbol, Builtin.ERROR);
        }
        return new TVariableExpression(target.name(), symbol, symbol.get().type());
    }

    private TExpression typeBinaryExpression(BinaryExpression be) {
        var left = typeExpression(be.left());
        var right = typeExpression(be.right());
        var operator = be.operator();
        var l = left.type();
        var r = right.type();

        if (l.isError() || r.isError()) {
            return new TBinaryExpression(left, operator, right, Builtin.ERROR);
        }

        Type resultType = Builtin.ERROR;
        if (ARITHMETIC_OPERATORS.contains(operator)) {
            if (l.isNumeric() && r.isNumeric()) {
                resultType = l == Builtin.REAL || r == Builtin.REAL ? Builtin.REAL : Builtin.INTEIRO;
            } else if (operator == TokenType.PLUS && l == Builtin.TEXTO && r == Builtin.TEXTO) {
                resultType = Builtin.TEXTO;
            }
        } else if (COMPARISON_OPERATORS.contains(operator)) {
            if (l == r && l != Builtin.VAZIO) {
                resultType = Builtin.LOGICO;
            }
        } else if (LOGICAL_OPERATORS.contains(operator)) {
            if (l == Builtin.LOGICO && r == Builtin.LOGICO) {
                resultType = Builtin.LOGICO;
            }
        } else {
            throw new IllegalStateException("unsupported binary operator " + operator);
        }

        if (resultType.isError()) {
            report(Kind.TYPE_MISMATCH, "operator " + operator.describe() + " cannot be applied to " + l + " and " + r,
                    be.position());
        }
        return new TBinaryExpression(left, operator, right, resultType);
    }

    private TExpression typeUnaryExpression(UnaryExpression ue) {
        var operand = typeExpression(ue.operand());
        var type = operand.type();
        if (type.isError()) {
            return new TUnaryExpression(ue.operator(), operand, Builtin.ERROR);
        }

        boolean ok = ue.operator() == TokenType.MINUS ? type.isNumeric() : type == Builtin.LOGICO;
        if (!ok) {
            report(Kind.TYPE_MISMATCH, "operator " + ue.operator().describe() + " cannot be applied to " + type,
                    ue.position());
            return new TUnaryExpression(ue.operator(), operand, Builtin.ERROR);
        }
        return new TUnaryExpression(ue.operator(), operand, type);
    }

    private TExpression typeFunctionEvaluation(FunctionEvaluationExpression fee) {
        var name = fee.name();
        var arguments = fee.arguments().stream()
                .map(this::typeExpression)
                .toList();

        var symbol = resolve(name, fee.position());
        if (symbol.isEmpty()) {
            return new TFunctionEvaluationExpression(name, symbol, arguments, Builtin.ERROR);
        }
        if (!(symbol.get().type() instanceof FunctionType type)) {
            report(Kind.NOT_CALLABLE, "'" + name + "' is not a function", fee.position());
            return new TFunctionEvaluationExpression(name, symbol, arguments, Builtin.ERROR);
        }

        var parameters = type.parameters();
        if (parameters.size() != arguments.size()) {
            report(Kind.ARGUMENT_COUNT_MISMATCH, "function '" + name + "' expects " + parameters.size()
                    + " argument(s) but got " + arguments.size(), fee.position());
        } else {
            for (int i = 0; i < arguments.size(); i++) {
                var expected = parameters.get(i);
                var actual = arguments.get(i).type();
                checkAssignable(expected, actual, Kind.TYPE_MISMATCH, "argument " + (i + 1) + " of '" + name
                        + "' must be " + (expected == Builtin.ANY ? "a value" : expected) + " but is " + actual,
                        fee.arguments().get(i).position());
            }
        }
        return new TFunctionEvaluationExpression(name, symbol, arguments, type.returnType());
    }

}
