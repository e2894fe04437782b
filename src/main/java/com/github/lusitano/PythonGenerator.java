package com.github.lusitano;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.lusitano.Tokenizer.TokenType;
import com.github.lusitano.parser.Symbol;
import com.github.lusitano.parser.Symbol.Category;
import com.github.lusitano.parser.TCompilationUnit;
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
import com.github.lusitano.parser.Type;
import com.github.lusitano.parser.Type.Builtin;

import lombok.RequiredArgsConstructor;

/**
 * Translates a typed compilation unit into Python 3 source text. The translation first builds an
 * {@link Output} model which {@link OutputEmitter} then renders. Generation trusts the typed tree:
 * nodes typed {@link Builtin#ERROR} and error statements still produce runnable stubs.
 * An instance generates exactly one compilation unit.
 */
@RequiredArgsConstructor
public class PythonGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(PythonGenerator.class);

    static final String HEADER = "# Generated by the Lusitano compiler. Do not edit.";
    static final String ENTRY_POINT = "principal";

    private static final Map<String, String> BUILTIN_FUNCTIONS = Map.of(
            "tamanho", "len",
            "raiz", "math.sqrt",
            "absoluto", "abs",
            "arredonda", "round",
            "paraInteiro", "int",
            "paraReal", "float",
            "paraTexto", "str");

    private final boolean emitHeader;
    private final boolean emitEntryPoint;

    private final NameMapper nameMapper = new NameMapper();
    private final Output output = new Output();

    public PythonGenerator() {
        this(true, true);
    }

    public String generate(TCompilationUnit cu) {
        // hoisted functions own their names before anything else is bound
        cu.statements().stream()
                .filter(TFunctionDeclaration.class::isInstance)
                .map(TFunctionDeclaration.class::cast)
                .forEach(fd -> nameMapper.bind(fd.symbol(), nameMapper.global));

        for (var statement : cu.statements()) {
            if (statement instanceof TFunctionDeclaration fd) {
                output.functions.add(compileFunctionDeclaration(fd, nameMapper.global));
            } else {
                compileStatement(statement, nameMapper.global, output.body);
            }
        }

        if (emitEntryPoint) {
            cu.statements().stream()
                    .filter(TFunctionDeclaration.class::isInstance)
                    .map(TFunctionDeclaration.class::cast)
                    .filter(fd -> fd.symbol().name().equals(ENTRY_POINT) && fd.parameters().isEmpty())
                    .findFirst()
                    .ifPresent(fd -> output.entryPoint = Optional.of(nameMapper.nameOf(fd.symbol())));
        }
        output.header = emitHeader;

        var writer = new StringWriter();
        new OutputEmitter(output, writer).emit();
        LOG.debug("generated {} functions and {} top-level statements", output.functions.size(), output.body.size());
        return writer.toString();
    }

    private Output.Def compileFunctionDeclaration(TFunctionDeclaration fd, Frame enclosing) {
        var name = nameMapper.isBound(fd.symbol()) ? nameMapper.nameOf(fd.symbol()) : nameMapper.bind(fd.symbol(), enclosing);
        var frame = new Frame(enclosing);
        var parameters = fd.parameters().stream()
                .map(p -> nameMapper.bind(p, frame))
                .toList();

        List<Output.Statement> body = new ArrayList<>();
        fd.body().statements().forEach(s -> compileStatement(s, frame, body));

        return new Output.Def(name, parameters, List.copyOf(frame.globals), List.copyOf(frame.nonlocals), body);
    }

    private void compileStatement(TStatement statement, Frame frame, List<Output.Statement> out) {
        if (statement instanceof TExpressionStatement es) {
            if (es.expression() instanceof TAssignmentExpression ae) {
                var value = compileExpression(ae.value(), frame);
                out.add(new Output.Assignment(assignTo(ae.target(), frame), value));
            } else {
                out.add(new Output.ExpressionStatement(compileExpression(es.expression(), frame)));
            }
        } else if (statement instanceof TVariableDeclaration vd) {
            var value = vd.initializer()
                    .map(i -> compileExpression(i, frame))
                    .orElseGet(() -> defaultValue(vd.symbol().type()));
            out.add(new Output.Assignment(nameMapper.bind(vd.symbol(), frame), value));
        } else if (statement instanceof TConstantDeclaration cd) {
            var value = compileExpression(cd.initializer(), frame);
            out.add(new Output.Assignment(nameMapper.bind(cd.symbol(), frame), value));
        } else if (statement instanceof TFunctionDeclaration fd) {
            out.add(compileFunctionDeclaration(fd, frame));
        } else if (statement instanceof TBlock b) {
            // python has no block scope, names are already unique per frame
            b.statements().forEach(s -> compileStatement(s, frame, out));
        } else if (statement instanceof TIfStatement is) {
            out.add(compileIf(is, frame));
        } else if (statement instanceof TWhileStatement ws) {
            var condition = compileExpression(ws.condition(), frame);
            out.add(new Output.While(condition, compileBlock(ws.body(), frame)));
        } else if (statement instanceof TForStatement fs) {
            out.add(compileFor(fs, frame));
        } else if (statement instanceof TReturnStatement rs) {
            if (rs.function().isEmpty()) {
                out.add(new Output.Pass(Optional.of("'retorna' outside of a function")));
            } else {
                out.add(new Output.Return(rs.value().map(v -> compileExpression(v, frame))));
            }
        } else if (statement instanceof TPrintStatement ps) {
            List<Output.Expression> arguments = new ArrayList<>();
            ps.arguments().forEach(a -> arguments.add(compileExpression(a, frame)));
            if (!arguments.isEmpty()) {
                arguments.add(new Output.KeywordArgument("sep", new Output.Literal("\"\"")));
            }
            out.add(new Output.ExpressionStatement(new Output.Call("print", arguments)));
        } else if (statement instanceof TReadStatement rs) {
            var prompt = rs.prompt().map(p -> compileExpression(p, frame));
            Output.Expression input = new Output.Call("input", prompt.map(List::of).orElse(List.of()));
            out.add(new Output.Assignment(assignTo(rs.target(), frame), convertInput(input, rs.target().type())));
        } else if (statement instanceof TErrorStatement es) {
            out.add(new Output.Pass(Optional.of("syntax error at line " + es.position().line() + ": " + es.message())));
        } else {
            throw new IllegalStateException("unsupported statement " + statement);
        }
    }

    private List<Output.Statement> compileBlock(TBlock block, Frame frame) {
        List<Output.Statement> statements = new ArrayList<>();
        block.statements().forEach(s -> compileStatement(s, frame, statements));
        return statements;
    }

    private Output.If compileIf(TIfStatement is, Frame frame) {
        var condition = compileExpression(is.condition(), frame);
        var thens = compileBlock(is.thenBranch(), frame);
        List<Output.Statement> elses = new ArrayList<>();
        is.elseBranch().ifPresent(e -> compileStatement(e, frame, elses));
        return new Output.If(condition, thens, elses);
    }

    private Output.For compileFor(TForStatement fs, Frame frame) {
        var from = compileExpression(fs.from(), frame);
        var to = compileExpression(fs.to(), frame);
        var step = fs.step().map(s -> compileExpression(s, frame));
        var variable = nameMapper.bind(fs.variable(), frame);
        var body = compileBlock(fs.body(), frame);

        Output.Expression iterable;
        var literalStep = fs.step().flatMap(PythonGenerator::constantValue);
        if (step.isEmpty() || literalStep.filter(s -> s > 0).isPresent()) {
            var end = inclusiveEnd(fs.to(), to, 1);
            iterable = new Output.Call("range", step.isEmpty() ? List.of(from, end) : List.of(from, end, step.get()));
        } else if (literalStep.filter(s -> s < 0).isPresent()) {
            var end = inclusiveEnd(fs.to(), to, -1);
            iterable = new Output.Call("range", List.of(from, end, step.get()));
        } else {
            // direction only known at run time
            output.helpers.add(Output.Helper.INTERVALO);
            iterable = new Output.Call(Output.Helper.INTERVALO.pythonName, List.of(from, to, step.get()));
        }
        return new Output.For(variable, iterable, body);
    }

    private static Output.Expression inclusiveEnd(TExpression source, Output.Expression compiled, int delta) {
        return constantValue(source)
                .flatMap(v -> offset(v, delta))
                .<Output.Expression>map(v -> new Output.Literal(Long.toString(v)))
                .orElseGet(() -> new Output.BinaryExpression(compiled, delta > 0 ? "+" : "-", new Output.Literal("1")));
    }

    // empty past the long range, python then does the arithmetic
    private static Optional<Long> offset(long value, int delta) {
        try {
            return Optional.of(Math.addExact(value, (long) delta));
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    // integer literals, possibly negated
    private static Optional<Long> constantValue(TExpression expression) {
        if (expression instanceof TIntegerExpression ie) {
            return Optional.of(ie.value());
        }
        if (expression instanceof TUnaryExpression ue && ue.operator() == TokenType.MINUS) {
            return constantValue(ue.operand()).map(v -> -v);
        }
        return Optional.empty();
    }

    private Output.Expression convertInput(Output.Expression input, Type type) {
        if (type == Builtin.INTEIRO) {
            return new Output.Call("int", List.of(input));
        } else if (type == Builtin.REAL) {
            return new Output.Call("float", List.of(input));
        } else if (type == Builtin.LOGICO) {
            output.helpers.add(Output.Helper.PARA_LOGICO);
            return new Output.Call(Output.Helper.PARA_LOGICO.pythonName, List.of(input));
        }
        return input;
    }

    private static Output.Expression defaultValue(Type type) {
        if (type == Builtin.INTEIRO) {
            return new Output.Literal("0");
        } else if (type == Builtin.REAL) {
            return new Output.Literal("0.0");
        } else if (type == Builtin.TEXTO) {
            return new Output.Literal("\"\"");
        } else if (type == Builtin.LOGICO) {
            return new Output.Literal("False");
        }
        return new Output.Literal("None");
    }

    // records writes to names of enclosing frames so the def can declare them global/nonlocal
    private String assignTo(TVariableExpression target, Frame frame) {
        if (target.symbol().isEmpty()) {
            return NameMapper.escape(target.name());
        }
        var symbol = target.symbol().get();
        var name = nameMapper.nameOf(symbol);
        var owner = nameMapper.frameOf(symbol);
        if (owner != null && owner != frame) {
            if (owner == nameMapper.global) {
                frame.globals.add(name);
            } else {
                frame.nonlocals.add(name);
            }
        }
        return name;
    }

    private Output.Expression compileExpression(TExpression expression, Frame frame) {
        if (expression instanceof TIntegerExpression ie) {
            return new Output.Literal(Long.toString(ie.value()));
        } else if (expression instanceof TRealExpression re) {
            return new Output.Literal(realLiteral(re.value()));
        } else if (expression instanceof TStringExpression se) {
            return new Output.Literal(stringLiteral(se.string()));
        } else if (expression instanceof TBooleanExpression be) {
            return new Output.Literal(be.value() ? "True" : "False");
        } else if (expression instanceof TVariableExpression ve) {
            return new Output.NameExpression(ve.symbol().map(nameMapper::nameOf).orElseGet(() -> NameMapper.escape(ve.name())));
        } else if (expression instanceof TAssignmentExpression ae) {
            var value = compileExpression(ae.value(), frame);
            return new Output.NamedExpression(assignTo(ae.target(), frame), value);
        } else if (expression instanceof TBinaryExpression be) {
            var left = compileExpression(be.left(), frame);
            var right = compileExpression(be.right(), frame);
            return new Output.BinaryExpression(left, binaryOperator(be), right);
        } else if (expression instanceof TUnaryExpression ue) {
            var operand = compileExpression(ue.operand(), frame);
            return new Output.UnaryExpression(ue.operator() == TokenType.NAO ? "not" : "-", operand);
        } else if (expression instanceof TFunctionEvaluationExpression fee) {
            List<Output.Expression> arguments = new ArrayList<>();
            fee.arguments().forEach(a -> arguments.add(compileExpression(a, frame)));
            return new Output.Call(functionName(fee), arguments);
        }
        throw new IllegalStateException("unsupported expression " + expression);
    }

    private String functionName(TFunctionEvaluationExpression fee) {
        if (fee.symbol().isEmpty()) {
            return NameMapper.escape(fee.name());
        }
        var symbol = fee.symbol().get();
        if (symbol.category() == Category.BUILTIN) {
            var pythonName = BUILTIN_FUNCTIONS.get(symbol.name());
            if (pythonName.startsWith("math.")) {
                output.importMath = true;
            }
            return pythonName;
        }
        return nameMapper.nameOf(symbol);
    }

    private static String binaryOperator(TBinaryExpression be) {
        return switch (be.operator()) {
            case E -> "and";
            case OU -> "or";
            case SLASH -> be.left().type() == Builtin.INTEIRO && be.right().type() == Builtin.INTEIRO ? "//" : "/";
            default -> be.operator().constantPattern;
        };
    }

    static String realLiteral(double value) {
        if (Double.isInfinite(value)) {
            return "float('inf')";
        }
        return Double.toString(value);
    }

    static String stringLiteral(String value) {
        var sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /** A Python function body, or the module itself. Names bound here must not clash with enclosing frames. */
    static class Frame {
        final Frame parent;
        final Set<String> names = new HashSet<>();
        final Set<String> globals = new LinkedHashSet<>();
        final Set<String> nonlocals = new LinkedHashSet<>();

        Frame(Frame parent) {
            this.parent = parent;
        }

        boolean isTaken(String name) {
            for (var frame = this; frame != null; frame = frame.parent) {
                if (frame.names.contains(name)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Gives every symbol a Python name. Python keywords and the names generated code relies on are
     * suffixed with {@code _}; a name already used in the same or an enclosing frame gets a
     * numeric suffix, which keeps block scoped declarations apart.
     */
    static class NameMapper {
        static final Set<String> RESERVED = Set.of(
                "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
                "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
                "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
                "try", "while", "with", "yield",
                "print", "input", "int", "float", "str", "bool", "len", "abs", "round", "range", "math",
                "__name__",
                Output.Helper.INTERVALO.pythonName, Output.Helper.PARA_LOGICO.pythonName);

        final Frame global = new Frame(null);

        private final Map<Symbol, String> names = new HashMap<>();
        private final Map<Symbol, Frame> frames = new HashMap<>();

        static String escape(String name) {
            return RESERVED.contains(name) ? name + "_" : name;
        }

        String bind(Symbol symbol, Frame frame) {
            var base = escape(symbol.name());
            var candidate = base;
            for (int i = 2; frame.isTaken(candidate); i++) {
                candidate = base + "_" + i;
            }
            frame.names.add(candidate);
            names.put(symbol, candidate);
            frames.put(symbol, frame);
            return candidate;
        }

        boolean isBound(Symbol symbol) {
            return names.containsKey(symbol);
        }

        String nameOf(Symbol symbol) {
            return names.getOrDefault(symbol, escape(symbol.name()));
        }

        Frame frameOf(Symbol symbol) {
            return frames.get(symbol);
        }
    }

    static class Output {
        boolean header;
        boolean importMath;
        final Set<Helper> helpers = EnumSet.noneOf(Helper.class);
        final List<Statement> functions = new ArrayList<>();
        final List<Statement> body = new ArrayList<>();
        Optional<String> entryPoint = Optional.empty();

        enum Helper {
            INTERVALO("_intervalo", List.of(
                    "def _intervalo(inicio, fim, passo):",
                    "    return range(inicio, fim + (1 if passo > 0 else -1), passo)")),
            PARA_LOGICO("_para_logico", List.of(
                    "def _para_logico(valor):",
                    "    return valor.strip().lower() in (\"verdadeiro\", \"v\", \"sim\", \"s\", \"true\", \"1\")"));

            final String pythonName;
            final List<String> lines;

            Helper(String pythonName, List<String> lines) {
                this.pythonName = pythonName;
                this.lines = lines;
            }
        }

        interface Element {}
        interface Expression extends Element {}
        interface Statement extends Element {}

        record Literal(String text) implements Expression {}
        record NameExpression(String name) implements Expression {}
        record BinaryExpression(Expression left, String op, Expression right) implements Expression {}
        record UnaryExpression(String op, Expression operand) implements Expression {}
        record Call(String function, List<Expression> arguments) implements Expression {}
        record KeywordArgument(String name, Expression value) implements Expression {}
        record NamedExpression(String name, Expression value) implements Expression {}

        record ExpressionStatement(Expression expression) implements Statement {}
        record Assignment(String name, Expression value) implements Statement {}
        record Def(String name, List<String> parameters, List<String> globals, List<String> nonlocals, List<Statement> body) implements Statement {}
        record If(Expression condition, List<Statement> thens, List<Statement> elses) implements Statement {}
        record While(Expression condition, List<Statement> body) implements Statement {}
        record For(String variable, Expression iterable, List<Statement> body) implements Statement {}
        record Return(Optional<Expression> value) implements Statement {}
        record Pass(Optional<String> comment) implements Statement {}
    }

    static class OutputEmitter {
        private static final int OR = 1;
        private static final int AND = 2;
        private static final int NOT = 3;
        private static final int COMPARISON = 4;
        private static final int ADDITIVE = 6;
        private static final int MULTIPLICATIVE = 7;
        private static final int UNARY = 8;
        private static final int POWER = 9;
        private static final int ATOM = 10;

        final Output output;
        final Writer writer;
        int indent = 0;
        boolean written = false;

        OutputEmitter(Output output, Writer writer) {
            this.output = output;
            this.writer = writer;
        }

        void emit() {
            if (output.header) {
                emitLineNl(HEADER);
            }
            if (output.importMath) {
                separate(1);
                emitLineNl("import math");
            }
            for (var helper : output.helpers) {
                separate(2);
                helper.lines.forEach(this::emitLineNl);
            }
            for (var function : output.functions) {
                separate(2);
                emitStatement(function);
            }
            if (!output.body.isEmpty()) {
                separate(2);
                output.body.forEach(this::emitStatement);
            }
            output.entryPoint.ifPresent(name -> {
                separate(2);
                emitLineNl("if __name__ == \"__main__\":");
                indent();
                emitLineNl(name + "()");
                outdent();
            });
        }

        private void separate(int blankLines) {
            if (written) {
                for (int i = 0; i < blankLines; i++) {
                    emit("\n");
                }
            }
        }

        void emitStatement(Output.Statement statement) {
            if (statement instanceof Output.Assignment a) {
                emitLineNl(a.name() + " = " + render(a.value()));
            } else if (statement instanceof Output.ExpressionStatement es) {
                emitLineNl(render(es.expression()));
            } else if (statement instanceof Output.Def def) {
                emitLineNl("def " + def.name() + "(" + String.join(", ", def.parameters()) + "):");
                indent();
                if (!def.globals().isEmpty()) {
                    emitLineNl("global " + String.join(", ", def.globals()));
                }
                if (!def.nonlocals().isEmpty()) {
                    emitLineNl("nonlocal " + String.join(", ", def.nonlocals()));
                }
                if (def.body().isEmpty() && def.globals().isEmpty() && def.nonlocals().isEmpty()) {
                    emitLineNl("pass");
                }
                def.body().forEach(this::emitStatement);
                outdent();
            } else if (statement instanceof Output.If i) {
                emitIf(i, "if");
            } else if (statement instanceof Output.While w) {
                emitLineNl("while " + render(w.condition()) + ":");
                emitSuite(w.body());
            } else if (statement instanceof Output.For f) {
                emitLineNl("for " + f.variable() + " in " + render(f.iterable()) + ":");
                emitSuite(f.body());
            } else if (statement instanceof Output.Return r) {
                emitLineNl(r.value().map(v -> "return " + render(v)).orElse("return"));
            } else if (statement instanceof Output.Pass p) {
                emitLineNl(p.comment().map(c -> "pass  # " + c.replace('\n', ' ')).orElse("pass"));
            } else {
                throw new IllegalStateException("not implemented: " + statement);
            }
        }

        private void emitIf(Output.If i, String keyword) {
            emitLineNl(keyword + " " + render(i.condition()) + ":");
            emitSuite(i.thens());
            if (i.elses().size() == 1 && i.elses().get(0) instanceof Output.If elif) {
                emitIf(elif, "elif");
            } else if (!i.elses().isEmpty()) {
                emitLineNl("else:");
                emitSuite(i.elses());
            }
        }

        private void emitSuite(List<Output.Statement> statements) {
            indent();
            if (statements.isEmpty()) {
                emitLineNl("pass");
            }
            statements.forEach(this::emitStatement);
            outdent();
        }

        String render(Output.Expression expression) {
            if (expression instanceof Output.Literal l) {
                return l.text();
            } else if (expression instanceof Output.NameExpression n) {
                return n.name();
            } else if (expression instanceof Output.Call c) {
                var sb = new StringBuilder(c.function()).append('(');
                for (int i = 0; i < c.arguments().size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(render(c.arguments().get(i)));
                }
                return sb.append(')').toString();
            } else if (expression instanceof Output.KeywordArgument k) {
                return k.name() + "=" + render(k.value());
            } else if (expression instanceof Output.NamedExpression n) {
                return "(" + n.name() + " := " + render(n.value()) + ")";
            } else if (expression instanceof Output.UnaryExpression u) {
                if (u.op().equals("not")) {
                    return "not " + renderOperand(u.operand(), NOT);
                }
                return u.op() + renderOperand(u.operand(), UNARY);
            } else if (expression instanceof Output.BinaryExpression b) {
                int p = precedence(b);
                String left;
                String right;
                if (p == POWER) {
                    left = renderOperand(b.left(), POWER + 1);
                    right = renderOperand(b.right(), UNARY);
                } else if (p == COMPARISON) {
                    // python would chain a < b < c
                    left = renderOperand(b.left(), COMPARISON + 1);
                    right = renderOperand(b.right(), COMPARISON + 1);
                } else {
                    left = renderOperand(b.left(), p);
                    right = renderOperand(b.right(), p + 1);
                }
                return left + " " + b.op() + " " + right;
            }
            throw new IllegalStateException("not implemented: " + expression);
        }

        private String renderOperand(Output.Expression operand, int minimumPrecedence) {
            var rendered = render(operand);
            return precedence(operand) < minimumPrecedence ? "(" + rendered + ")" : rendered;
        }

        private static int precedence(Output.Expression expression) {
            if (expression instanceof Output.BinaryExpression b) {
                return switch (b.op()) {
                    case "or" -> OR;
                    case "and" -> AND;
                    case "==", "!=", "<", "<=", ">", ">=" -> COMPARISON;
                    case "+", "-" -> ADDITIVE;
                    case "*", "/", "//", "%" -> MULTIPLICATIVE;
                    case "**" -> POWER;
                    default -> throw new IllegalStateException("unknown operator " + b.op());
                };
            } else if (expression instanceof Output.UnaryExpression u) {
                return u.op().equals("not") ? NOT : UNARY;
            }
            return ATOM;
        }

        void indent() {
            indent++;
        }

        void outdent() {
            indent--;
        }

        void emitLineNl(String line) {
            for (int i = 0; i < indent; i++) {
                emit("    ");
            }
            emit(line);
            emit("\n");
        }

        void emit(String text) {
            try {
                writer.append(text);
                written = true;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

}
