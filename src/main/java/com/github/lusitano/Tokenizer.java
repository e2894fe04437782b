package com.github.lusitano;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.github.lusitano.diagnostics.Diagnostic.Kind;
import com.github.lusitano.diagnostics.Diagnostics;

public class Tokenizer {

    static final Map<String, TokenType> KEYWORDS = Arrays.stream(TokenType.values())
            .filter(TokenType::isKeyword)
            .collect(Collectors.toUnmodifiableMap(t -> t.constantPattern, Function.identity()));

    private static final List<Pattern> PATTERNS = buildPatterns();

    private static List<Pattern> buildPatterns() {
        List<Pattern> patterns = new ArrayList<>();
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && !tokenType.isKeyword()) {
                patterns.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }

        patterns.add(new IdentifierPattern());
        patterns.add(new NumberPattern());
        patterns.add(new StringPattern());
        patterns.add(new CommentPattern());

        // comments before "/", longer operators before their prefixes
        patterns.sort(Comparator.comparingInt(Tokenizer::priority).reversed());
        return List.copyOf(patterns);
    }

    private static int priority(Pattern pattern) {
        if (pattern instanceof CommentPattern) {
            return Integer.MAX_VALUE;
        }
        if (pattern instanceof StaticPattern sp) {
            return sp.pattern.length();
        }
        return Integer.MIN_VALUE;
    }

    /**
     * Scans the whole program. Unrecognized characters and malformed literals are reported to
     * {@code diagnostics} and skipped, so the returned token list is always complete and ends
     * with an {@link TokenType#EOF} token.
     */
    public Tokens tokenize(String programString, Diagnostics diagnostics) {
        var source = new Source(programString);
        List<Token> tokens = new ArrayList<>();

        int index = 0;
        while (index < programString.length()) {
            if (Character.isWhitespace(programString.charAt(index))) {
                index++;
                continue;
            }

            boolean gotMatch = false;
            for (var pattern : PATTERNS) {
                var result = pattern.match(source, index, diagnostics);
                if (result.isPresent()) {
                    result.get().token().ifPresent(tokens::add);
                    index = result.get().end();
                    gotMatch = true;
                    break;
                }
            }
            if (!gotMatch) {
                char c = programString.charAt(index);
                String message = c == '!'
                        ? "unexpected character '!'; use 'nao' for negation or '!=' for inequality"
                        : "unrecognized character '" + c + "' (code " + (int) c + ")";
                diagnostics.report(Kind.LEXICAL_ERROR, message, source.line(index), source.column(index));
                index++;
            }
        }

        tokens.add(source.token(TokenType.EOF, index, index, null));

        return new Tokens(tokens);
    }

    /** Source text with a precomputed line index, used to turn offsets into line and column. */
    static class Source {
        final String text;
        private final int[] lineStarts;

        Source(String text) {
            this.text = text;
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }

        int line(int index) {
            int pos = Arrays.binarySearch(lineStarts, index);
            return (pos >= 0 ? pos : -pos - 2) + 1;
        }

        int column(int index) {
            return index - lineStarts[line(index) - 1] + 1;
        }

        int length() {
            return text.length();
        }

        char charAt(int index) {
            return index < text.length() ? text.charAt(index) : '\0';
        }

        Token token(TokenType type, int start, int end, Object value) {
            return new Token(type, text.substring(start, end), value, line(start), column(start));
        }
    }

    record Match(Optional<Token> token, int end) {
        static Match of(Token token, int end) {
            return new Match(Optional.of(token), end);
        }
        static Match skip(int end) {
            return new Match(Optional.empty(), end);
        }
    }

    interface Pattern {
        Optional<Match> match(Source source, int index, Diagnostics diagnostics);
    }

    static class StaticPattern implements Pattern {
        String pattern;
        TokenType tokenType;

        public StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Match> match(Source source, int index, Diagnostics diagnostics) {
            if (source.text.startsWith(pattern, index)) {
                int end = index + pattern.length();
                return Optional.of(Match.of(source.token(tokenType, index, end, null), end));
            } else {
                return Optional.empty();
            }
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Match> match(Source source, int index, Diagnostics diagnostics) {
            if (!Character.isDigit(source.charAt(index))) {
                return Optional.empty();
            }
            int start = index;
            while (Character.isDigit(source.charAt(index))) {
                index++;
            }
            boolean isReal = false;
            if (source.charAt(index) == '.' && Character.isDigit(source.charAt(index + 1))) {
                isReal = true;
                index++;
                while (Character.isDigit(source.charAt(index))) {
                    index++;
                }
            }
            char e = source.charAt(index);
            if (e == 'e' || e == 'E') {
                char next = source.charAt(index + 1);
                boolean signed = next == '+' || next == '-';
                if (Character.isDigit(next) || (signed && Character.isDigit(source.charAt(index + 2)))) {
                    isReal = true;
                    index += signed ? 2 : 1;
                    while (Character.isDigit(source.charAt(index))) {
                        index++;
                    }
                } else if (signed) {
                    diagnostics.report(Kind.LEXICAL_ERROR,
                            "malformed exponent in number literal, expected a digit after '" + e + next + "'",
                            source.line(index), source.column(index));
                    return Optional.of(Match.skip(index + 2));
                }
            }

            String image = source.text.substring(start, index);
            if (isReal) {
                return Optional.of(Match.of(source.token(TokenType.DECIMAL, start, index, Double.parseDouble(image)), index));
            }
            long value;
            try {
                value = Long.parseLong(image);
            } catch (NumberFormatException ex) {
                diagnostics.report(Kind.LEXICAL_ERROR, "integer literal " + image + " is out of range",
                        source.line(start), source.column(start));
                value = 0;
            }
            return Optional.of(Match.of(source.token(TokenType.NUMBER, start, index, value), index));
        }
    }

    static class IdentifierPattern implements Pattern {
        @Override
        public Optional<Match> match(Source source, int index, Diagnostics diagnostics) {
            char first = source.charAt(index);
            if (Character.isLetter(first) || first == '_') {
                int start = index;
                while (Character.isLetterOrDigit(source.charAt(index)) || source.charAt(index) == '_') {
                    index++;
                }
                String image = source.text.substring(start, index);
                var type = KEYWORDS.getOrDefault(image, TokenType.IDENTIFIER);
                return Optional.of(Match.of(source.token(type, start, index, null), index));
            } else {
                return Optional.empty();
            }
        }
    }

    static class StringPattern implements Pattern {
        @Override
        public Optional<Match> match(Source source, int index, Diagnostics diagnostics) {
            char quote = source.charAt(index);
            if (quote != '"' && quote != '\'') {
                return Optional.empty();
            }
            int start = index;
            index++;
            var value = new StringBuilder();
            while (index < source.length()) {
                char cur = source.charAt(index);
                if (cur == quote) {
                    index++;
                    return Optional.of(Match.of(source.token(TokenType.STRING, start, index, value.toString()), index));
                }
                if (cur == '\n') {
                    break;
                }
                if (cur == '\\' && index + 1 < source.length() && source.charAt(index + 1) != '\n') {
                    char escaped = source.charAt(index + 1);
                    switch (escaped) {
                        case 'n' -> value.append('\n');
                        case 't' -> value.append('\t');
                        case 'r' -> value.append('\r');
                        case '\\', '"', '\'' -> value.append(escaped);
                        default -> value.append('\\').append(escaped);
                    }
                    index += 2;
                    continue;
                }
                value.append(cur);
                index++;
            }
            diagnostics.report(Kind.LEXICAL_ERROR,
                    index >= source.length() ? "unterminated string literal, reached end of file"
                            : "unterminated string literal, reached end of line",
                    source.line(start), source.column(start));
            return Optional.of(Match.skip(index));
        }
    }

    static class CommentPattern implements Pattern {
        @Override
        public Optional<Match> match(Source source, int index, Diagnostics diagnostics) {
            if (source.text.startsWith("//", index)) {
                index += 2;
                while (index < source.length() && source.charAt(index) != '\n') {
                    index++;
                }
                return Optional.of(Match.skip(index));
            } else if (source.text.startsWith("/*", index)) {
                int close = source.text.indexOf("*/", index + 2);
                if (close < 0) {
                    diagnostics.report(Kind.LEXICAL_ERROR, "unterminated block comment",
                            source.line(index), source.column(index));
                    return Optional.of(Match.skip(source.length()));
                }
                return Optional.of(Match.skip(close + 2));
            } else {
                return Optional.empty();
            }
        }
    }

    public record Token(TokenType type, String image, Object value, int line, int column) {
        public String describe() {
            return switch (type) {
                case EOF -> "end of file";
                case IDENTIFIER -> "identifier '" + image + "'";
                case NUMBER, DECIMAL -> "number " + image;
                case STRING -> "string " + image;
                default -> type.describe();
            };
        }
    }

    public enum TokenType {
        FUNCAO("funcao"),
        RETORNA("retorna"),
        VAR("var"),
        CONST("const"),
        SE("se"),
        SENAO("senao"),
        SENAOSE("senaose"),
        ENQUANTO("enquanto"),
        PARA("para"),
        DE("de"),
        ATE("ate"),
        PASSO("passo"),
        ESCREVA("escreva"),
        LEIA("leia"),
        E("e"),
        OU("ou"),
        NAO("nao"),
        VERDADEIRO("verdadeiro"),
        FALSO("falso"),

        INTEIRO("inteiro"),
        REAL("real"),
        TEXTO("texto"),
        LOGICO("logico"),
        VAZIO("vazio"),

        NUMBER,
        DECIMAL,
        STRING,

        EQUALS_EQUALS("=="), NOT_EQUALS("!="),
        LE("<="), GE(">="), LT("<"), GT(">"),
        PLUS_EQUALS("+="), MINUS_EQUALS("-="), STAR_EQUALS("*="), SLASH_EQUALS("/="),
        PLUS("+"), MINUS("-"),
        STAR_STAR("**"), STAR("*"), SLASH("/"), PERCENT("%"),

        LBRACE("{"),
        RBRACE("}"),
        LPAREN("("),
        RPAREN(")"),

        COLON(":"),
        SEMICOLON(";"),
        EQUALS("="),
        IDENTIFIER,
        COMMA(","),
        EOF;

        public final String constantPattern;

        private TokenType() {
            this(null);
        }
        private TokenType(String constantPattern) {
            this.constantPattern = constantPattern;
        }

        public boolean isKeyword() {
            return constantPattern != null && Character.isLetter(constantPattern.charAt(0));
        }

        public String describe() {
            return switch (this) {
                case NUMBER -> "integer literal";
                case DECIMAL -> "real literal";
                case STRING -> "string literal";
                case IDENTIFIER -> "identifier";
                case EOF -> "end of file";
                default -> "'" + constantPattern + "'";
            };
        }
    }

    public static class Tokens {
        final List<Token> tokens;
        int index;

        Tokens(List<Token> tokens) {
            this.tokens = tokens;
        }

        public Token next() {
            var token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        public Token peek() {
            return tokens.get(index);
        }

        /** Bounded lookahead; {@code offset} 0 is the current token. */
        public Token peek(int offset) {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        public boolean skip(TokenType type) {
            if (matches(type)) {
                next();
                return true;
            }
            return false;
        }

        public Token next(TokenType type) {
            var token = peek();
            if (token.type() != type) {
                throw new SyntaxErrorException("expected " + type.describe() + " but found " + token.describe(),
                        type.describe(), token);
            }
            return next();
        }

        public int position() {
            return index;
        }

        public int size() {
            return tokens.size();
        }

        public List<Token> asList() {
            return List.copyOf(tokens);
        }
    }

}
