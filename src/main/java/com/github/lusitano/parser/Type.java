package com.github.lusitano.parser;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Type {

    public static class Builtin {
        public static final Type INTEIRO = new Type("inteiro");
        public static final Type REAL = new Type("real");
        public static final Type TEXTO = new Type("texto");
        public static final Type LOGICO = new Type("logico");
        public static final Type VAZIO = new Type("vazio");

        /** Type of an expression that failed to type check. Never causes further diagnostics. */
        public static final Type ERROR = new Type("<erro>");
        /** Accepts any value; only used as the parameter type of the conversion built-ins. */
        public static final Type ANY = new Type("<qualquer>");
    }

    @Accessors(fluent = true)
    @Getter
    private final String name;

    /** Looks up a type by the keyword that names it in source code. */
    public static Optional<Type> named(String keyword) {
        return Optional.ofNullable(switch (keyword) {
            case "inteiro" -> Builtin.INTEIRO;
            case "real" -> Builtin.REAL;
            case "texto" -> Builtin.TEXTO;
            case "logico" -> Builtin.LOGICO;
            case "vazio" -> Builtin.VAZIO;
            default -> null;
        });
    }

    public static FunctionType function(Type returnType, List<Type> parameters) {
        return new FunctionType(returnType, List.copyOf(parameters));
    }

    public boolean isNumeric() {
        return this == Builtin.INTEIRO || this == Builtin.REAL;
    }

    public boolean isError() {
        return this == Builtin.ERROR;
    }

    @Override
    public String toString() {
        return name;
    }

    public static class FunctionType extends Type {
        @Accessors(fluent = true)
        @Getter
        private final Type returnType;
        @Accessors(fluent = true)
        @Getter
        private final List<Type> parameters;

        FunctionType(Type returnType, List<Type> parameters) {
            super(parameters.stream().map(Type::toString).collect(Collectors.joining(", ", "funcao(", "): ")) + returnType);
            this.returnType = returnType;
            this.parameters = parameters;
        }
    }
}
