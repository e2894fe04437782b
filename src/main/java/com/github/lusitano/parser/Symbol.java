package com.github.lusitano.parser;

/**
 * A declared name. {@code scope} is the index of the owning scope in {@link Scopes}, so two
 * declarations of the same name in different scopes are distinct symbols.
 */
public record Symbol(String name, Type type, Category category, int scope, int line, int column) {

    public enum Category {
        VARIABLE, CONSTANT, FUNCTION, PARAMETER, BUILTIN;

        public boolean isCallable() {
            return this == FUNCTION || this == BUILTIN;
        }

        public boolean isAssignable() {
            return this == VARIABLE || this == PARAMETER;
        }
    }

}
