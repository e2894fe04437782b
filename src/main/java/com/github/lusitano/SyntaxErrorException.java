package com.github.lusitano;

import com.github.lusitano.Tokenizer.Token;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown by the parser when the next token does not fit the production being parsed. It never
 * leaves the parser: the enclosing declaration turns it into a diagnostic and resynchronizes.
 */
@Getter
@Accessors(fluent = true)
public class SyntaxErrorException extends RuntimeException {

    private final String expected;
    private final Token found;

    public SyntaxErrorException(String message, String expected, Token found) {
        super(message);
        this.expected = expected;
        this.found = found;
    }

}
