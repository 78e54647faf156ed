package com.plcopen.generator.codegen.model.input;

import lombok.NonNull;
import lombok.Value;

/**
 * Literal as written in the source, e.g. {@code 42}, {@code 3.5}, {@code TRUE}, {@code 'abc'}.
 */
@Value
public class LiteralExpression implements Expression {

    @NonNull
    String value;

    public static LiteralExpression of(String value) {
        return new LiteralExpression(value);
    }

    public static LiteralExpression of(long value) {
        return new LiteralExpression(Long.toString(value));
    }
}
