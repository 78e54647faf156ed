package com.plcopen.generator.codegen.model.input;

import lombok.NonNull;
import lombok.Value;

@Value
public class UnaryExpression implements Expression {

    @NonNull
    Operator operator;

    @NonNull
    Expression value;

    public static UnaryExpression negate(Expression value) {
        return new UnaryExpression(Operator.MINUS, value);
    }
}
