package com.plcopen.generator.codegen.model.input;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code left := right}, used for enumeration members such as {@code RED := 1}.
 */
@Value
public class AssignmentExpression implements Expression {

    @NonNull
    Expression left;

    @NonNull
    Expression right;

    public static AssignmentExpression of(String name, Expression value) {
        return new AssignmentExpression(ReferenceExpression.of(name), value);
    }
}
