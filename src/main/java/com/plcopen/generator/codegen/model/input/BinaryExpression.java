package com.plcopen.generator.codegen.model.input;

import lombok.NonNull;
import lombok.Value;

@Value
public class BinaryExpression implements Expression {

    @NonNull
    Operator operator;

    @NonNull
    Expression left;

    @NonNull
    Expression right;
}
