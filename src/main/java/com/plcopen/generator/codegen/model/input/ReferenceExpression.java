package com.plcopen.generator.codegen.model.input;

import lombok.NonNull;
import lombok.Value;

@Value
public class ReferenceExpression implements Expression {

    @NonNull
    String name;

    public static ReferenceExpression of(String name) {
        return new ReferenceExpression(name);
    }
}
