package com.plcopen.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class ExpressionList implements Expression {

    @Singular("element")
    List<Expression> elements;

    public static ExpressionList of(Expression... elements) {
        return new ExpressionList(List.of(elements));
    }
}
