package com.plcopen.generator.codegen.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Enumeration with explicit numeric values, e.g. {@code (RED := 1, GREEN := 2)}.
 */
@Value
@Builder
public class EnumType implements DataType {

    @NonNull
    @Builder.Default
    String numericType = "INT";

    /**
     * One assignment, or an {@link ExpressionList} of assignments.
     */
    Expression elements;
}
