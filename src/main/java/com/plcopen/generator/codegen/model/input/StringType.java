package com.plcopen.generator.codegen.model.input;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StringType implements DataType {

    boolean wide;

    /** Declared length; {@code null} for the default length. */
    Integer size;
}
