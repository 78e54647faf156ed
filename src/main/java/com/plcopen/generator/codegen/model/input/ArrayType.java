package com.plcopen.generator.codegen.model.input;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ArrayType implements DataType {

    String elementTypeName;

    /** Bounds as written, e.g. {@code 0..9}. */
    String bounds;
}
