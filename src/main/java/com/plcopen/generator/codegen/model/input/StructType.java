package com.plcopen.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class StructType implements DataType {

    @Singular("field")
    List<VariableDeclaration> fields;
}
