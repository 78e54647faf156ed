package com.plcopen.generator.codegen.model.input;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class VariableBlock {

    @NonNull
    VariableBlockType type;

    boolean constant;

    boolean retain;

    @Singular("variable")
    List<VariableDeclaration> variables;
}
