package com.plcopen.generator.codegen.model.input;

/**
 * Kind of a {@code VAR...END_VAR} section.
 */
public enum VariableBlockType {
    LOCAL,
    TEMP,
    INPUT,
    OUTPUT,
    IN_OUT,
    GLOBAL,
    EXTERNAL
}
