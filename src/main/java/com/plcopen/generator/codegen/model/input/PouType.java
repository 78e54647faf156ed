package com.plcopen.generator.codegen.model.input;

public enum PouType {
    PROGRAM,
    FUNCTION,
    FUNCTION_BLOCK,
    ACTION,
    CLASS,
    METHOD,
    INIT
}
