package com.plcopen.generator.codegen.model.input;

public enum Operator {
    PLUS,
    MINUS,
    MULTIPLY,
    DIVIDE,
    MODULO,
    NOT,
    AND,
    OR,
    XOR
}
