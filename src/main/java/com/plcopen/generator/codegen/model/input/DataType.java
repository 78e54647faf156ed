package com.plcopen.generator.codegen.model.input;

/**
 * Body of a user-defined type declaration.
 */
public interface DataType {
}
