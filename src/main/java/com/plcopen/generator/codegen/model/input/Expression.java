package com.plcopen.generator.codegen.model.input;

/**
 * Initializer expression as handed over by the front-end. Only the shapes needed for
 * initial values and enumeration members are modelled.
 */
public interface Expression {
}
