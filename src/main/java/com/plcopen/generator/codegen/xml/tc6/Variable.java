package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Formal parameter slot of a {@link Block}.
 */
public class Variable extends XmlElement<Variable> {

    public static final String TAG = "variable";

    public Variable() {
        super(TAG, true);
    }

    public Variable withName(String formalParameter) {
        return attribute(Tc6Schema.ATTR_FORMAL_PARAMETER, formalParameter);
    }

    public Variable connect(int refLocalId) {
        return child(ConnectionPointIn.to(refLocalId));
    }

    public Variable connectOut(int refLocalId) {
        return child(ConnectionPointOut.to(refLocalId));
    }
}
