package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class InVariable extends XmlElement<InVariable> {

    public static final String TAG = "inVariable";

    public InVariable() {
        super(TAG, true);
    }

    public InVariable connect(int refLocalId) {
        return child(ConnectionPointIn.to(refLocalId));
    }

    public InVariable withExpression(String expression) {
        return child(Expression.of(expression));
    }
}
