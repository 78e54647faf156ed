package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class OutVariable extends XmlElement<OutVariable> {

    public static final String TAG = "outVariable";

    public OutVariable() {
        super(TAG, true);
    }

    public OutVariable connect(int refLocalId) {
        return child(ConnectionPointIn.to(refLocalId));
    }

    public OutVariable connectName(int refLocalId, String formalParameter) {
        return child(ConnectionPointIn.to(refLocalId, formalParameter));
    }

    public OutVariable withExpression(String expression) {
        return child(Expression.of(expression));
    }
}
