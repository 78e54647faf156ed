package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class InOutVariable extends XmlElement<InOutVariable> {

    public static final String TAG = "inOutVariable";

    public InOutVariable() {
        super(TAG, true);
    }

    public InOutVariable withExpression(String expression) {
        return child(Expression.of(expression));
    }
}
