package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Inline ST expression, e.g. {@code <expression>a + b</expression>}.
 */
public class Expression extends XmlElement<Expression> {

    public static final String TAG = "expression";

    public Expression() {
        super(TAG);
    }

    public static Expression of(String expression) {
        return new Expression().content(expression);
    }
}
