package com.plcopen.generator.codegen.xml.tc6;

import java.util.List;

import com.plcopen.generator.codegen.xml.XmlElement;

public class InputVariables extends XmlElement<InputVariables> {

    public static final String TAG = "inputVariables";

    public InputVariables() {
        super(TAG);
    }

    public static InputVariables withVariables(List<Variable> variables) {
        return new InputVariables().children(variables);
    }
}
