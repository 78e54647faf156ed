package com.plcopen.generator.codegen.xml.tc6;

import java.util.List;

import com.plcopen.generator.codegen.xml.XmlElement;

public class InOutVariables extends XmlElement<InOutVariables> {

    public static final String TAG = "inOutVariables";

    public InOutVariables() {
        super(TAG);
    }

    public static InOutVariables withVariables(List<Variable> variables) {
        return new InOutVariables().children(variables);
    }
}
