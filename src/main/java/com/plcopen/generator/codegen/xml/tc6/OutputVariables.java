package com.plcopen.generator.codegen.xml.tc6;

import java.util.List;

import com.plcopen.generator.codegen.xml.XmlElement;

public class OutputVariables extends XmlElement<OutputVariables> {

    public static final String TAG = "outputVariables";

    public OutputVariables() {
        super(TAG);
    }

    public static OutputVariables withVariables(List<Variable> variables) {
        return new OutputVariables().children(variables);
    }
}
