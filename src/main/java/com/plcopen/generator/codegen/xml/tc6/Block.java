package com.plcopen.generator.codegen.xml.tc6;

import java.util.List;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Call of a function or function block inside an FBD network.
 */
public class Block extends XmlElement<Block> {

    public static final String TAG = "block";

    public Block() {
        super(TAG);
    }

    public static Block init(String typeName, int localId, int executionOrderId) {
        return new Block().withName(typeName).withId(localId).withExecutionId(executionOrderId);
    }

    public Block withName(String typeName) {
        return attribute("typeName", typeName);
    }

    public Block withInput(List<Variable> variables) {
        return child(InputVariables.withVariables(variables));
    }

    public Block withOutput(List<Variable> variables) {
        return child(OutputVariables.withVariables(variables));
    }

    public Block withInOut(List<Variable> variables) {
        return child(InOutVariables.withVariables(variables));
    }
}
