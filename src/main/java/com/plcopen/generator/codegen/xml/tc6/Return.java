package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Return extends XmlElement<Return> {

    public static final String TAG = "return";

    public Return() {
        super(TAG);
    }

    public static Return init(int localId, int executionOrderId) {
        return new Return().withId(localId).withExecutionId(executionOrderId);
    }

    public Return connect(int refLocalId) {
        return child(ConnectionPointIn.to(refLocalId));
    }

    public Return negate(boolean value) {
        return child(Negated.asAddData(value));
    }
}
