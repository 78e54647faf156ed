package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Jump extends XmlElement<Jump> {

    public static final String TAG = "jump";

    public Jump() {
        super(TAG);
    }

    public Jump withName(String label) {
        return attribute(Tc6Schema.ATTR_LABEL, label);
    }

    public Jump connect(int refLocalId) {
        return child(ConnectionPointIn.to(refLocalId));
    }

    public Jump negate() {
        return child(Negated.asAddData(true));
    }
}
