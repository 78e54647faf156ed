package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Continuation extends XmlElement<Continuation> {

    public static final String TAG = "continuation";

    public Continuation() {
        super(TAG);
    }

    public Continuation withName(String name) {
        return attribute(Tc6Schema.ATTR_NAME, name);
    }

    public Continuation connectOut(int refLocalId) {
        return child(ConnectionPointOut.to(refLocalId));
    }
}
