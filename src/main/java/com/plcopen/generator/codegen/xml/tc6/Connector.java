package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Connector extends XmlElement<Connector> {

    public static final String TAG = "connector";

    public Connector() {
        super(TAG);
    }

    public Connector withName(String name) {
        return attribute(Tc6Schema.ATTR_NAME, name);
    }

    public Connector connect(int refLocalId) {
        return child(ConnectionPointIn.to(refLocalId));
    }
}
