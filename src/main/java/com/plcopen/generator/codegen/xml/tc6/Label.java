package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Label extends XmlElement<Label> {

    public static final String TAG = "label";

    public Label() {
        super(TAG);
    }

    public Label withName(String label) {
        return attribute(Tc6Schema.ATTR_LABEL, label);
    }
}
