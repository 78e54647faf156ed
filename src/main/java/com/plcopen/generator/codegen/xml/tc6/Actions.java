package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Actions extends XmlElement<Actions> {

    public static final String TAG = "actions";

    public Actions() {
        super(TAG);
    }
}
