package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class BodyContent extends XmlElement<BodyContent> {

    public static final String TAG = "BodyContent";

    public BodyContent() {
        super(TAG);
    }
}
