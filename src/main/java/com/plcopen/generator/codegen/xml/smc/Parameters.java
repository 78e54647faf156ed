package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Parameters extends XmlElement<Parameters> {

    public static final String TAG = "Parameters";

    public Parameters() {
        super(TAG);
    }
}
