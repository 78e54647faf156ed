package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Enumerator extends XmlElement<Enumerator> {

    public static final String TAG = "Enumerator";

    public Enumerator() {
        super(TAG);
    }

    public static Enumerator of(String name, String value) {
        return new Enumerator()
                .attribute(SmcSchema.ATTR_NAME, name)
                .attribute(SmcSchema.ATTR_VALUE, value)
                .close();
    }
}
