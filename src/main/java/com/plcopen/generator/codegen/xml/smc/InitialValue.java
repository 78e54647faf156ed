package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class InitialValue extends XmlElement<InitialValue> {

    public static final String TAG = "InitialValue";

    public InitialValue() {
        super(TAG);
    }

    /**
     * {@code <InitialValue><SimpleValue value="..."/></InitialValue>}
     */
    public static InitialValue simple(String value) {
        return new InitialValue().child(new SimpleValue().attribute(SmcSchema.ATTR_VALUE, value).close());
    }
}
