package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Underlying numeric type of an enumeration.
 */
public class BaseType extends XmlElement<BaseType> {

    public static final String TAG = "BaseType";

    public BaseType() {
        super(TAG);
    }

    public static BaseType named(String typeName) {
        return new BaseType().child(new TypeName().content(typeName));
    }
}
