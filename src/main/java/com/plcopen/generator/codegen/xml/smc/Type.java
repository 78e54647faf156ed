package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Type extends XmlElement<Type> {

    public static final String TAG = "Type";

    public Type() {
        super(TAG);
    }

    /**
     * {@code <Type><TypeName>typeName</TypeName></Type>}
     */
    public static Type named(String typeName) {
        return new Type().child(new TypeName().content(typeName));
    }
}
