package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class TextDeclaration extends XmlElement<TextDeclaration> {

    public static final String TAG = "textDeclaration";

    public TextDeclaration() {
        super(TAG);
    }
}
