package com.plcopen.generator.codegen.xml.tc6;

import com.plcopen.generator.codegen.xml.XmlElement;

public class Content extends XmlElement<Content> {

    public static final String TAG = "content";

    public Content() {
        super(TAG);
    }

    public Content withDeclaration(String declaration) {
        return content(declaration);
    }
}
