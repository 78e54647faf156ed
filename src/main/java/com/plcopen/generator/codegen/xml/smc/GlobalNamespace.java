package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Anchor under which data type declarations and POUs are appended.
 */
public class GlobalNamespace extends XmlElement<GlobalNamespace> {

    public static final String TAG = "GlobalNamespace";

    public GlobalNamespace() {
        super(TAG);
    }
}
