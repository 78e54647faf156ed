package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Anchor under which per-unit configurations are appended.
 */
public class Instances extends XmlElement<Instances> {

    public static final String TAG = "Instances";

    public Instances() {
        super(TAG);
    }
}
