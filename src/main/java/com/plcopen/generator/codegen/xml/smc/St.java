package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Structured Text leaf. Its content is written as CDATA.
 */
public class St extends XmlElement<St> {

    public static final String TAG = "ST";

    public St() {
        super(TAG);
    }
}
