package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Document root carrying the fixed namespace and schema location attributes.
 */
public class Project extends XmlElement<Project> {

    public static final String TAG = "Project";

    public Project() {
        super(TAG);
    }

    public static Project omron() {
        return new Project()
                .attribute("xmlns:xsi", SmcSchema.XSI_NAMESPACE)
                .attribute("xmlns:smcext", SmcSchema.SMC_NAMESPACE)
                .attribute("xsi:schemaLocation", SmcSchema.OMRON_SCHEMA)
                .attribute("schemaVersion", SmcSchema.SCHEMA_VERSION)
                .attribute("xmlns", SmcSchema.IEC_NAMESPACE);
    }
}
