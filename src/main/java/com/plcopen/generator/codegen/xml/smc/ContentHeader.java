package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class ContentHeader extends XmlElement<ContentHeader> {

    public static final String TAG = "ContentHeader";

    public ContentHeader() {
        super(TAG);
    }

    public static ContentHeader of(String projectName, String creationDateTime) {
        return new ContentHeader()
                .attribute(SmcSchema.ATTR_NAME, projectName)
                .attribute(SmcSchema.ATTR_CREATION_DATE_TIME, creationDateTime);
    }
}
