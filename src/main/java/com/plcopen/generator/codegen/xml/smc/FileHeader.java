package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class FileHeader extends XmlElement<FileHeader> {

    public static final String TAG = "FileHeader";

    public FileHeader() {
        super(TAG);
    }
}
