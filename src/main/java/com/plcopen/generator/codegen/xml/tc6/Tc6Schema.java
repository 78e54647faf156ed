package com.plcopen.generator.codegen.xml.tc6;

import lombok.experimental.UtilityClass;

/**
 * Constants of the PLCopen TC6 0201 graphical schema.
 */
@UtilityClass
public class Tc6Schema {

    public static final String NAMESPACE = "http://www.plcopen.org/xml/tc6_0201";
    public static final String DECLARATION_DATA_NAME = "www.bachmann.at/plc/plcopenxml";

    public static final String ATTR_NAME = "name";
    public static final String ATTR_VALUE = "value";
    public static final String ATTR_LABEL = "label";
    public static final String ATTR_FORMAL_PARAMETER = "formalParameter";
}
