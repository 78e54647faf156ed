package com.plcopen.generator.codegen.xml.smc;

import lombok.experimental.UtilityClass;

/**
 * Fixed names and namespace values of the Sysmac Studio flavour of IEC 61131-10 XML.
 */
@UtilityClass
public class SmcSchema {

    public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String SMC_NAMESPACE = "https://www.ia.omron.com/Smc";
    public static final String IEC_NAMESPACE = "www.iec.ch/public/TC65SC65BWG7TF10";
    public static final String OMRON_SCHEMA = SMC_NAMESPACE + " IEC61131_10_Ed1_0_SmcExt1_0_Spc1_0.xsd";
    public static final String SCHEMA_VERSION = "1";

    public static final String COMPANY_NAME = "OMRON Corporation";
    public static final String PRODUCT_NAME = "Sysmac Studio";
    public static final String PRODUCT_VERSION = "1.30.0.0";

    /** Sysmac rejects unbounded strings; the largest fixed width it accepts. */
    public static final String STRING_PLACEHOLDER_TYPE = "STRING[1986]";

    public static final String DEFAULT_RESULT_TYPE = "BOOL";
    public static final String POU_VERSION_PLACEHOLDER = "0.0.0";

    public static final String ATTR_NAME = "name";
    public static final String ATTR_VALUE = "value";
    public static final String ATTR_CONSTANT = "constant";
    public static final String ATTR_RETAIN = "retain";
    public static final String ATTR_ORDER_WITHIN_PARAM_SET = "orderWithinParamSet";
    public static final String ATTR_CREATION_DATE_TIME = "creationDateTime";
    public static final String ATTR_VERSION = "version";
    public static final String ATTR_HANDLE_UNKNOWN = "handleUnknown";
    public static final String ATTR_XSI_TYPE = "xsi:type";
}
