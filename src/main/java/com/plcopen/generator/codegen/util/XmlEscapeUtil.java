package com.plcopen.generator.codegen.util;

import lombok.experimental.UtilityClass;

/**
 * Escaping rules for attribute values, text and CDATA sections.
 */
@UtilityClass
public class XmlEscapeUtil {

    private static final String CDATA_END = "]]>";

    public static String escapeAttribute(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\n' -> sb.append("&#10;");
                case '\r' -> sb.append("&#13;");
                case '\t' -> sb.append("&#9;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String escapeText(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    /**
     * Wraps text in one or more CDATA sections. A literal {@code ]]>} is split across two sections.
     */
    public static String toCData(String value) {
        String text = value == null ? "" : value;
        return "<![CDATA[" + text.replace(CDATA_END, "]]]]><![CDATA[>") + "]]>";
    }
}
