package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Field of a structured data type.
 */
public class Member extends XmlElement<Member> {

    public static final String TAG = "Member";

    public Member() {
        super(TAG);
    }

    public static Member of(String name, String typeName) {
        return new Member()
                .attribute(SmcSchema.ATTR_NAME, name)
                .child(Type.named(typeName));
    }
}
