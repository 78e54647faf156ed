package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;
import com.plcopen.generator.codegen.xml.XmlNodeSource;

public class AddData extends XmlElement<AddData> {

    public static final String TAG = "AddData";

    public AddData() {
        super(TAG);
    }

    /**
     * Wraps a vendor property in {@code <AddData><Data name="Smc" handleUnknown="discard">}.
     */
    public static AddData vendor(XmlNodeSource property) {
        return new AddData().child(new Data()
                .attribute(SmcSchema.ATTR_NAME, SmcSchema.SMC_NAMESPACE)
                .attribute(SmcSchema.ATTR_HANDLE_UNKNOWN, "discard")
                .child(property));
    }
}
