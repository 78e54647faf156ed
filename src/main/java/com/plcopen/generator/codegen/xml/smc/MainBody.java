package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

public class MainBody extends XmlElement<MainBody> {

    public static final String TAG = "MainBody";

    public MainBody() {
        super(TAG);
    }

    /**
     * {@code <MainBody><BodyContent xsi:type="ST"><ST>text</ST></BodyContent></MainBody>}
     */
    public static MainBody structuredText(String text) {
        return new MainBody().child(new BodyContent()
                .attribute(SmcSchema.ATTR_XSI_TYPE, "ST")
                .child(new St().content(text)));
    }
}
