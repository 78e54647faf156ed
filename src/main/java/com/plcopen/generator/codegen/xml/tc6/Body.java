package com.plcopen.generator.codegen.xml.tc6;

import java.util.List;

import com.plcopen.generator.codegen.xml.XmlElement;
import com.plcopen.generator.codegen.xml.XmlNodeSource;

public class Body extends XmlElement<Body> {

    public static final String TAG = "body";

    public Body() {
        super(TAG);
    }

    /**
     * {@code <body><FBD>children</FBD></body>}
     */
    public static Body withFbd(List<? extends XmlNodeSource> children) {
        return new Body().child(new Fbd().children(children));
    }
}
