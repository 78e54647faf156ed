package com.plcopen.generator.codegen.xml;

/**
 * Anything that can be folded into a parent element.
 */
public interface XmlNodeSource {

    /**
     * Returns the node backing this source. Parents copy the returned node when attaching it.
     */
    XmlNode toNode();
}
