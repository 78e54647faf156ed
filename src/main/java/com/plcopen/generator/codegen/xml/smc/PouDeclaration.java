package com.plcopen.generator.codegen.xml.smc;

import com.plcopen.generator.codegen.xml.XmlElement;

/**
 * Shared helpers of {@link Program}, {@link Function} and {@link FunctionBlock}.
 */
public abstract class PouDeclaration<T extends PouDeclaration<T>> extends XmlElement<T> {

    protected PouDeclaration(String tag) {
        super(tag);
    }

    public T withName(String name) {
        return attribute(SmcSchema.ATTR_NAME, name);
    }

    public T withResultType(String typeName) {
        return child(ResultType.named(typeName));
    }

    public T withMetadata(String creationDateTime) {
        return child(AddData.vendor(PouInfo.of(creationDateTime, SmcSchema.POU_VERSION_PLACEHOLDER)));
    }

    public T withBody(String structuredText) {
        return child(MainBody.structuredText(structuredText));
    }

    /**
     * Whether the schema expects a {@code ResultType} on this kind of POU.
     */
    public abstract boolean hasResultType();
}
