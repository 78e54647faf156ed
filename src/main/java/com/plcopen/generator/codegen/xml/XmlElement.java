package com.plcopen.generator.codegen.xml;

import java.util.List;

/**
 * Base for the typed element builders. Each subclass binds one fixed schema tag and
 * delegates storage to a single {@link XmlNode}.
 *
 * @param <T> the concrete element type, returned from every chained call
 */
public abstract class XmlElement<T extends XmlElement<T>> implements XmlNodeSource {

    public static final String NEGATED = "negated";
    public static final String LOCAL_ID = "localId";
    public static final String REF_LOCAL_ID = "refLocalId";
    public static final String EXECUTION_ORDER_ID = "executionOrderId";

    private final XmlNode node;

    protected XmlElement(String tag) {
        this(tag, false);
    }

    /**
     * @param negatable elements that may be logically negated start with {@code negated="false"}
     */
    protected XmlElement(String tag, boolean negatable) {
        this.node = new XmlNode(tag);
        if (negatable) {
            node.attribute(NEGATED, "false");
        }
    }

    @SuppressWarnings("unchecked")
    protected final T self() {
        return (T) this;
    }

    public T attribute(String key, String value) {
        node.attribute(key, value);
        return self();
    }

    /**
     * Sets the attribute only when a value is present.
     */
    public T maybeAttribute(String key, String value) {
        if (value != null) {
            node.attribute(key, value);
        }
        return self();
    }

    public T withId(Object localId) {
        return attribute(LOCAL_ID, String.valueOf(localId));
    }

    public T withRefId(Object refLocalId) {
        return attribute(REF_LOCAL_ID, String.valueOf(refLocalId));
    }

    public T withExecutionId(Object executionOrderId) {
        return attribute(EXECUTION_ORDER_ID, String.valueOf(executionOrderId));
    }

    public T child(XmlNodeSource source) {
        node.child(source);
        return self();
    }

    public T children(List<? extends XmlNodeSource> sources) {
        node.children(sources);
        return self();
    }

    public T close() {
        node.close();
        return self();
    }

    public T content(String text) {
        node.content(text);
        return self();
    }

    /**
     * Snapshot of the wrapped node.
     */
    @Override
    public XmlNode toNode() {
        return node.copy();
    }

    public String serialize() {
        return node.serialize(0);
    }

    @Override
    public String toString() {
        return serialize();
    }
}
