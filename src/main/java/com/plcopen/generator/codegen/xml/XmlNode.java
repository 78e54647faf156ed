package com.plcopen.generator.codegen.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.plcopen.generator.codegen.util.XmlEscapeUtil;

/**
 * Generic XML element: a tag name, attributes, ordered children and an optional text payload.
 *
 * Attaching a child stores a deep copy of its current state, so a retained handle to the
 * original can keep changing without affecting the tree it was folded into.
 *
 * An element carries either children or content, never both. A closed (self-closing)
 * element carries neither.
 */
public class XmlNode implements XmlNodeSource {

    private static final String INDENT = "    ";

    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<XmlNode> children = new ArrayList<>();
    private boolean closed;
    private String content;

    public XmlNode(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Element name must not be blank");
        }
        this.name = name;
    }

    /**
     * Sets an attribute. Repeated calls for the same key overwrite the previous value.
     */
    public XmlNode attribute(String key, String value) {
        attributes.put(key, value);
        return this;
    }

    public XmlNode child(XmlNodeSource source) {
        if (closed) {
            throw new IllegalStateException("Cannot add children to closed element <" + name + ">");
        }
        if (content != null) {
            throw new IllegalStateException("Element <" + name + "> already has text content");
        }
        children.add(source.toNode().copy());
        return this;
    }

    public XmlNode children(List<? extends XmlNodeSource> sources) {
        for (XmlNodeSource source : sources) {
            child(source);
        }
        return this;
    }

    public XmlNode close() {
        if (!children.isEmpty() || content != null) {
            throw new IllegalStateException("Element <" + name + "> has children or content and cannot be closed");
        }
        closed = true;
        return this;
    }

    public XmlNode content(String text) {
        if (closed) {
            throw new IllegalStateException("Cannot set content on closed element <" + name + ">");
        }
        if (!children.isEmpty()) {
            throw new IllegalStateException("Element <" + name + "> already has children");
        }
        this.content = text;
        return this;
    }

    /**
     * First direct child with the given tag. The returned node is the live child, not a copy.
     */
    public Optional<XmlNode> findChild(String childName) {
        return children.stream()
                .filter(c -> c.name.equals(childName))
                .findFirst();
    }

    public List<XmlNode> findChildren(String childName) {
        return children.stream()
                .filter(c -> c.name.equals(childName))
                .collect(Collectors.toList());
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public List<XmlNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isClosed() {
        return closed;
    }

    public Optional<String> getContent() {
        return Optional.ofNullable(content);
    }

    public XmlNode copy() {
        XmlNode copy = new XmlNode(name);
        copy.attributes.putAll(attributes);
        for (XmlNode c : children) {
            copy.children.add(c.copy());
        }
        copy.closed = closed;
        copy.content = content;
        return copy;
    }

    @Override
    public XmlNode toNode() {
        return this;
    }

    /**
     * Renders this element and its subtree as indented XML text, four spaces per level.
     */
    public String serialize(int level) {
        String indent = INDENT.repeat(level);
        String open = openTag();

        if (closed) {
            return indent + "<" + open + "/>\n";
        }
        if (content != null) {
            return indent + "<" + open + ">" + XmlEscapeUtil.escapeText(content) + "</" + name + ">\n";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(indent).append('<').append(open).append(">\n");
        for (XmlNode c : children) {
            sb.append(c.serialize(level + 1));
        }
        sb.append(indent).append("</").append(name).append(">\n");
        return sb.toString();
    }

    String openTag() {
        if (attributes.isEmpty()) {
            return name;
        }
        return name + " " + renderAttributes();
    }

    /**
     * Attributes as {@code key="value"} pairs separated by single spaces.
     */
    public String renderAttributes() {
        return attributes.entrySet().stream()
                .map(e -> e.getKey() + "=\"" + XmlEscapeUtil.escapeAttribute(e.getValue()) + "\"")
                .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return serialize(0);
    }
}
