package com.plcopen.generator.codegen.xml;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the generic XML node model.
 */
class XmlNodeTest {

    @Test
    void testNewNodeIsEmpty() {
        XmlNode node = new XmlNode("Root");

        assertThat(node.getName()).isEqualTo("Root");
        assertThat(node.getAttributes()).isEmpty();
        assertThat(node.getChildren()).isEmpty();
        assertThat(node.isClosed()).isFalse();
        assertThat(node.getContent()).isEmpty();
    }

    @Test
    void testLastAttributeWriteWins() {
        XmlNode node = new XmlNode("position")
                .attribute("x", "1")
                .attribute("x", "2");

        assertThat(node.getAttributes()).containsExactly(entry("x", "2"));
    }

    @Test
    void testAttachedChildIsSnapshot() {
        XmlNode child = new XmlNode("Child").attribute("state", "before");
        XmlNode parent = new XmlNode("Parent").child(child);

        child.attribute("state", "after");
        child.child(new XmlNode("Late"));

        XmlNode attached = parent.getChildren().get(0);
        assertThat(attached.getAttribute("state")).isEqualTo("before");
        assertThat(attached.getChildren()).isEmpty();
    }

    @Test
    void testChildrenPreserveOrder() {
        XmlNode parent = new XmlNode("Parent").children(List.of(
                new XmlNode("A"), new XmlNode("B"), new XmlNode("C")));

        assertThat(parent.getChildren()).extracting(XmlNode::getName).containsExactly("A", "B", "C");
    }

    @Test
    void testFindChildReturnsLiveNode() {
        XmlNode root = new XmlNode("Project").child(new XmlNode("Instances"));

        root.findChild("Instances").orElseThrow().child(new XmlNode("Configuration"));

        assertThat(root.findChild("Instances").orElseThrow().getChildren()).hasSize(1);
        assertThat(root.findChild("Missing")).isEmpty();
    }

    @Test
    void testSerializeClosedElement() {
        String xml = new XmlNode("SimpleValue").attribute("value", "5").close().serialize(0);

        assertThat(xml).isEqualTo("<SimpleValue value=\"5\"/>\n");
        assertThat(xml).doesNotContain("</SimpleValue>");
    }

    @Test
    void testSerializeContentLeaf() {
        String xml = new XmlNode("TypeName").content("INT").serialize(1);

        assertThat(xml).isEqualTo("    <TypeName>INT</TypeName>\n");
    }

    @Test
    void testSerializeNested() {
        XmlNode root = new XmlNode("Type").child(new XmlNode("TypeName").content("DINT"));

        assertThat(root.serialize(0)).isEqualTo("""
                <Type>
                    <TypeName>DINT</TypeName>
                </Type>
                """);
    }

    @Test
    void testSerializeJoinsAttributesWithSpaces() {
        String xml = new XmlNode("Element")
                .attribute("key1", "value1")
                .attribute("key2", "value2")
                .close()
                .serialize(0);

        assertThat(xml).isEqualTo("<Element key1=\"value1\" key2=\"value2\"/>\n");
    }

    @Test
    void testSerializeEscapesReservedCharacters() {
        String xml = new XmlNode("expression")
                .attribute("text", "a < \"b\"")
                .content("x & y")
                .serialize(0);

        assertThat(xml).isEqualTo("<expression text=\"a &lt; &quot;b&quot;\">x &amp; y</expression>\n");
    }

    @Test
    void testContentAndChildrenAreExclusive() {
        XmlNode withContent = new XmlNode("ST").content("x := 1;");
        assertThatThrownBy(() -> withContent.child(new XmlNode("Other")))
                .isInstanceOf(IllegalStateException.class);

        XmlNode withChild = new XmlNode("Type").child(new XmlNode("TypeName"));
        assertThatThrownBy(() -> withChild.content("INT"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testClosedElementRejectsChildrenAndContent() {
        XmlNode closed = new XmlNode("connection").close();

        assertThatThrownBy(() -> closed.child(new XmlNode("x"))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> closed.content("x")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new XmlNode("Type").child(new XmlNode("TypeName")).close())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testBlankNameRejected() {
        assertThatThrownBy(() -> new XmlNode(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
