package com.plcopen.generator.codegen.writer;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.util.XmlEscapeUtil;
import com.plcopen.generator.codegen.xml.XmlNode;

/**
 * Writes a document tree to a file, depth-first. Leaf text goes out as CDATA.
 *
 * The destination's directory must exist; it is not created.
 */
public class XmlDocumentWriter {

    private static final Logger log = LoggerFactory.getLogger(XmlDocumentWriter.class);

    public static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    private static final String INDENT = "    ";

    public void write(Path output, XmlNode root) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            write(out, root);
        }
        log.info("Wrote {}", output.toAbsolutePath());
    }

    public void write(Writer out, XmlNode root) throws IOException {
        out.write(DECLARATION);
        out.write('\n');
        writeNode(out, root, 0);
        out.flush();
    }

    private void writeNode(Writer out, XmlNode node, int level) throws IOException {
        String indent = INDENT.repeat(level);
        out.write(indent);
        out.write('<');
        out.write(node.getName());
        if (!node.getAttributes().isEmpty()) {
            out.write(' ');
            out.write(node.renderAttributes());
        }

        if (node.getChildren().isEmpty()) {
            if (node.isClosed() || node.getContent().isEmpty()) {
                out.write("/>\n");
                return;
            }
            out.write('>');
            out.write(XmlEscapeUtil.toCData(node.getContent().get()));
            writeEnd(out, node);
            return;
        }

        out.write(">\n");
        for (XmlNode child : node.getChildren()) {
            writeNode(out, child, level + 1);
        }
        out.write(indent);
        writeEnd(out, node);
    }

    private static void writeEnd(Writer out, XmlNode node) throws IOException {
        out.write("</");
        out.write(node.getName());
        out.write(">\n");
    }
}
