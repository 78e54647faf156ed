package com.plcopen.generator.codegen.writer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the XML file among the candidates produced by a previous step and copies it to
 * the requested output path.
 */
public class XmlOutputSelector {

    private static final Logger log = LoggerFactory.getLogger(XmlOutputSelector.class);

    private static final String XML_EXTENSION = "xml";

    /**
     * @return {@code output}, whether or not anything was copied
     */
    public Path copyXmlFileToOutput(List<Path> candidates, Path output) throws IOException {
        if (candidates == null || candidates.isEmpty()) {
            return output;
        }

        Optional<Path> xmlFile = findXmlCandidate(candidates);
        if (xmlFile.isEmpty()) {
            log.warn("None of {} candidate files is an XML file", candidates.size());
            return output;
        }

        log.info("Copying {} to {}", xmlFile.get(), output);
        Files.copy(xmlFile.get(), output, StandardCopyOption.REPLACE_EXISTING);
        return output;
    }

    /**
     * @return the first candidate with an {@code .xml} extension, compared case-insensitively
     */
    public Optional<Path> findXmlCandidate(List<Path> candidates) {
        if (candidates == null) {
            return Optional.empty();
        }
        return candidates.stream().filter(XmlOutputSelector::isXml).findFirst();
    }

    static boolean isXml(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && name.substring(dot + 1).toLowerCase(Locale.ROOT).equals(XML_EXTENSION);
    }
}
