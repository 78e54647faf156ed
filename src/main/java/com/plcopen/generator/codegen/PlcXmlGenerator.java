package com.plcopen.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.model.core.context.GenerationParameters;
import com.plcopen.generator.codegen.model.core.context.GenerationStats;
import com.plcopen.generator.codegen.model.core.context.ToolDiagnostics;
import com.plcopen.generator.codegen.model.input.CompilationUnit;
import com.plcopen.generator.codegen.source.SourceTextReader;
import com.plcopen.generator.codegen.translate.OmronTemplate;
import com.plcopen.generator.codegen.translate.ProgramUnitTranslator;
import com.plcopen.generator.codegen.writer.XmlDocumentWriter;
import com.plcopen.generator.codegen.xml.XmlNode;

/**
 * Generates one PLCopenXML file from a list of compilation units.
 */
public class PlcXmlGenerator {
    private static final Logger log = LoggerFactory.getLogger(PlcXmlGenerator.class);

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final GenerationParameters parameters;
    private final Clock clock;
    private final SourceTextReader sourceReader;
    private final XmlDocumentWriter writer = new XmlDocumentWriter();

    public PlcXmlGenerator(GenerationParameters parameters) {
        this(parameters, Clock.systemDefaultZone(), new SourceTextReader());
    }

    public PlcXmlGenerator(GenerationParameters parameters, Clock clock, SourceTextReader sourceReader) {
        this.parameters = parameters;
        this.clock = clock;
        this.sourceReader = sourceReader;
    }

    /**
     * Builds the document for the units and writes it to {@code output}.
     *
     * Units missing optional data are written partially; only IO failures and exhausted
     * integer ranges abort the run.
     *
     * @throws IOException if a source file cannot be read or the output cannot be written
     */
    public GenerationResult generate(List<CompilationUnit> units, Path output) throws IOException {
        log.info("Generating {} from {} compilation unit(s)", output, units.size());

        GenerationStats stats = new GenerationStats();
        ToolDiagnostics diagnostics = new ToolDiagnostics();

        XmlNode document = buildDocument(units, stats, diagnostics);
        writer.write(output, document);

        log.info("Generated {} global variable(s), {} data type(s), {} POU(s); skipped {}",
                stats.getGlobalVariables(), stats.getDataTypes(), stats.getPous(), stats.getSkipped());

        return GenerationResult.builder()
                .success(true)
                .outputPath(output)
                .unitsTranslated(stats.getUnitsTranslated())
                .globalVariablesGenerated(stats.getGlobalVariables())
                .dataTypesGenerated(stats.getDataTypes())
                .pousGenerated(stats.getPous())
                .elementsSkipped(stats.getSkipped())
                .warnings(diagnostics.getWarnings())
                .build();
    }

    /**
     * Builds the populated document without writing it.
     */
    public XmlNode buildDocument(List<CompilationUnit> units) throws IOException {
        return buildDocument(units, new GenerationStats(), new ToolDiagnostics());
    }

    private XmlNode buildDocument(List<CompilationUnit> units, GenerationStats stats, ToolDiagnostics diagnostics)
            throws IOException {
        String creationDateTime = timestamp();
        XmlNode document = OmronTemplate.create(parameters, creationDateTime);
        new ProgramUnitTranslator(parameters, sourceReader, creationDateTime, stats, diagnostics)
                .translate(document, units);
        return document;
    }

    private String timestamp() {
        return LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    }
}
