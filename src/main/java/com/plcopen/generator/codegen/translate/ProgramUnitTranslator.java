package com.plcopen.generator.codegen.translate;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.model.core.context.GenerationParameters;
import com.plcopen.generator.codegen.model.core.context.GenerationStats;
import com.plcopen.generator.codegen.model.core.context.ToolDiagnostics;
import com.plcopen.generator.codegen.model.input.CompilationUnit;
import com.plcopen.generator.codegen.source.SourceTextReader;
import com.plcopen.generator.codegen.xml.XmlNode;

/**
 * Fills the skeleton document with the globals, custom types and POUs of every unit.
 *
 * One translator serves one generation run: the parameter order tracker it owns is shared by
 * all units, so translating the same units twice with one instance duplicates output and
 * shifts parameter orders.
 */
public class ProgramUnitTranslator {

    private static final Logger log = LoggerFactory.getLogger(ProgramUnitTranslator.class);

    private final GlobalVariablesPass globalsPass;
    private final CustomTypesPass typesPass;
    private final PouPass pouPass;
    private final BestEffortRunner runner;
    private final GenerationStats stats;

    public ProgramUnitTranslator(GenerationParameters parameters, SourceTextReader sourceReader,
                                 String creationDateTime, GenerationStats stats, ToolDiagnostics diagnostics) {
        VariableElementFactory variableFactory = new VariableElementFactory();
        this.globalsPass = new GlobalVariablesPass(variableFactory, stats);
        this.typesPass = new CustomTypesPass(parameters, new EnumeratorConflictResolver(), stats);
        this.pouPass = new PouPass(variableFactory, sourceReader, new ParameterOrderTracker(), stats, creationDateTime);
        this.runner = new BestEffortRunner(diagnostics);
        this.stats = stats;
    }

    /**
     * @throws IOException if a POU body cannot be read from its source file
     */
    public void translate(XmlNode document, List<CompilationUnit> units) throws IOException {
        for (CompilationUnit unit : units) {
            log.info("Translating {}", unit.getFileName());
            runner.run("global variables of " + unit.getFileName(), () -> globalsPass.apply(document, unit));
            runner.run("custom types of " + unit.getFileName(), () -> typesPass.apply(document, unit));
            runner.run("POUs of " + unit.getFileName(), () -> pouPass.apply(document, unit));
            stats.countUnit();
        }
    }
}
