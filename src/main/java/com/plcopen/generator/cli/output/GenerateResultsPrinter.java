package com.plcopen.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.cli.model.GenerateOptions;
import com.plcopen.generator.cli.model.ValidatedGenerateOptions;
import com.plcopen.generator.codegen.GenerationResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("PLCopenXML Generator");
        log.info("=================================================");
        log.info("Project Name: {}", o.getProjectName());
        log.info("Output File: {}", v.getNormalizedOutput());
        log.info("Omron Workarounds: {}", o.isOutputXmlOmron());
        if (v.isCopyMode()) {
            log.info("Candidate Files: {}", v.getCandidates().size());
        }
        log.info("=================================================");
    }

    public void printSuccess(GenerationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        if (result.isCopied()) {
            log.info("Copied existing XML file");
        } else {
            log.info("Units Translated: {}", result.getUnitsTranslated());
            log.info("Global Variables: {}", result.getGlobalVariablesGenerated());
            log.info("Data Types: {}", result.getDataTypesGenerated());
            log.info("POUs: {}", result.getPousGenerated());
            log.info("Skipped Elements: {}", result.getElementsSkipped());
        }

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("Warnings:");
            result.getWarnings().forEach(w -> log.warn("  {}", w));
        }
        log.info("=================================================");
    }

    public void printFailure(GenerationResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
