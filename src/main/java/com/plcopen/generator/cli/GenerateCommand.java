package com.plcopen.generator.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.cli.exception.OptionsValidationException;
import com.plcopen.generator.cli.model.GenerateOptions;
import com.plcopen.generator.cli.model.ValidatedGenerateOptions;
import com.plcopen.generator.cli.output.GenerateResultsPrinter;
import com.plcopen.generator.cli.validation.GenerateOptionsValidator;
import com.plcopen.generator.codegen.GenerationResult;
import com.plcopen.generator.codegen.PlcXmlGenerator;
import com.plcopen.generator.codegen.model.core.context.GenerationParameters;
import com.plcopen.generator.codegen.writer.XmlOutputSelector;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command producing the PLCopenXML output file.
 *
 * With candidate files the first XML file among them is copied to the output, and the
 * run fails when none of them is an XML file. Without candidates an empty project
 * document is written.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "plc-xml-generator 1.0.0",
        description = "Writes a PLCopenXML (Sysmac Studio) project file."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            GenerationResult result = validated.isCopyMode()
                    ? copy(validated.getCandidates(), validated.getNormalizedOutput())
                    : generateEmpty(validated.getNormalizedOutput());
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }
            printer.printSuccess(result);
            return 0;
        } catch (IOException e) {
            log.debug("Generation failed", e);
            printer.printFailure(GenerationResult.failure(e.getMessage()));
            return 1;
        }
    }

    private GenerationResult copy(List<Path> candidates, Path output) throws IOException {
        XmlOutputSelector selector = new XmlOutputSelector();
        if (selector.findXmlCandidate(candidates).isEmpty()) {
            return GenerationResult.failure(
                    String.format("No XML file among %d candidate file(s)", candidates.size()));
        }
        Path written = selector.copyXmlFileToOutput(candidates, output);
        return GenerationResult.builder()
                .success(true)
                .outputPath(written)
                .copied(true)
                .build();
    }

    private GenerationResult generateEmpty(Path output) throws IOException {
        GenerationParameters parameters = GenerationParameters.builder()
                .outputXmlOmron(options.isOutputXmlOmron())
                .projectName(options.getProjectName())
                .build();
        return new PlcXmlGenerator(parameters).generate(List.of(), output);
    }
}
