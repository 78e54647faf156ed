package com.plcopen.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.plcopen.generator.codegen.model.core.context.GenerationParameters;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--output", "-o" }, required = true, description = "Path of the XML file to write")
	private Path output;

	@Option(names = { "--project-name", "-n" }, defaultValue = GenerationParameters.DEFAULT_PROJECT_NAME,
			description = "Project name written to the content header (default: ${DEFAULT-VALUE})")
	private String projectName;

	@Option(names = { "--omron" }, description = "Apply Sysmac Studio workarounds (fixed-width string member types)")
	private boolean outputXmlOmron;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Parameters(arity = "0..*", paramLabel = "CANDIDATE",
			description = "Files produced by an earlier step; the first XML file among them is copied to the output")
	private List<Path> candidates = new ArrayList<>();

}
