package com.plcopen.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.plcopen.generator.cli.exception.OptionsValidationException;
import com.plcopen.generator.cli.model.GenerateOptions;
import com.plcopen.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (isBlank(o.getProjectName())) {
			errors.add("Project name must not be blank (--project-name / -n).");
		}

		Path normalizedOutput = null;
		if (o.getOutput() == null) {
			errors.add("Output file is required (--output / -o).");
		} else {
			normalizedOutput = o.getOutput().toAbsolutePath().normalize();
			Path parent = normalizedOutput.getParent();
			if (parent != null && !Files.isDirectory(parent)) {
				errors.add("Output directory does not exist: " + parent);
			}
			if (Files.isDirectory(normalizedOutput)) {
				errors.add("Output path is a directory: " + normalizedOutput);
			} else if (Files.exists(normalizedOutput) && !o.isForce()) {
				errors.add("Output file already exists: " + normalizedOutput + ". Use --force to overwrite.");
			}
		}

		List<Path> candidates = o.getCandidates() == null ? List.of() : List.copyOf(o.getCandidates());
		for (Path candidate : candidates) {
			if (!Files.isRegularFile(candidate)) {
				errors.add("Candidate file does not exist or is not a file: " + candidate);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(normalizedOutput, candidates);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
