package com.plcopen.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.plcopen.generator.cli.exception.OptionsValidationException;
import com.plcopen.generator.cli.model.GenerateOptions;
import com.plcopen.generator.cli.model.ValidatedGenerateOptions;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class GenerateOptionsValidatorTest {

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @TempDir
    Path tempDir;

    @Test
    void testValidOutputIsNormalized() {
        Path output = tempDir.resolve("sub/../out.xml");

        ValidatedGenerateOptions validated = validator.validate(options("-o", output.toString()));

        assertThat(validated.getNormalizedOutput()).isEqualTo(tempDir.resolve("out.xml").toAbsolutePath().normalize());
        assertThat(validated.isCopyMode()).isFalse();
    }

    @Test
    void testDefaultsFromOptions() {
        GenerateOptions options = options("-o", tempDir.resolve("out.xml").toString());

        assertThat(options.getProjectName()).isEqualTo("Sample");
        assertThat(options.isOutputXmlOmron()).isFalse();
        assertThat(options.getCandidates()).isEmpty();
    }

    @Test
    void testCandidatesSwitchToCopyMode() throws Exception {
        Path candidate = Files.writeString(tempDir.resolve("in.xml"), "<Project/>");

        ValidatedGenerateOptions validated = validator.validate(
                options("-o", tempDir.resolve("out.xml").toString(), candidate.toString()));

        assertThat(validated.isCopyMode()).isTrue();
        assertThat(validated.getCandidates()).containsExactly(candidate);
    }

    @Test
    void testExistingOutputNeedsForce() throws Exception {
        Path output = Files.writeString(tempDir.resolve("out.xml"), "old");

        assertThatThrownBy(() -> validator.validate(options("-o", output.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--force");
        assertThat(validator.validate(options("-o", output.toString(), "--force")).getNormalizedOutput())
                .isEqualTo(output.toAbsolutePath().normalize());
    }

    @Test
    void testAllErrorsReportedTogether() {
        OptionsValidationException e = catchThrowableOfType(() -> validator.validate(options(
                        "-o", tempDir.resolve("missing/out.xml").toString(),
                        "-n", " ",
                        tempDir.resolve("nothing.xml").toString())),
                OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(3);
        assertThat(e.getErrors()).anyMatch(m -> m.startsWith("Project name must not be blank"));
        assertThat(e.getErrors()).anyMatch(m -> m.startsWith("Output directory does not exist"));
        assertThat(e.getErrors()).anyMatch(m -> m.startsWith("Candidate file does not exist"));
    }

    @Test
    void testOutputDirectoryRejected() {
        assertThatThrownBy(() -> validator.validate(options("-o", tempDir.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("is a directory");
    }

    private static GenerateOptions options(String... args) {
        return CommandLine.populateCommand(new GenerateOptions(), args);
    }
}
