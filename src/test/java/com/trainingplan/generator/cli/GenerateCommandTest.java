package com.trainingplan.generator.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the generate command run end to end through picocli.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testGenerateWritesSummaryFile() throws IOException {
        Path output = tempDir.resolve("reports/plan.md");

        int exitCode = execute("--race", "10K", "--weeks", "8", "--seed", "3", "--output", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.exists(output)).isTrue();
        String content = Files.readString(output);
        assertThat(content).startsWith("# Training Plan plan_");
        assertThat(content).contains("## Week 1 - Base", "## Week 4 - Build (deload)", "## Week 8 - Taper");
    }

    @Test
    void testGenerateWithoutOutputFile() {
        assertThat(execute("--race", "5K", "--weeks", "8", "--seed", "1")).isZero();
    }

    @Test
    void testValidateOnlyWritesNothing() {
        Path output = tempDir.resolve("plan.md");

        int exitCode = execute("--validate-only", "--output", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void testUnparseableOptionsFail() {
        assertThat(execute("--race", "Ultra")).isEqualTo(1);
    }

    @Test
    void testInvalidConfigurationFails() {
        assertThat(execute("--days", "6", "--rest-days", "Monday,Tuesday,Wednesday,Thursday,Friday")).isEqualTo(1);
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path output = Files.writeString(tempDir.resolve("plan.md"), "old");

        assertThat(execute("--weeks", "8", "--output", output.toString())).isEqualTo(1);
        assertThat(Files.readString(output)).isEqualTo("old");

        assertThat(execute("--weeks", "8", "--output", output.toString(), "--force")).isZero();
        assertThat(Files.readString(output)).startsWith("# Training Plan");
    }

    private static int execute(String... args) {
        return new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
