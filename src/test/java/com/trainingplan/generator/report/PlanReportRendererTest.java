package com.trainingplan.generator.report;

import com.trainingplan.generator.generator.GenerationStep;
import com.trainingplan.generator.generator.PlanGenerationOptions;
import com.trainingplan.generator.generator.PlanGenerationResult;
import com.trainingplan.generator.generator.PlanGenerator;
import com.trainingplan.generator.generator.PlanWarning;
import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.Severity;
import com.trainingplan.generator.plan.TrainingPlan;
import com.trainingplan.generator.validation.ConfigurationValidator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PlanReportRenderer.
 */
class PlanReportRendererTest {

    @TempDir
    Path tempDir;

    private PlanReportRenderer renderer;
    private TrainingPlan plan;

    @BeforeEach
    void setUp() {
        renderer = new PlanReportRenderer();
        PlanGenerationResult result = new PlanGenerator().generatePlan(
                ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K).toBuilder().programLength(8).build(),
                PlanGenerationOptions.builder().randomSeed(9L).build());
        plan = result.getPlan();
    }

    @Test
    void testRenderSummary() throws IOException {
        String report = renderer.render(plan, List.of());

        assertThat(report).startsWith("# Training Plan " + plan.getId());
        assertThat(report).contains(
                "- Race: 10K",
                "- Program: 8 weeks, 4 training days per week",
                "- Phases: base 2, build 4, peak 1, taper 1",
                "_Generated by training-plan-generator 1.0.0_");
        assertThat(report).doesNotContain("## Warnings");
    }

    @Test
    void testRenderWeeks() throws IOException {
        String report = renderer.render(plan, List.of());

        for (int week = 1; week <= 8; week++) {
            assertThat(report).contains("## Week " + week + " - ");
        }
        assertThat(report).contains("## Week 4 - Build (deload)");
        assertThat(report).doesNotContain("## Week 8 - Taper (deload)");
        assertThat(report).contains("- Monday: Rest", "- Sunday: Long Run, 22 km, 143 min (zone 2) - Long run - 22 km");
        assertThat(report).contains("quality focus: Tempo Run");
    }

    @Test
    void testRenderWarnings() throws IOException {
        PlanWarning warning = new PlanWarning(GenerationStep.DELOAD, Severity.MEDIUM, "Week 8: Deload skipped");

        String report = renderer.render(plan, List.of(warning));

        assertThat(report).contains("## Warnings", "- " + warning);
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path file = tempDir.resolve("out/nested/plan.md");

        Path written = renderer.write(plan, List.of(), file);

        assertThat(written).isEqualTo(file);
        assertThat(Files.readString(file)).isEqualTo(renderer.render(plan, List.of()));
    }
}
