package com.trainingplan.generator.cli.output;

import java.nio.file.Path;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.cli.model.ValidatedGenerateOptions;
import com.trainingplan.generator.generator.PlanGenerationResult;
import com.trainingplan.generator.generator.PlanWarning;
import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.plan.PlanMetadata;
import com.trainingplan.generator.plan.TrainingPlan;
import com.trainingplan.generator.util.DayOfWeekUtil;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

	private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

	public void printBanner(ValidatedGenerateOptions v) {
		PlanConfiguration c = v.getConfiguration();
		log.info("=================================================");
		log.info("Training Plan Generator");
		log.info("=================================================");
		log.info("Race Distance: {}", c.getRaceDistance());
		log.info("Program Length: {} weeks", c.getProgramLength());
		log.info("Training Days: {} per week", c.getTrainingDaysPerWeek());
		log.info("Rest Days: {}", c.getRestDays().stream().map(DayOfWeekUtil::displayName)
				.collect(Collectors.joining(", ")));
		log.info("Long Run Day: {}", DayOfWeekUtil.displayName(c.getLongRunDay()));
		log.info("Deload Frequency: every {} weeks", c.getDeloadFrequency());
		log.info("Experience: {}", c.effectiveExperience());
		log.info("Difficulty: {}", c.effectiveDifficulty().getLabel());
		log.info("Pace Method: {}", c.getPaceMethod() != null ? c.getPaceMethod().getLabel() : "None");
		log.info("Output: {}", v.getOutputFile() != null ? v.getOutputFile() : "log");
		log.info("=================================================");
	}

	public void printValidationSuccess(PlanGenerationResult result) {
		log.info("");
		log.info("=================================================");
		log.info("CONFIGURATION VALID");
		log.info("=================================================");
		printWarnings(result);
	}

	public void printSuccess(PlanGenerationResult result, Path outputFile) {
		TrainingPlan plan = result.getPlan();
		PlanMetadata metadata = plan.getMetadata();

		log.info("");
		log.info("=================================================");
		log.info("PLAN GENERATED");
		log.info("=================================================");
		log.info("Plan ID: {}", plan.getId());
		log.info("Weeks: {}", plan.totalWeeks());
		log.info("Total Distance: {} km ({} mi)", metadata.getTotalDistanceKm(), metadata.getTotalDistanceMiles());
		log.info("Total Workouts: {}", metadata.getTotalWorkouts());
		log.info("Average Weekly Time: {} min", metadata.getEstimatedWeeklyMinutes());
		log.info("");
		log.info("Phase Distribution:");
		log.info("  Base:  {} weeks", metadata.getPhaseDistribution().getBase());
		log.info("  Build: {} weeks", metadata.getPhaseDistribution().getBuild());
		log.info("  Peak:  {} weeks", metadata.getPhaseDistribution().getPeak());
		log.info("  Taper: {} weeks", metadata.getPhaseDistribution().getTaper());
		log.info("Deload Weeks: {}", plan.deloadWeeks().size());
		if (outputFile != null) {
			log.info("");
			log.info("Summary File: {}", outputFile);
		}
		printWarnings(result);
		log.info("=================================================");
	}

	public void printSummary(String summary) {
		log.info("");
		for (String line : summary.split("\\R")) {
			log.info(line);
		}
	}

	public void printFailure(PlanGenerationResult result) {
		log.error("Plan generation failed:");
		for (String error : result.getErrors()) {
			log.error("  - {}", error);
		}
		printWarnings(result);
	}

	private void printWarnings(PlanGenerationResult result) {
		if (result.getWarnings().isEmpty()) {
			return;
		}
		log.info("");
		log.info("Warnings ({}):", result.getWarnings().size());
		for (PlanWarning warning : result.getWarnings()) {
			log.warn("  {}", warning);
		}
	}
}
