package com.trainingplan.generator.cli.model;

import java.nio.file.Path;

import com.trainingplan.generator.model.DifficultyLevel;
import com.trainingplan.generator.model.ExperienceLevel;
import com.trainingplan.generator.model.PaceMethod;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--race", "-r" }, defaultValue = "10K",
			description = "Race distance: 5K, 10K, \"Half Marathon\" or Marathon (default: ${DEFAULT-VALUE})")
	private String race;

	@Option(names = { "--weeks", "-w" }, defaultValue = "12", description = "Program length in weeks (default: ${DEFAULT-VALUE})")
	private int weeks;

	@Option(names = { "--days", "-d" }, defaultValue = "4", description = "Training days per week (default: ${DEFAULT-VALUE})")
	private int trainingDays;

	@Option(names = { "--rest-days" }, defaultValue = "Monday,Wednesday,Friday",
			description = "Rest days, comma-separated (default: ${DEFAULT-VALUE})")
	private String restDays;

	@Option(names = { "--long-run-day" }, defaultValue = "Sunday", description = "Long run day (default: ${DEFAULT-VALUE})")
	private String longRunDay;

	@Option(names = { "--deload-frequency" }, defaultValue = "4",
			description = "Deload every N weeks, 3 or 4 (default: ${DEFAULT-VALUE})")
	private int deloadFrequency;

	@Option(names = { "--experience" }, defaultValue = "INTERMEDIATE",
			description = "BEGINNER, INTERMEDIATE or ADVANCED (default: ${DEFAULT-VALUE})")
	private ExperienceLevel experience;

	@Option(names = { "--difficulty" }, defaultValue = "MODERATE",
			description = "VERY_EASY, EASY, MODERATE, HARD or VERY_HARD (default: ${DEFAULT-VALUE})")
	private DifficultyLevel difficulty;

	@Option(names = { "--pace-method" },
			description = "How paces were established: RECENT_RACE, TIME_TRIAL, CURRENT_PACE, GOAL or FITNESS_LEVEL")
	private PaceMethod paceMethod;

	@Option(names = { "--seed" }, description = "Random seed for deload quality-workout skips")
	private Long seed;

	@Option(names = { "--skip-deload" }, description = "Do not apply deload weeks")
	private boolean skipDeload;

	@Option(names = { "--validate-only" }, description = "Only validate the configuration")
	private boolean validateOnly;

	@Option(names = { "--output", "-o" }, description = "Write the plan summary to this file instead of the log")
	private Path output;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--verbose", "-v" }, description = "Log pipeline details")
	private boolean verbose;

	// ---- Getters only; picocli sets fields reflectively ----

}
