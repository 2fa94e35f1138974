package com.trainingplan.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.trainingplan.generator.cli.exception.OptionsValidationException;
import com.trainingplan.generator.cli.model.GenerateOptions;
import com.trainingplan.generator.cli.model.ValidatedGenerateOptions;
import com.trainingplan.generator.generator.PlanGenerationOptions;
import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.util.DayOfWeekUtil;

/**
 * Turns raw options into a plan configuration. Only checks what cannot be parsed;
 * plan rules are left to the configuration validator.
 */
public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Optional<RaceDistance> race = RaceDistance.fromLabel(o.getRace());
		if (race.isEmpty()) {
			errors.add("Unknown race distance: " + o.getRace() + ". Expected one of 5K, 10K, Half Marathon, Marathon.");
		}

		List<DayOfWeek> restDays = parseRestDays(o.getRestDays(), errors);

		Optional<DayOfWeek> longRunDay = DayOfWeekUtil.parse(o.getLongRunDay());
		if (longRunDay.isEmpty()) {
			errors.add("Unknown long run day: " + o.getLongRunDay());
		}

		Path outputFile = null;
		if (o.getOutput() != null) {
			outputFile = o.getOutput().toAbsolutePath().normalize();
			if (Files.isDirectory(outputFile)) {
				errors.add("Output path is a directory: " + outputFile);
			} else if (Files.exists(outputFile) && !o.isForce()) {
				errors.add("Output file already exists: " + outputFile + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		PlanConfiguration configuration = PlanConfiguration.builder()
				.raceDistance(race.get())
				.programLength(o.getWeeks())
				.trainingDaysPerWeek(o.getTrainingDays())
				.restDays(restDays)
				.longRunDay(longRunDay.get())
				.deloadFrequency(o.getDeloadFrequency())
				.experience(o.getExperience())
				.difficulty(o.getDifficulty())
				.paceMethod(o.getPaceMethod())
				.build();

		PlanGenerationOptions generationOptions = PlanGenerationOptions.builder()
				.validateOnly(o.isValidateOnly())
				.skipDeload(o.isSkipDeload())
				.randomSeed(o.getSeed())
				.build();

		return new ValidatedGenerateOptions(configuration, generationOptions, outputFile);
	}

	private static List<DayOfWeek> parseRestDays(String raw, List<String> errors) {
		if (raw == null || raw.isBlank()) {
			return List.of();
		}

		List<DayOfWeek> result = new ArrayList<>();
		for (String token : Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList()) {
			Optional<DayOfWeek> day = DayOfWeekUtil.parse(token);
			if (day.isPresent()) {
				result.add(day.get());
			} else {
				errors.add("Unknown rest day: " + token);
			}
		}
		return result;
	}
}
