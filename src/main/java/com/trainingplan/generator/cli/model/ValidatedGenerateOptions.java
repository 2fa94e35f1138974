package com.trainingplan.generator.cli.model;

import java.nio.file.Path;

import com.trainingplan.generator.generator.PlanGenerationOptions;
import com.trainingplan.generator.model.PlanConfiguration;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Values derived from the options that the command needs. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
	PlanConfiguration configuration;
	PlanGenerationOptions generationOptions;
	/** Null when the summary goes to the log. */
	Path outputFile;
}
