package com.trainingplan.generator;

import com.trainingplan.generator.cli.GenerateCommand;

import picocli.CommandLine;

/**
 * Main entry point for the training plan generator.
 * Builds a plan from command-line preferences and prints or writes a summary.
 */
public class PlanGeneratorApplication {

	public static void main(String[] args) {
		int exitCode = new CommandLine(new GenerateCommand())
				.setCaseInsensitiveEnumValuesAllowed(true)
				.execute(args);
		System.exit(exitCode);
	}
}
