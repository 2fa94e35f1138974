package com.trainingplan.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.cli.exception.OptionsValidationException;
import com.trainingplan.generator.cli.model.GenerateOptions;
import com.trainingplan.generator.cli.model.ValidatedGenerateOptions;
import com.trainingplan.generator.cli.output.GenerateResultsPrinter;
import com.trainingplan.generator.cli.validation.GenerateOptionsValidator;
import com.trainingplan.generator.generator.PlanGenerationResult;
import com.trainingplan.generator.generator.PlanGenerator;
import com.trainingplan.generator.report.PlanReportRenderer;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that generates a training plan from runner preferences.
 */
@Command(
		name = "generate",
		mixinStandardHelpOptions = true,
		version = "training-plan-generator 1.0.0",
		description = "Generates a periodized endurance training plan and prints or writes a summary."
)
public class GenerateCommand implements Callable<Integer> {

	private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

	@Mixin
	private GenerateOptions options = new GenerateOptions();

	private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
	private final GenerateResultsPrinter printer = new GenerateResultsPrinter();
	private final PlanGenerator generator;
	private final PlanReportRenderer renderer;

	public GenerateCommand() {
		this(new PlanGenerator(), new PlanReportRenderer());
	}

	public GenerateCommand(PlanGenerator generator, PlanReportRenderer renderer) {
		this.generator = generator;
		this.renderer = renderer;
	}

	@Override
	public Integer call() {
		try {
			if (options.isVerbose()) {
				enableDebugLogging();
			}

			ValidatedGenerateOptions v = validator.validate(options);
			printer.printBanner(v);

			PlanGenerationResult result = generator.generatePlan(v.getConfiguration(), v.getGenerationOptions());
			if (!result.isSuccess()) {
				printer.printFailure(result);
				return 1;
			}

			if (result.getPlan() == null) {
				printer.printValidationSuccess(result);
				return 0;
			}

			if (v.getOutputFile() != null) {
				renderer.write(result.getPlan(), result.getWarnings(), v.getOutputFile());
			} else {
				printer.printSummary(renderer.render(result.getPlan(), result.getWarnings()));
			}
			printer.printSuccess(result, v.getOutputFile());
			return 0;

		} catch (OptionsValidationException e) {
			for (String error : e.getErrors()) {
				log.error(error);
			}
			return 1;
		} catch (Exception e) {
			log.error("Generation failed with exception", e);
			return 1;
		}
	}

	private static void enableDebugLogging() {
		Logger packageLogger = LoggerFactory.getLogger("com.trainingplan");
		if (packageLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}
}
