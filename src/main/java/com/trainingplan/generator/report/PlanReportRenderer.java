package com.trainingplan.generator.report;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.distribution.Workout;
import com.trainingplan.generator.generator.PlanWarning;
import com.trainingplan.generator.plan.PlanMetadata;
import com.trainingplan.generator.plan.PlanStatistics;
import com.trainingplan.generator.plan.PlanStatisticsCalculator;
import com.trainingplan.generator.plan.TrainingPlan;
import com.trainingplan.generator.plan.WeeklyPlan;
import com.trainingplan.generator.scheduling.DailyWorkout;
import com.trainingplan.generator.util.DayOfWeekUtil;
import com.trainingplan.generator.util.DistanceUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a Markdown summary of a plan from {@code templates/plan-summary.ftl}.
 */
public class PlanReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(PlanReportRenderer.class);

    static final String TEMPLATE_NAME = "plan-summary.ftl";

    private final Configuration freemarkerConfig;
    private final PlanStatisticsCalculator statisticsCalculator;

    public PlanReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
        this.statisticsCalculator = new PlanStatisticsCalculator();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setLocale(Locale.US);
        cfg.setNumberFormat("0.#");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(TrainingPlan plan, List<PlanWarning> warnings) throws IOException {
        StringWriter out = new StringWriter();
        render(plan, warnings, out);
        return out.toString();
    }

    public void render(TrainingPlan plan, List<PlanWarning> warnings, Writer out) throws IOException {
        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        try {
            template.process(model(plan, warnings), out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render plan report: " + e.getMessage(), e);
        }
    }

    public Path write(TrainingPlan plan, List<PlanWarning> warnings, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, render(plan, warnings), StandardCharsets.UTF_8);
        log.info("Plan summary written to {}", file);
        return file;
    }

    private Map<String, Object> model(TrainingPlan plan, List<PlanWarning> warnings) {
        PlanMetadata metadata = plan.getMetadata();
        PlanStatistics statistics = statisticsCalculator.calculate(plan);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", plan.getId());
        summary.put("race", plan.getConfiguration().getRaceDistance().getLabel());
        summary.put("weeks", plan.totalWeeks());
        summary.put("trainingDays", plan.getConfiguration().getTrainingDaysPerWeek());
        summary.put("totalKm", metadata.getTotalDistanceKm());
        summary.put("totalMiles", metadata.getTotalDistanceMiles());
        summary.put("totalWorkouts", metadata.getTotalWorkouts());
        summary.put("weeklyMinutes", metadata.getEstimatedWeeklyMinutes());
        summary.put("version", metadata.getVersion());

        Map<String, Object> model = new HashMap<>();
        model.put("plan", summary);
        model.put("phases", metadata.getPhaseDistribution());
        model.put("statistics", statistics);
        model.put("weeks", plan.getWeeks().stream().map(PlanReportRenderer::weekModel).toList());
        model.put("warnings", warnings.stream().map(PlanWarning::toString).toList());
        return model;
    }

    private static Map<String, Object> weekModel(WeeklyPlan week) {
        List<String> days = new ArrayList<>();
        for (DailyWorkout day : week.effectiveDays()) {
            days.add(dayLine(day));
        }

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("number", week.getWeekNumber());
        model.put("phase", week.getPhase().displayName());
        model.put("deload", week.isDeloadWeek());
        model.put("focus", week.getFocus());
        model.put("distanceKm", week.getDistanceKm());
        model.put("durationMinutes", week.getDurationMinutes());
        model.put("quality", week.getRotation().getQualityType().getWorkoutName());
        model.put("days", days);
        return model;
    }

    private static String dayLine(DailyWorkout day) {
        String name = DayOfWeekUtil.displayName(day.getDay());
        if (!day.isTraining()) {
            return name + ": Rest";
        }
        Workout workout = day.getWorkout();
        return name + ": " + workout.getType().getDisplayName() + ", "
                + DistanceUtil.formatKm(workout.getDistanceKm()) + ", " + workout.getDurationMinutes()
                + " min (zone " + workout.getIntensity().number() + ") - " + workout.getDescription();
    }
}
