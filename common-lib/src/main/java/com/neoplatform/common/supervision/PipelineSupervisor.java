package com.neoplatform.common.supervision;

import com.neoplatform.common.confidence.Alert;
import com.neoplatform.common.confidence.AlertLevel;
import com.neoplatform.common.confidence.ConfidenceMetrics;
import com.neoplatform.common.confidence.ConfidenceSystem;
import com.neoplatform.common.confidence.ConfidenceTrend;
import com.neoplatform.common.confidence.HealthReport;
import com.neoplatform.common.confidence.ObservationSample;
import com.neoplatform.common.confidence.PredictionSample;
import com.neoplatform.common.model.Recommendation;
import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.StageType;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.trace.TraceContextUtil;
import com.neoplatform.common.validation.ConceptualCoherenceValidator;
import com.neoplatform.common.validation.DataCompletenessValidator;
import com.neoplatform.common.validation.PhysicalPlausibilityValidator;
import com.neoplatform.common.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the supervision core. Owns the stage → {@link StageSupervisor} mapping
 * and one {@link ConfidenceSystem} session.
 *
 * <h3>Stage decision ladder (first match wins)</h3>
 * <pre>
 *   no validator report                     → INVESTIGATE
 *   critical errors &gt; 3                     → STOP
 *   critical errors &gt; 0 or warnings &gt; 5     → RETRY
 *   metrics present and overall &lt; 0.6       → INVESTIGATE
 *   otherwise                               → CONTINUE
 * </pre>
 *
 * <h3>Fail closed</h3>
 * A stage without a mapping, or any unexpected exception while supervising it, yields a
 * non-supervised {@link SupervisionResult} with {@link Recommendation#STOP}. Neither
 * operation throws to its caller.
 *
 * <p>Not thread-safe; see {@link ConfidenceSystem}.
 */
public class PipelineSupervisor {

    private static final Logger log = LoggerFactory.getLogger(PipelineSupervisor.class);

    static final int    STOP_CRITICAL_ERRORS     = 3;
    static final int    RETRY_WARNINGS           = 5;
    static final double INVESTIGATE_CONFIDENCE   = 0.6;

    static final double RUN_VALID_CONFIDENCE     = 0.7;
    static final double RUN_CRITICAL_CONFIDENCE  = 0.5;
    static final int    RUN_MANY_ALERTS          = 5;

    private final Map<String, StageSupervisor> supervisors;
    private final ConfidenceSystem confidenceSystem;

    public PipelineSupervisor(List<StageSupervisor> stageSupervisors, ConfidenceSystem confidenceSystem) {
        Map<String, StageSupervisor> byName = new LinkedHashMap<>();
        for (StageSupervisor supervisor : stageSupervisors) {
            if (byName.put(supervisor.name(), supervisor) != null) {
                throw new IllegalArgumentException("duplicate stage supervisor: " + supervisor.name());
            }
        }
        this.supervisors = Collections.unmodifiableMap(byName);
        this.confidenceSystem = confidenceSystem;
    }

    /** Pipeline with the standard stage catalogue and freshly built validators. */
    public static PipelineSupervisor withDefaultStages(ConfidenceSystem confidenceSystem) {
        return withDefaultStages(confidenceSystem, new PhysicalPlausibilityValidator(),
            new DataCompletenessValidator(), new ConceptualCoherenceValidator());
    }

    /**
     * Pipeline with the standard stage catalogue:
     * <pre>
     *   data_collector   completeness
     *   trajectory       physical
     *   impact_analyzer  physical
     *   mitigation       physical, coherence
     *   visualization    completeness, coherence
     *   ml_predictor     completeness
     *   explainer        completeness, coherence
     * </pre>
     */
    public static PipelineSupervisor withDefaultStages(ConfidenceSystem confidenceSystem,
                                                       Validator physical,
                                                       Validator completeness,
                                                       Validator coherence) {
        return withDefaultStages(confidenceSystem, physical, completeness, coherence,
            StageSupervisor.DEFAULT_HISTORY_CAPACITY);
    }

    public static PipelineSupervisor withDefaultStages(ConfidenceSystem confidenceSystem,
                                                       Validator physical,
                                                       Validator completeness,
                                                       Validator coherence,
                                                       int stageHistoryCapacity) {
        List<StageSupervisor> stages = List.of(
            stage(StageType.DATA_COLLECTION, stageHistoryCapacity, completeness),
            stage(StageType.TRAJECTORY, stageHistoryCapacity, physical),
            stage(StageType.IMPACT, stageHistoryCapacity, physical),
            stage(StageType.MITIGATION, stageHistoryCapacity, physical, coherence),
            stage(StageType.VISUALIZATION, stageHistoryCapacity, completeness, coherence),
            stage(StageType.ML_PREDICTION, stageHistoryCapacity, completeness),
            stage(StageType.EXPLANATION, stageHistoryCapacity, completeness, coherence));
        return new PipelineSupervisor(stages, confidenceSystem);
    }

    private static StageSupervisor stage(StageType type, int historyCapacity, Validator... validators) {
        return new StageSupervisor(type.defaultStageName(), type, List.of(validators), historyCapacity);
    }

    // ── single stage ──────────────────────────────────────────────────────────

    public SupervisionResult superviseOne(String stageName, Map<String, Object> output, StageContext context) {
        return superviseOne(stageName, output, context, null, null);
    }

    /**
     * Supervises one stage output and feeds its reports, together with the optional
     * samples, into the confidence session.
     */
    public SupervisionResult superviseOne(String stageName, Map<String, Object> output, StageContext context,
                                          ObservationSample observation, PredictionSample prediction) {
        StageSupervisor supervisor = stageName != null ? supervisors.get(stageName) : null;
        if (supervisor == null) {
            log.warn("[PipelineSupervisor] no supervisor for stage={} → STOP", stageName);
            return SupervisionResult.notSupervised(stageName, "No supervisor found for " + stageName);
        }

        try {
            StageSupervision stage = supervisor.supervise(output, context);
            ConfidenceMetrics metrics = stage.reports().isEmpty()
                ? null
                : confidenceSystem.update(stage.reports(), observation, prediction);
            Recommendation recommendation = recommend(stage.reports(), metrics);

            log.info("[PipelineSupervisor] stage={} recommendation={} confidence={}",
                stageName, recommendation, String.format("%.2f", stage.overallConfidence()));
            return SupervisionResult.of(stage, metrics, recommendation);
        } catch (RuntimeException e) {
            log.error("[PipelineSupervisor] supervision failed. stage={} → STOP", stageName, e);
            return SupervisionResult.notSupervised(stageName,
                "Supervision failed: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    static Recommendation recommend(List<ValidationReport> reports, ConfidenceMetrics metrics) {
        if (reports.isEmpty()) {
            return Recommendation.INVESTIGATE;
        }
        int criticalErrors = reports.stream().mapToInt(r -> r.errors().size()).sum();
        int warnings       = reports.stream().mapToInt(r -> r.warnings().size()).sum();

        if (criticalErrors > STOP_CRITICAL_ERRORS) {
            return Recommendation.STOP;
        }
        if (criticalErrors > 0 || warnings > RETRY_WARNINGS) {
            return Recommendation.RETRY;
        }
        if (metrics != null && metrics.overall() < INVESTIGATE_CONFIDENCE) {
            return Recommendation.INVESTIGATE;
        }
        return Recommendation.CONTINUE;
    }

    // ── whole run ─────────────────────────────────────────────────────────────

    public RunSupervisionReport superviseRun(RunState state) {
        String runId = TraceContextUtil.newRunId();
        RunState run = state != null ? state : RunState.empty();
        log.info("[PipelineSupervisor] run supervision started. runId={}", runId);

        Map<String, SupervisionResult> stageReports = new LinkedHashMap<>();
        List<ValidationReport> allReports = new ArrayList<>();

        for (RunComponent component : RunComponent.values()) {
            Map<String, Object> output = component.toStageOutput(run);
            if (output == null) {
                continue;
            }
            StageContext context = new StageContext(component.stageName(), component.stageType(),
                runId, component.dataType(), null, Map.of());
            SupervisionResult result = superviseOne(component.stageName(), output, context);
            stageReports.put(component.stageName(), result);
            allReports.addAll(result.validationReports());
        }

        double overall = 0.0;
        boolean runValid = false;
        if (!allReports.isEmpty()) {
            ConfidenceMetrics metrics = confidenceSystem.update(allReports);
            overall  = metrics.overall();
            runValid = overall >= RUN_VALID_CONFIDENCE;
        }

        List<Alert> alerts = confidenceSystem.activeAlerts();
        List<String> recommendations = runRecommendations(overall, alerts);

        log.info("[PipelineSupervisor] run supervision finished. runId={} stages={} confidence={} valid={} activeAlerts={}",
            runId, stageReports.size(), String.format("%.2f", overall), runValid, alerts.size());
        return new RunSupervisionReport(runId, Instant.now(), stageReports, overall, runValid,
            alerts, recommendations);
    }

    static List<String> runRecommendations(double overall, List<Alert> activeAlerts) {
        List<String> lines = new ArrayList<>();
        if (overall < RUN_CRITICAL_CONFIDENCE) {
            lines.add("CRITICAL: Very low confidence, review all stages");
        } else if (overall < RUN_VALID_CONFIDENCE) {
            lines.add("WARNING: Low confidence, verify calculations");
        }
        if (activeAlerts.size() > RUN_MANY_ALERTS) {
            lines.add("WARNING: Many active alerts, review the system");
        }
        if (activeAlerts.stream().anyMatch(a -> a.level() == AlertLevel.CRITICAL)) {
            lines.add("CRITICAL: Critical alerts active, stop the run");
        }
        if (lines.isEmpty()) {
            lines.add("SUCCESS: Run valid, continue");
        }
        return lines;
    }

    // ── session queries ───────────────────────────────────────────────────────

    public boolean shouldContinue() {
        return confidenceSystem.shouldContinue();
    }

    public boolean resolveAlert(int index) {
        return confidenceSystem.resolveAlert(index);
    }

    public List<Alert> activeAlerts() {
        return confidenceSystem.activeAlerts();
    }

    public ConfidenceTrend trend() {
        return confidenceSystem.trend();
    }

    public HealthReport healthReport() {
        return confidenceSystem.healthReport();
    }

    public Optional<StagePerformance> stagePerformance(String stageName) {
        return Optional.ofNullable(supervisors.get(stageName)).map(StageSupervisor::performanceSummary);
    }

    public SystemStatus systemStatus() {
        Set<Validator> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        supervisors.values().forEach(s -> distinct.addAll(s.validators()));
        return new SystemStatus(healthReport(), activeAlerts().size(), trend(),
            supervisors.size(), distinct.size(), Instant.now());
    }

    public Set<String> stageNames() {
        return supervisors.keySet();
    }

    public Optional<StageSupervisor> supervisor(String stageName) {
        return Optional.ofNullable(supervisors.get(stageName));
    }

    public ConfidenceSystem confidenceSystem() {
        return confidenceSystem;
    }
}
