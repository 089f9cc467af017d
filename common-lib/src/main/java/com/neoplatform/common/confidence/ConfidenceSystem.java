package com.neoplatform.common.confidence;

import com.neoplatform.common.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Process-wide trustworthiness tracker: turns validator reports plus optional side-channel
 * samples into one {@link ConfidenceMetrics} snapshot, keeps the snapshot history, classifies
 * the trend and raises {@link Alert}s.
 *
 * <h3>Update algorithm</h3>
 * <ol>
 *   <li>No reports → {@link #defaultMetrics()}; nothing is stored.</li>
 *   <li>domainPhysical = mean over non-narrative reports;
 *       conceptualCoherence = mean over narrative reports (1.0 when none).</li>
 *   <li>orbital, dataQuality (default 0.5) from the observation sample;
 *       prediction (default 0.6) from the prediction sample.</li>
 *   <li>overall = weighted sum, clamped to [0, 1].</li>
 *   <li>trend from the last {@code trendWindow} stored snapshots, alert level from overall.</li>
 *   <li>append to history (FIFO eviction beyond capacity), then raise alerts.</li>
 * </ol>
 *
 * <h3>Alerts</h3>
 * Raised when the alert level is HIGH or CRITICAL, when the trend is DECLINING below the
 * declining-alert ceiling, and when the reports contain critical results. Alerts are never
 * evicted, so their indices stay stable for {@link #resolveAlert(int)}.
 *
 * <p>Not thread-safe. One instance is one supervision session; a concurrent host must
 * serialize access.
 */
public class ConfidenceSystem {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceSystem.class);

    /** Absorbs floating-point noise so a half-window difference of exactly the threshold stays STABLE. */
    static final double TREND_EPSILON = 1e-9;

    static final double DEFAULT_COMPONENT       = 0.5;
    static final double DEFAULT_PREDICTION      = 0.6;
    static final double NARRATIVE_ABSENT        = 1.0;

    static final double DEFAULT_MAGNITUDE       = 20.0;
    static final double BRIGHT_MAGNITUDE        = 15.0;
    static final double FAINT_MAGNITUDE         = 25.0;
    static final double BRIGHT_FACTOR           = 1.1;
    static final double FAINT_FACTOR            = 0.8;
    static final double MIN_ORBITAL_CONFIDENCE  = 0.1;
    static final double MAX_RELATIVE_SPREAD     = 0.9;

    private final ConfidenceSettings settings;
    private final Deque<ConfidenceMetrics> history = new ArrayDeque<>();
    private final List<Alert> alerts = new ArrayList<>();

    public ConfidenceSystem() {
        this(ConfidenceSettings.defaults());
    }

    public ConfidenceSystem(ConfidenceSettings settings) {
        this.settings = settings;
    }

    public ConfidenceSettings settings() {
        return settings;
    }

    public ConfidenceMetrics update(List<ValidationReport> reports) {
        return update(reports, null, null);
    }

    /**
     * Computes, stores and returns a new snapshot.
     *
     * @param reports     validator reports of one or more stage supervisions
     * @param observation optional input sample of the analysed object
     * @param prediction  optional narrative/prediction sample
     * @return the new snapshot, or the neutral default when {@code reports} is empty
     */
    public ConfidenceMetrics update(List<ValidationReport> reports,
                                    ObservationSample observation,
                                    PredictionSample prediction) {
        if (reports == null || reports.isEmpty()) {
            log.debug("[ConfidenceSystem] no reports supplied, returning default snapshot");
            return defaultMetrics();
        }

        double physical  = clamp01(domainPhysicalConfidence(reports));
        double coherence = clamp01(conceptualCoherenceConfidence(reports));
        double orbital   = observation != null ? clamp01(orbitalConfidence(observation)) : DEFAULT_COMPONENT;
        double quality   = observation != null ? clamp01(dataQualityConfidence(observation)) : DEFAULT_COMPONENT;
        double predicted = prediction  != null ? clamp01(predictionConfidence(prediction)) : DEFAULT_PREDICTION;

        double overall = clamp01(settings.weights().combine(physical, coherence, orbital, quality, predicted));

        Trend trend = classifyTrend(recentOverall(), settings.trendThreshold());
        AlertLevel alertLevel = alertLevelFor(overall);

        ConfidenceMetrics metrics = new ConfidenceMetrics(overall, physical, coherence, orbital,
            quality, predicted, trend, alertLevel, Instant.now());

        history.addLast(metrics);
        while (history.size() > settings.historyCapacity()) {
            history.removeFirst();
        }

        raiseAlerts(metrics, reports);

        log.info("[ConfidenceSystem] overall={} physical={} coherence={} orbital={} dataQuality={} prediction={} trend={} alertLevel={}",
            fmt(overall), fmt(physical), fmt(coherence), fmt(orbital), fmt(quality), fmt(predicted), trend, alertLevel);
        return metrics;
    }

    // ── components ────────────────────────────────────────────────────────────

    static double domainPhysicalConfidence(List<ValidationReport> reports) {
        return reports.stream()
            .filter(r -> !r.kind().isNarrative())
            .mapToDouble(ValidationReport::overallConfidence)
            .average()
            .orElse(0.0);
    }

    static double conceptualCoherenceConfidence(List<ValidationReport> reports) {
        return reports.stream()
            .filter(r -> r.kind().isNarrative())
            .mapToDouble(ValidationReport::overallConfidence)
            .average()
            .orElse(NARRATIVE_ABSENT);
    }

    /**
     * {@code max(0.1, 1 − min(spread, 0.9))} where spread is the relative size-bound spread,
     * scaled ×1.1 for bright (H &lt; 15) and ×0.8 for faint (H &gt; 25) objects, capped at 1.0.
     * Missing or zero bounds → 0.5.
     */
    static double orbitalConfidence(ObservationSample sample) {
        Double min = sample.diameterMin();
        Double max = sample.diameterMax();
        if (min == null || max == null || min == 0.0 || max == 0.0) {
            return DEFAULT_COMPONENT;
        }

        double spread = Math.abs(max - min) / Math.abs(min);
        double confidence = Math.max(MIN_ORBITAL_CONFIDENCE, 1.0 - Math.min(spread, MAX_RELATIVE_SPREAD));

        double magnitude = sample.absoluteMagnitude() != null ? sample.absoluteMagnitude() : DEFAULT_MAGNITUDE;
        if (magnitude < BRIGHT_MAGNITUDE) {
            confidence *= BRIGHT_FACTOR;
        } else if (magnitude > FAINT_MAGNITUDE) {
            confidence *= FAINT_FACTOR;
        }
        return Math.min(1.0, confidence);
    }

    /** 40% required-field presence, 40% orbital-subfield presence, 20% internal consistency. */
    static double dataQualityConfidence(ObservationSample sample) {
        int present = 0;
        if (sample.id() != null) present++;
        if (sample.name() != null) present++;
        if (sample.diameterMin() != null) present++;
        if (sample.diameterMax() != null) present++;
        if (sample.absoluteMagnitude() != null) present++;
        if (sample.orbitalDataPresent()) present++;
        double completeness = present / 6.0;

        int orbitalPresent = 0;
        if (sample.eccentricity() != null) orbitalPresent++;
        if (sample.inclination() != null) orbitalPresent++;
        if (sample.semiMajorAxis() != null) orbitalPresent++;
        double orbitalQuality = orbitalPresent / 3.0;

        return Math.min(1.0, completeness * 0.4 + orbitalQuality * 0.4 + consistency(sample) * 0.2);
    }

    /**
     * Mean of three sanity checks: size bounds ordered (1.0 / 0.0), absolute magnitude in
     * [5, 30] (1.0 / 0.2), eccentricity in [0, 1] (1.0 / 0.2). Unknown inputs score 0.5.
     */
    static double consistency(ObservationSample sample) {
        Double min = sample.diameterMin();
        Double max = sample.diameterMax();
        double ordering = (min != null && max != null && min > 0 && max > 0)
            ? (min <= max ? 1.0 : 0.0)
            : 0.5;

        Double h = sample.absoluteMagnitude();
        double magnitude = h == null ? 0.5 : (h >= 5 && h <= 30 ? 1.0 : 0.2);

        Double e = sample.eccentricity();
        double eccentricity = e == null ? 0.5 : (e >= 0 && e <= 1 ? 1.0 : 0.2);

        return (ordering + magnitude + eccentricity) / 3.0;
    }

    /** 50% self-reported confidence, 30% structural consistency, 20% summary length bucket. */
    static double predictionConfidence(PredictionSample sample) {
        double selfReported = sample.confidenceLevel() != null
            ? clamp01(sample.confidenceLevel()) : DEFAULT_PREDICTION;

        int present = (sample.summary() != null ? 1 : 0) + (sample.confidenceLevel() != null ? 1 : 0);
        double structure = present / 2.0;

        int words = sample.summaryWordCount();
        double completeness;
        if (words > 20)      completeness = 1.0;
        else if (words > 10) completeness = 0.7;
        else if (words > 5)  completeness = 0.4;
        else                 completeness = 0.1;

        return Math.min(1.0, selfReported * 0.5 + structure * 0.3 + completeness * 0.2);
    }

    /**
     * Compares the mean of the first half of {@code recentOverall} with the mean of the second
     * half. Fewer than two values → STABLE. A difference of exactly ±threshold is STABLE.
     */
    public static Trend classifyTrend(List<Double> recentOverall, double threshold) {
        int n = recentOverall.size();
        if (n < 2) return Trend.STABLE;

        int half = n / 2;
        double first = 0.0;
        for (int i = 0; i < half; i++) first += recentOverall.get(i);
        first /= half;

        double second = 0.0;
        for (int i = half; i < n; i++) second += recentOverall.get(i);
        second /= (n - half);

        double diff = second - first;
        if (diff > threshold + TREND_EPSILON)    return Trend.IMPROVING;
        if (diff < -(threshold + TREND_EPSILON)) return Trend.DECLINING;
        return Trend.STABLE;
    }

    AlertLevel alertLevelFor(double overall) {
        if (overall < settings.criticalThreshold()) return AlertLevel.CRITICAL;
        if (overall < settings.highThreshold())     return AlertLevel.HIGH;
        if (overall < settings.mediumThreshold())   return AlertLevel.MEDIUM;
        return AlertLevel.LOW;
    }

    private List<Double> recentOverall() {
        return history.stream()
            .skip(Math.max(0, history.size() - settings.trendWindow()))
            .map(ConfidenceMetrics::overall)
            .toList();
    }

    // ── alerts ────────────────────────────────────────────────────────────────

    private void raiseAlerts(ConfidenceMetrics metrics, List<ValidationReport> reports) {
        String origin = originOf(reports);

        if (metrics.alertLevel().isAtLeast(AlertLevel.HIGH)) {
            addAlert(Alert.raise(metrics.alertLevel(),
                String.format(Locale.ROOT, "System confidence %s: %.2f",
                    metrics.alertLevel().name().toLowerCase(Locale.ROOT), metrics.overall()),
                origin));
        }

        if (metrics.trend() == Trend.DECLINING && metrics.overall() < settings.decliningAlertCeiling()) {
            addAlert(Alert.raise(AlertLevel.MEDIUM,
                String.format(Locale.ROOT, "Declining confidence trend detected: %.2f", metrics.overall()),
                origin));
        }

        int criticalErrors = reports.stream().mapToInt(r -> r.errors().size()).sum();
        if (criticalErrors > 0) {
            String stages = reports.stream()
                .filter(r -> !r.isValid())
                .map(ValidationReport::stageName)
                .distinct()
                .collect(Collectors.joining(","));
            addAlert(Alert.raise(AlertLevel.CRITICAL,
                "Critical errors detected: " + criticalErrors, stages));
        }
    }

    private void addAlert(Alert alert) {
        alerts.add(alert);
        log.warn("[ConfidenceSystem] alert raised. level={} stage={} message={}",
            alert.level(), alert.stageName(), alert.message());

        long unresolved = alerts.stream().filter(a -> !a.resolved()).count();
        if (unresolved > settings.unresolvedAlertSoftLimit()) {
            log.warn("[ConfidenceSystem] unresolved alerts={} exceed soft limit={}",
                unresolved, settings.unresolvedAlertSoftLimit());
        }
    }

    private static String originOf(List<ValidationReport> reports) {
        List<String> stages = reports.stream().map(ValidationReport::stageName).distinct().toList();
        return stages.size() == 1 ? stages.get(0) : "system";
    }

    /**
     * Marks the alert at {@code index} (position in {@link #alerts()}) resolved.
     *
     * @return false when the index is out of range
     */
    public boolean resolveAlert(int index) {
        if (index < 0 || index >= alerts.size()) {
            return false;
        }
        alerts.set(index, alerts.get(index).asResolved());
        log.info("[ConfidenceSystem] alert resolved. index={}", index);
        return true;
    }

    /** Every alert ever raised, in raise order. Indices match {@link #resolveAlert(int)}. */
    public List<Alert> alerts() {
        return List.copyOf(alerts);
    }

    public List<Alert> activeAlerts() {
        return alerts.stream().filter(a -> !a.resolved()).toList();
    }

    // ── decisions and reporting ───────────────────────────────────────────────

    /**
     * False when any unresolved alert is CRITICAL or the latest overall confidence is below
     * the critical threshold; true otherwise, including before the first update.
     */
    public boolean shouldContinue() {
        boolean criticalOpen = alerts.stream()
            .anyMatch(a -> !a.resolved() && a.level() == AlertLevel.CRITICAL);
        if (criticalOpen) {
            return false;
        }
        return latest()
            .map(m -> m.overall() >= settings.criticalThreshold())
            .orElse(true);
    }

    public Optional<ConfidenceMetrics> latest() {
        return Optional.ofNullable(history.peekLast());
    }

    public List<ConfidenceMetrics> history() {
        return List.copyOf(history);
    }

    public ConfidenceTrend trend() {
        if (history.size() < 2) {
            return ConfidenceTrend.insufficientData();
        }
        List<ConfidenceMetrics> snapshot = new ArrayList<>(history);
        ConfidenceMetrics current  = snapshot.get(snapshot.size() - 1);
        ConfidenceMetrics previous = snapshot.get(snapshot.size() - 2);
        return new ConfidenceTrend(current.trend(), true,
            current.overall() - previous.overall(), current.overall(), previous.overall());
    }

    public HealthReport healthReport() {
        int active = activeAlerts().size();
        return latest()
            .map(m -> new HealthReport(
                m.alertLevel() == AlertLevel.LOW ? HealthStatus.HEALTHY : HealthStatus.DEGRADED,
                m.overall(), m, active, m.timestamp()))
            .orElseGet(() -> new HealthReport(HealthStatus.NO_DATA, 0.0, null, active, null));
    }

    /** Neutral snapshot returned when there is nothing to aggregate. Never stored. */
    public static ConfidenceMetrics defaultMetrics() {
        return new ConfidenceMetrics(DEFAULT_COMPONENT, DEFAULT_COMPONENT, DEFAULT_COMPONENT,
            DEFAULT_COMPONENT, DEFAULT_COMPONENT, DEFAULT_PREDICTION,
            Trend.STABLE, AlertLevel.MEDIUM, Instant.now());
    }

    static double clamp01(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
