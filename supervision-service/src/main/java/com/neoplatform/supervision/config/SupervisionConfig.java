package com.neoplatform.supervision.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.neoplatform.common.confidence.ConfidenceSettings;
import com.neoplatform.common.confidence.ConfidenceSystem;
import com.neoplatform.common.confidence.ConfidenceWeights;
import com.neoplatform.common.supervision.PipelineSupervisor;
import com.neoplatform.common.validation.ConceptualCoherenceValidator;
import com.neoplatform.common.validation.DataCompletenessValidator;
import com.neoplatform.common.validation.PhysicalPlausibilityValidator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class SupervisionConfig {

    @Value("${supervision.weights.domain-physical:0.30}")
    private double weightDomainPhysical;

    @Value("${supervision.weights.conceptual-coherence:0.20}")
    private double weightConceptualCoherence;

    @Value("${supervision.weights.orbital-uncertainty:0.20}")
    private double weightOrbitalUncertainty;

    @Value("${supervision.weights.data-quality:0.15}")
    private double weightDataQuality;

    @Value("${supervision.weights.prediction-quality:0.15}")
    private double weightPredictionQuality;

    @Value("${supervision.thresholds.critical:0.3}")
    private double criticalThreshold;

    @Value("${supervision.thresholds.high:0.5}")
    private double highThreshold;

    @Value("${supervision.thresholds.medium:0.7}")
    private double mediumThreshold;

    @Value("${supervision.thresholds.declining-alert-ceiling:0.8}")
    private double decliningAlertCeiling;

    @Value("${supervision.trend.window:5}")
    private int trendWindow;

    @Value("${supervision.trend.threshold:0.05}")
    private double trendThreshold;

    @Value("${supervision.history.capacity:100}")
    private int historyCapacity;

    @Value("${supervision.history.stage-capacity:50}")
    private int stageHistoryCapacity;

    @Value("${supervision.alerts.unresolved-soft-limit:100}")
    private int unresolvedAlertSoftLimit;

    @Bean
    public ConfidenceSettings confidenceSettings() {
        ConfidenceWeights weights = new ConfidenceWeights(weightDomainPhysical, weightConceptualCoherence,
            weightOrbitalUncertainty, weightDataQuality, weightPredictionQuality);
        return new ConfidenceSettings(weights, criticalThreshold, highThreshold, mediumThreshold,
            decliningAlertCeiling, trendWindow, trendThreshold, historyCapacity, unresolvedAlertSoftLimit);
    }

    @Bean
    public ConfidenceSystem confidenceSystem(ConfidenceSettings confidenceSettings) {
        return new ConfidenceSystem(confidenceSettings);
    }

    @Bean
    public PhysicalPlausibilityValidator physicalPlausibilityValidator() {
        return new PhysicalPlausibilityValidator();
    }

    @Bean
    public DataCompletenessValidator dataCompletenessValidator() {
        return new DataCompletenessValidator();
    }

    @Bean
    public ConceptualCoherenceValidator conceptualCoherenceValidator() {
        return new ConceptualCoherenceValidator();
    }

    @Bean
    public PipelineSupervisor pipelineSupervisor(ConfidenceSystem confidenceSystem,
                                                 PhysicalPlausibilityValidator physical,
                                                 DataCompletenessValidator completeness,
                                                 ConceptualCoherenceValidator coherence) {
        return PipelineSupervisor.withDefaultStages(confidenceSystem, physical, completeness, coherence,
            stageHistoryCapacity);
    }

    /** Single worker: the supervision session is single-writer. */
    @Bean(destroyMethod = "dispose")
    public Scheduler supervisionScheduler() {
        return Schedulers.newSingle("supervision");
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
