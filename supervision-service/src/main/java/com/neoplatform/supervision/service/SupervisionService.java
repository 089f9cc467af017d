package com.neoplatform.supervision.service;

import com.neoplatform.common.confidence.Alert;
import com.neoplatform.common.confidence.ConfidenceTrend;
import com.neoplatform.common.confidence.HealthReport;
import com.neoplatform.common.confidence.ObservationSample;
import com.neoplatform.common.confidence.PredictionSample;
import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.supervision.PipelineSupervisor;
import com.neoplatform.common.supervision.RunState;
import com.neoplatform.common.supervision.RunSupervisionReport;
import com.neoplatform.common.supervision.StagePerformance;
import com.neoplatform.common.supervision.SupervisionResult;
import com.neoplatform.common.supervision.SystemStatus;
import com.neoplatform.common.trace.TraceContextUtil;
import com.neoplatform.supervision.dto.StageSupervisionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Reactive facade over the process-wide {@link PipelineSupervisor}.
 *
 * <p>Every call is executed on the single supervision scheduler, so the session sees one
 * writer at a time regardless of how many requests arrive concurrently.
 */
@Service
public class SupervisionService {

    private static final Logger log = LoggerFactory.getLogger(SupervisionService.class);

    private final PipelineSupervisor supervisor;
    private final Scheduler scheduler;

    public SupervisionService(PipelineSupervisor supervisor, Scheduler supervisionScheduler) {
        this.supervisor = supervisor;
        this.scheduler  = supervisionScheduler;
    }

    public Mono<SupervisionResult> superviseStage(String stageName, StageSupervisionRequest request, String runId) {
        Mono<SupervisionResult> pipeline = Mono.deferContextual(ctx -> {
            String id = TraceContextUtil.getRunId(ctx);
            return serialized(() -> {
                StageContext context = new StageContext(stageName, request.stageType(), id,
                    request.dataType(), null, request.attributes());
                SupervisionResult result = supervisor.superviseOne(stageName, request.output(), context,
                    ObservationSample.fromMap(request.observation()),
                    PredictionSample.fromMap(request.prediction()));
                TraceContextUtil.withMdc(ctx, () -> log.info(
                    "[SupervisionService] stage supervised. stage={} supervised={} recommendation={}",
                    stageName, result.supervised(), result.recommendation()));
                return result;
            });
        });
        return runId != null && !runId.isBlank() ? TraceContextUtil.withRunId(pipeline, runId) : pipeline;
    }

    public Mono<RunSupervisionReport> superviseRun(RunState state) {
        return serialized(() -> supervisor.superviseRun(state))
            .doOnSuccess(report -> TraceContextUtil.withMdc(report.runId(), () -> log.info(
                "[SupervisionService] run supervised. valid={} alerts={}",
                report.runValid(), report.alerts().size())));
    }

    public Mono<Boolean> shouldContinue() {
        return serialized(supervisor::shouldContinue);
    }

    public Mono<Boolean> resolveAlert(int index) {
        return serialized(() -> supervisor.resolveAlert(index));
    }

    public Mono<List<Alert>> activeAlerts() {
        return serialized(supervisor::activeAlerts);
    }

    public Mono<ConfidenceTrend> trend() {
        return serialized(supervisor::trend);
    }

    public Mono<HealthReport> healthReport() {
        return serialized(supervisor::healthReport);
    }

    public Mono<SystemStatus> systemStatus() {
        return serialized(supervisor::systemStatus);
    }

    /** Empty when the stage is not part of the pipeline. */
    public Mono<StagePerformance> stagePerformance(String stageName) {
        return Mono.defer(() -> Mono.justOrEmpty(supervisor.stagePerformance(stageName)))
            .subscribeOn(scheduler);
    }

    private <T> Mono<T> serialized(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(scheduler);
    }
}
