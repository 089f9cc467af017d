package com.neoplatform.supervision.controller;

import com.neoplatform.common.confidence.Alert;
import com.neoplatform.common.confidence.ConfidenceTrend;
import com.neoplatform.common.confidence.HealthReport;
import com.neoplatform.common.supervision.RunState;
import com.neoplatform.common.supervision.RunSupervisionReport;
import com.neoplatform.common.supervision.StagePerformance;
import com.neoplatform.common.supervision.SupervisionResult;
import com.neoplatform.common.supervision.SystemStatus;
import com.neoplatform.supervision.dto.StageSupervisionRequest;
import com.neoplatform.supervision.service.SupervisionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/supervision")
public class SupervisionController {

    private final SupervisionService supervisionService;

    public SupervisionController(SupervisionService supervisionService) {
        this.supervisionService = supervisionService;
    }

    @PostMapping("/stages/{stageName}")
    public Mono<ResponseEntity<SupervisionResult>> superviseStage(
            @PathVariable String stageName,
            @RequestBody StageSupervisionRequest request,
            @RequestHeader(value = "X-Run-Id", required = false) String runId) {
        return supervisionService.superviseStage(stageName, request, runId).map(ResponseEntity::ok);
    }

    @PostMapping("/runs")
    public Mono<ResponseEntity<RunSupervisionReport>> superviseRun(@RequestBody RunState state) {
        return supervisionService.superviseRun(state).map(ResponseEntity::ok);
    }

    @GetMapping("/continue")
    public Mono<ResponseEntity<Map<String, Boolean>>> shouldContinue() {
        return supervisionService.shouldContinue()
            .map(decision -> ResponseEntity.ok(Map.of("shouldContinue", decision)));
    }

    @PostMapping("/alerts/{index}/resolve")
    public Mono<ResponseEntity<Map<String, Object>>> resolveAlert(@PathVariable int index) {
        return supervisionService.resolveAlert(index)
            .map(resolved -> resolved
                ? ResponseEntity.ok(Map.<String, Object>of("index", index, "resolved", true))
                : ResponseEntity.notFound().<Map<String, Object>>build());
    }

    @GetMapping("/alerts")
    public Mono<ResponseEntity<List<Alert>>> activeAlerts() {
        return supervisionService.activeAlerts().map(ResponseEntity::ok);
    }

    @GetMapping("/trend")
    public Mono<ResponseEntity<ConfidenceTrend>> trend() {
        return supervisionService.trend().map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthReport>> health() {
        return supervisionService.healthReport().map(ResponseEntity::ok);
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<SystemStatus>> status() {
        return supervisionService.systemStatus().map(ResponseEntity::ok);
    }

    @GetMapping("/stages/{stageName}/performance")
    public Mono<ResponseEntity<StagePerformance>> stagePerformance(@PathVariable String stageName) {
        return supervisionService.stagePerformance(stageName)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
