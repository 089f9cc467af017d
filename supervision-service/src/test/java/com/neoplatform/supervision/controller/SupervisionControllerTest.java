package com.neoplatform.supervision.controller;

import com.neoplatform.common.confidence.ConfidenceSystem;
import com.neoplatform.common.supervision.PipelineSupervisor;
import com.neoplatform.supervision.service.SupervisionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

class SupervisionControllerTest {

    private Scheduler scheduler;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newSingle("supervision-test");
        SupervisionService service = new SupervisionService(
            PipelineSupervisor.withDefaultStages(new ConfidenceSystem()), scheduler);
        client = WebTestClient.bindToController(new SupervisionController(service)).build();
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    @DisplayName("POST stages/{stageName} → 200 with the decision in the body")
    void superviseStage() {
        String body = """
            {
              "stageType": "TRAJECTORY",
              "output": {
                "orbital_elements": {"semi_major_axis": 1.0, "eccentricity": 0.2, "inclination": 10.0},
                "orbital_period": 1.0
              }
            }
            """;

        client.post().uri("/api/v1/supervision/stages/trajectory")
            .header("X-Run-Id", "run_http")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.supervised").isEqualTo(true)
            .jsonPath("$.recommendation").isEqualTo("CONTINUE")
            .jsonPath("$.validationReports[0].validatorName").isEqualTo("PhysicalPlausibilityValidator");
    }

    @Test
    @DisplayName("unknown stage → 200 with supervised=false and STOP")
    void unknownStage() {
        client.post().uri("/api/v1/supervision/stages/warp_drive")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"output\": {}}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.supervised").isEqualTo(false)
            .jsonPath("$.recommendation").isEqualTo("STOP");
    }

    @Test
    @DisplayName("POST runs → run report")
    void superviseRun() {
        client.post().uri("/api/v1/supervision/runs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"explanation\": \"The asteroid orbit and impact energy depend on velocity.\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.runId").exists()
            .jsonPath("$.stageReports.explainer.supervised").isEqualTo(true);
    }

    @Test
    @DisplayName("resolving an unknown alert index → 404")
    void resolveUnknownAlert() {
        client.post().uri("/api/v1/supervision/alerts/3/resolve")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("performance of an unknown stage → 404, known stage → 200")
    void stagePerformance() {
        client.get().uri("/api/v1/supervision/stages/warp_drive/performance")
            .exchange()
            .expectStatus().isNotFound();

        client.get().uri("/api/v1/supervision/stages/trajectory/performance")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.totalSupervisions").isEqualTo(0);
    }

    @Test
    @DisplayName("GET continue, health, trend, status, alerts")
    void queries() {
        client.get().uri("/api/v1/supervision/continue").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.shouldContinue").isEqualTo(true);

        client.get().uri("/api/v1/supervision/health").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.status").isEqualTo("NO_DATA");

        client.get().uri("/api/v1/supervision/trend").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.sufficientData").isEqualTo(false);

        client.get().uri("/api/v1/supervision/status").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.supervisorsActive").isEqualTo(7);

        client.get().uri("/api/v1/supervision/alerts").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.length()").isEqualTo(0);
    }
}
