package com.pdm.engine;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest
@ActiveProfiles("demo")
@AutoConfigureWebTestClient
class MaintenanceEngineApplicationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void shouldAnalyseAssetWithKnownIssueEndToEnd() {
        webTestClient.post()
                .uri("/api/v1/analyses")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {
                        "assetType": "crane",
                        "assetId": "sep-450",
                        "assetName": "SEP-450",
                        "equipmentList": [
                            {"id": "sep-450-wire-rope", "name": "Wire Rope", "type": "wire_rope", "cycleCount": 12000},
                            {"id": "sep-450-hoist-motor", "name": "Hoist Motor", "type": "hoist_motor", "operatingHours": 18000}
                        ],
                        "environmentData": {"temperature": 41, "humidity": 70}
                    }
                    """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("complete")
                .jsonPath("$.analysisVersion").isEqualTo("2.1.0")
                .jsonPath("$.sourcesQueried.length()").isEqualTo(8)
                .jsonPath("$.predictions.length()").isEqualTo(2)
                .jsonPath("$.predictions[0].equipmentId").isEqualTo("sep-450-wire-rope")
                .jsonPath("$.predictions[0].priority").isEqualTo("high")
                .jsonPath("$.predictions[1].equipmentId").isEqualTo("sep-450-hoist-motor")
                .jsonPath("$.predictions[1].healthScore").isEqualTo(61.0)
                .jsonPath("$.predictions[1].confidence").isEqualTo(92)
                .jsonPath("$.degradationCurve.length()").isEqualTo(16);
    }

    @Test
    void shouldServeBundledCatalog() {
        webTestClient.get()
                .uri("/api/v1/catalog/profiles/slew_bearing")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.manufacturer").isEqualTo("Rothe Erde");
    }
}
