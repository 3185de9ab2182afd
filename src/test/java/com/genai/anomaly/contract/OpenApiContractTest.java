package com.genai.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document structure.
 * Ensures all endpoints and the persisted record schema are present,
 * protecting consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        assertThat(paths).containsKey("/api/v1/anomalies");
        assertThat(paths).containsKey("/api/v1/anomalies/{recordId}");
        assertThat(paths).containsKey("/api/v1/anomalies/stats");
        assertThat(paths).containsKey("/api/v1/anomalies/trust-signals/current");
        assertThat(paths).containsKey("/api/v1/anomalies/analyze");
        assertThat(paths).containsKey("/api/v1/anomalies/analyze/replay");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("AnomalyRecord");
        assertThat(schemas).containsKey("AnomalyListResponse");
        assertThat(schemas).containsKey("TrustSignal");
        assertThat(schemas).containsKey("DetectionReport");
        assertThat(schemas).containsKey("ReplayResult");
        assertThat(schemas).containsKey("TimeWindow");
    }

    @Test
    void openApiSpec_anomalyRecordSchema_hasPersistedFields() {
        Map<String, Object> props = apiDocs().read("$.components.schemas.AnomalyRecord.properties");

        assertThat(props).containsKeys("record_id", "anomaly_type", "observed_value", "expected_value",
                "deviation_score", "confidence", "algorithm_version", "time_window", "timestamp",
                "metric_name", "source_id");
    }
}
