package com.genai.anomaly.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.model.ActualRecord;
import com.genai.anomaly.model.PredictedRecord;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.genai.anomaly.testutil.TestDataFactory.actual;
import static com.genai.anomaly.testutil.TestDataFactory.actualOutcome;
import static com.genai.anomaly.testutil.TestDataFactory.predicted;
import static com.genai.anomaly.testutil.TestDataFactory.predictedOutcome;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Drives the HTTP surface end to end: JSON-Lines input files, live analysis
 * into the in-memory store, queries, replay and the trust signal.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class AnomalyApiIntegrationTest {

    // Kept clear of windows other tests in the shared context may use
    private static final Instant START = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant END = START.plus(Duration.ofHours(1));

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private AnomalyProperties properties;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @BeforeEach
    void writeInputs() throws Exception {
        List<PredictedRecord> predictedRecords = new ArrayList<>();
        List<ActualRecord> actualRecords = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            Instant ts = START.minus(Duration.ofHours(i + 1)).plusSeconds(60);
            predictedRecords.add(predicted("hist-" + i, "cost_usd", 100.0, ts));
            actualRecords.add(actual("hist-" + i, "cost_usd", i % 2 == 0 ? 80.0 : 120.0, ts));
        }
        Instant spike = START.plus(Duration.ofMinutes(5));
        predictedRecords.add(predicted("trace-spike", "cost_usd", 100.0, spike));
        actualRecords.add(actual("trace-spike", "cost_usd", 150.0, spike));
        Instant denial = START.plus(Duration.ofMinutes(20));
        predictedRecords.add(predictedOutcome("trace-policy", "approved", denial));
        actualRecords.add(actualOutcome("trace-policy", "denied", denial));

        Path dataDir = Paths.get(properties.getInput().getDataDir());
        Files.createDirectories(dataDir);
        writeLines(dataDir.resolve("predicted.jsonl"), predictedRecords);
        writeLines(dataDir.resolve("actual.jsonl"), actualRecords);
    }

    private void writeLines(Path file, List<?> records) throws Exception {
        StringBuilder content = new StringBuilder();
        for (Object record : records) {
            content.append(mapper.writeValueAsString(record)).append('\n');
        }
        Files.writeString(file, content.toString(), StandardCharsets.UTF_8);
    }

    @Test
    void analyzeQueryReplayAndTrust() {
        Map<String, String> window = Map.of("start", START.toString(), "end", END.toString());

        ResponseEntity<String> analyzed = restTemplate.postForEntity("/api/v1/anomalies/analyze", window, String.class);
        assertThat(analyzed.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext report = JsonPath.parse(analyzed.getBody());
        List<String> types = report.read("$.records[*].anomaly_type");
        assertThat(types).containsExactly("cost", "policy");

        String costId = report.read("$.records[0].record_id");

        ResponseEntity<String> again = restTemplate.postForEntity("/api/v1/anomalies/analyze", window, String.class);
        assertThat((Boolean) JsonPath.read(again.getBody(), "$.already_processed")).isTrue();
        assertThat((String) JsonPath.read(again.getBody(), "$.records[0].record_id")).isEqualTo(costId);
        ResponseEntity<String> fetched = restTemplate.getForEntity("/api/v1/anomalies/" + costId, String.class);
        assertThat(fetched.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((Double) JsonPath.read(fetched.getBody(), "$.confidence")).isCloseTo(0.625, within(1e-9));

        ResponseEntity<String> listed = restTemplate.getForEntity(
                "/api/v1/anomalies?anomaly_type=policy&start={start}&end={end}", String.class, START, END);
        assertThat((Integer) JsonPath.read(listed.getBody(), "$.returned_count")).isEqualTo(1);
        assertThat((Integer) JsonPath.read(listed.getBody(), "$.total_count")).isEqualTo(1);

        ResponseEntity<String> replayed = restTemplate.postForEntity("/api/v1/anomalies/analyze/replay",
                Map.of("start", START.toString(), "end", END.toString(), "algorithm_version", "1.0.0"), String.class);
        assertThat(replayed.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((String) JsonPath.read(replayed.getBody(), "$.emission_mode")).isEqualTo("REPLAY");
        assertThat((String) JsonPath.read(replayed.getBody(), "$.comparison.status")).isEqualTo("MATCHED");

        ResponseEntity<String> trust = restTemplate.getForEntity(
                "/api/v1/anomalies/trust-signals/current?start={start}&end={end}", String.class, START, END);
        assertThat(trust.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((Integer) JsonPath.read(trust.getBody(), "$.total_count")).isEqualTo(2);

        ResponseEntity<String> missing = restTemplate.getForEntity("/api/v1/anomalies/does-not-exist", String.class);
        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void replay_unknownVersion_badRequest() {
        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/anomalies/analyze/replay",
                Map.of("start", START.toString(), "end", END.toString(), "algorithm_version", "0.0.0"), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat((String) JsonPath.read(response.getBody(), "$.error")).isEqualTo("INVALID_ARGUMENT");
    }
}
