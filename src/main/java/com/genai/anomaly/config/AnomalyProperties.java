package com.genai.anomaly.config;

import com.genai.anomaly.model.AnomalyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyProperties {

    // Version stamped on live records. Must be a key of `algorithms`.
    private String activeVersion = "1.0.0";

    // Parameter sets per algorithm version. Historical versions stay here so replay can bind them.
    // Keys containing dots need brackets in YAML: anomaly.algorithms."[1.0.0]".
    private Map<String, Algorithm> algorithms = new LinkedHashMap<>(Map.of("1.0.0", new Algorithm()));

    private Store store = new Store();

    private Trust trust = new Trust();

    private Replay replay = new Replay();

    private Detection detection = new Detection();

    private Live live = new Live();

    private Input input = new Input();

    @Data
    public static class Algorithm {
        // Minimum baseline samples per metric; below this the metric's detectors are skipped
        private long minSamples = 10;
        private List<Double> percentiles = List.of(5.0, 50.0, 95.0, 99.0);
        // History preceding the evaluated window that baselines are computed over
        private Duration baselineLookback = Duration.ofDays(7);
        // Size of the epoch-aligned buckets predicted and actual records are paired in
        private Duration correlationWindow = Duration.ofHours(1);
        // Global floor; candidates below it are never stored
        private double minConfidence = 0.5;
        // Clamp for |z|, also the score of a nonzero deviation against a zero-variance baseline
        private double maxDeviationScore = 1000.0;
        private Cost cost = new Cost();
        private Quality quality = new Quality();
        private Latency latency = new Latency();
        private Policy policy = new Policy();
    }

    @Data
    public static class Cost {
        private boolean enabled = true;
        private List<String> metrics = List.of("cost_usd");
        private double deviationThreshold = 2.0;
    }

    @Data
    public static class Quality {
        private boolean enabled = true;
        private List<String> metrics = List.of("quality_score");
        private double deviationThreshold = 2.0;
        private double lowPercentile = 5.0;
        private double percentileBoost = 0.1;
    }

    @Data
    public static class Latency {
        private boolean enabled = true;
        private List<String> metrics = List.of("latency_ms");
        private double deviationThreshold = 2.0;
        private double highPercentile = 99.0;
        private double percentileMultiplier = 1.0;
        private double percentileBoost = 0.15;
    }

    @Data
    public static class Policy {
        private boolean enabled = true;
        private List<String> metrics = List.of("policy_outcome");
        private double confidence = 0.9;
    }

    @Data
    public static class Store {
        // memory | file | aerospike
        private String backend = "memory";
        private String filePath = "./data/anomalies/anomalies.jsonl";
        // Completed live runs, file backend only
        private String runsFilePath = "./data/anomalies/detection-runs.jsonl";
    }

    @Data
    public static class Trust {
        private Duration defaultWindow = Duration.ofHours(24);
        private Duration halfLife = Duration.ofHours(6);
        // Weighted anomaly mass at which the composite score reaches 1 - 1/e
        private double saturation = 5.0;
        private double mediumThreshold = 0.25;
        private double lowThreshold = 0.6;
        private Map<AnomalyType, Double> typeWeights = new EnumMap<>(Map.of(
                AnomalyType.COST, 1.0,
                AnomalyType.QUALITY, 1.0,
                AnomalyType.LATENCY, 1.0,
                AnomalyType.POLICY, 1.5));
    }

    @Data
    public static class Replay {
        private Duration timeout = Duration.ofMinutes(5);
        private int maxConcurrent = 2;
    }

    @Data
    public static class Detection {
        private int parallelism = 4;
    }

    @Data
    public static class Live {
        private boolean enabled = false;
        private Duration windowSize = Duration.ofHours(1);
        private int checkIntervalSeconds = 300;
    }

    @Data
    public static class Input {
        private String dataDir = "./data/input";
    }
}
