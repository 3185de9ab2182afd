package com.genai.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI anomalyServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("GenAI Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Advisory anomaly detection over predicted vs. actual GenAI operational metrics.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Correlate predicted and actual records per source, metric and window\n" +
                                "2. Compute per-metric baselines (mean, std, exact percentiles) over the lookback\n" +
                                "3. Run the cost, quality, latency and policy detectors\n" +
                                "4. Stamp candidates above the confidence floor into immutable records\n" +
                                "5. Append to the anomaly store (append-only, never updated)\n\n" +
                                "**Anomaly Types:**\n" +
                                "- `cost`: z-score deviation of cost metrics\n" +
                                "- `quality`: z-score or low-percentile breach of quality metrics\n" +
                                "- `latency`: P99 breach or z-score spike of latency metrics\n" +
                                "- `policy`: predicted vs. actual outcome mismatch\n\n" +
                                "Signals are advisory. Replay re-derives anomalies for a pinned algorithm version " +
                                "and never writes to the live store.")
                        .contact(new Contact().name("Anomaly Detection Team")));
    }
}
