package com.genai.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GenAiAnomalyServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenAiAnomalyServiceApplication.class, args);
    }
}
