package com.eainde.policylens.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * All {@code policylens.*} settings. Defaults here match application.yml.
 */
@Data
@ConfigurationProperties(prefix = "policylens")
public class PolicyLensProperties {

    private Chunking chunking = new Chunking();
    private Evaluation evaluation = new Evaluation();
    private Risk risk = new Risk();
    private Sentinel sentinel = new Sentinel();
    private Batch batch = new Batch();
    private RetrySettings retry = new RetrySettings();
    private Reasoning reasoning = new Reasoning();

    @Data
    public static class Chunking {
        private int size = 600;
        private int overlap = 100;
        private int minChars = 50;
    }

    @Data
    public static class Evaluation {
        private int topK = 5;
        private int topCases = 3;
        private double highThreshold = 0.75;
        private double mediumThreshold = 0.45;
        private int excerptLength = 500;
        private List<String> highRiskCountries = new ArrayList<>(
                List.of("North Korea", "Iran", "Syria", "KP", "IR", "SY"));
    }

    @Data
    public static class Risk {
        /** Weight of case-similarity risk in the composite score. */
        private double caseWeight = 0.3;
        private double flagThreshold = 0.75;
        private double reviewThreshold = 0.45;
        private int similarCases = 5;
    }

    @Data
    public static class Sentinel {
        private int pageSize = 200;
        private double reEvaluationThreshold = 0.10;
        private int highImpactCount = 100;
    }

    @Data
    public static class Batch {
        private int workers = 5;
        private int pageSize = 100;
    }

    @Data
    public static class RetrySettings {
        private int maxAttempts = 3;
        private Duration initialInterval = Duration.ofSeconds(1);
        private double multiplier = 2.0;
    }

    @Data
    public static class Reasoning {
        private String baseUrl = "https://openrouter.ai/api/v1";
        /** Reasoning is disabled when blank. */
        private String apiKey;
        private String model = "openai/gpt-4o-mini";
        private double temperature = 0.1;
        private int maxTokens = 2000;
        private Duration timeout = Duration.ofSeconds(60);
        private boolean logRequests = false;
    }
}
