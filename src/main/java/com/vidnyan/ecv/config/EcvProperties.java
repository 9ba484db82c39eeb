package com.vidnyan.ecv.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for verification and test generation.
 * Can be configured via application.properties or application.yml
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "ecv")
public class EcvProperties {

    private Generation generation = new Generation();
    private Symbolic symbolic = new Symbolic();
    private Causal causal = new Causal();
    private Verification verification = new Verification();

    @PostConstruct
    public void init() {
        if (generation.poolSize < 1) {
            log.warn("ecv.generation.pool-size {} is not positive, using 1", generation.poolSize);
            generation.poolSize = 1;
        }
        if (symbolic.bisectionIterations > 10) {
            log.warn("ecv.symbolic.bisection-iterations {} capped at 10", symbolic.bisectionIterations);
            symbolic.bisectionIterations = 10;
        }
    }

    @Data
    public static class Generation {
        /** Upper bound on worker threads for the (rule, technique) grid. */
        private int poolSize = 8;
        /** Timeout for one (rule, technique) task; null or zero disables it. */
        private Duration taskTimeout = Duration.ofSeconds(60);
        /** Seed for generated values; null draws a fresh seed per task. */
        private Long seed;
    }

    @Data
    public static class Symbolic {
        private int bisectionIterations = 10;
        private double searchLow = -1000;
        private double searchHigh = 1000;
        private double epsilon = 0.001;
    }

    @Data
    public static class Causal {
        private int interventionTopK = 3;
        private int counterfactualTopK = 2;
    }

    @Data
    public static class Verification {
        /** Maximum rule pairs examined by rule-set verification; 0 or less is unbounded. */
        private int maxRulePairs = 5000;
    }
}
