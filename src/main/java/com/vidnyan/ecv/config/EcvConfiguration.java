package com.vidnyan.ecv.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.ecv.generation.TestGenerationTechnique;
import com.vidnyan.ecv.generation.adversarial.AdversarialStrategy;
import com.vidnyan.ecv.verification.VerificationMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for ECV components.
 */
@Slf4j
@Configuration
public class EcvConfiguration {

    /**
     * ObjectMapper for the LLM request and response.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log available techniques, strategies and verification modes on startup.
     */
    @Bean
    public String logComponents(List<TestGenerationTechnique> techniques,
                                List<AdversarialStrategy> strategies,
                                List<VerificationMode> modes) {
        log.info("Registered {} test generation techniques:", techniques.size());
        techniques.forEach(t -> log.info("  - {} ({})", t.getName(), t.technique().tag()));
        log.info("Registered {} adversarial strategies: {}", strategies.size(),
                strategies.stream().map(AdversarialStrategy::name).toList());
        log.info("Registered {} verification modes: {}", modes.size(),
                modes.stream().map(VerificationMode::name).toList());
        return "components-logged";
    }
}
