package com.vidnyan.ecv.adapter.out.ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.ecv.application.port.out.MutationProposer;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Asks an LLM for adversarial scenarios. Any failure means "no proposals".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmMutationProposer implements MutationProposer {

    private static final String SYSTEM_PROMPT = """
            You are a clinical data manager testing edit checks on case report forms.
            Respond with JSON only.
            """;

    private static final TypeReference<Map<String, Map<String, Object>>> TEST_DATA_TYPE = new TypeReference<>() {};

    private final LlmClient llmClient;
    private final ConditionModel conditionModel;
    private final ObjectMapper objectMapper;

    @Override
    public List<ProposedScenario> proposeMutations(Rule rule, Specification specification) {
        if (!llmClient.isConfigured()) {
            return List.of();
        }
        try {
            Optional<String> reply = llmClient.chat(SYSTEM_PROMPT, prompt(rule, specification));
            List<ProposedScenario> scenarios = reply.map(this::parse).orElse(List.of());
            log.debug("LLM proposed {} scenarios for rule {}", scenarios.size(), rule.id());
            return scenarios;
        } catch (Exception e) {
            log.warn("Failed to obtain LLM proposals for rule {}: {}", rule.id(), e.getMessage());
            return List.of();
        }
    }

    private String prompt(Rule rule, Specification specification) {
        RuleAnalysis analysis = conditionModel.analyze(rule, specification);
        String fields = analysis.fieldRefs().stream()
                .map(ref -> "- " + ref + " (" + analysis.typeOf(ref).code() + ")"
                        + analysis.field(ref).filter(Field::hasValidValues)
                                .map(f -> " valid values: " + f.validValues())
                                .orElse(""))
                .collect(Collectors.joining("\n"));
        return """
                Edit check %s fires when this condition holds:
                %s

                Fields:
                %s

                Propose up to 5 tricky test cases. Reply with a JSON object:
                {"test_cases": [{"description": "...", "expected_result": true,
                  "test_data": {"Form": {"Field": "value"}}}]}
                expected_result is whether the condition holds for the test data.
                """.formatted(rule.id(), rule.effectiveCondition(), fields);
    }

    /**
     * Scenarios from the first JSON object in a reply. Malformed entries are skipped.
     */
    List<ProposedScenario> parse(String reply) {
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.debug("No JSON object in LLM reply");
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(reply.substring(start, end + 1));
        } catch (Exception e) {
            log.debug("Unparseable LLM reply: {}", e.getMessage());
            return List.of();
        }

        List<ProposedScenario> scenarios = new ArrayList<>();
        for (JsonNode node : root.path("test_cases")) {
            JsonNode data = node.path("test_data");
            JsonNode expected = node.path("expected_result");
            if (!data.isObject() || expected.isMissingNode()) {
                continue;
            }
            ObjectNode forms = objectMapper.createObjectNode();
            data.fields().forEachRemaining(form -> {
                if (form.getValue().isObject()) {
                    forms.set(form.getKey(), form.getValue());
                } else {
                    log.debug("Skipping non-object form '{}' in LLM scenario", form.getKey());
                }
            });
            if (forms.isEmpty()) {
                continue;
            }
            try {
                scenarios.add(new ProposedScenario(
                        node.path("description").asText("LLM proposed scenario"),
                        expected.asBoolean(),
                        objectMapper.convertValue(forms, TEST_DATA_TYPE)));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed scenario: {}", e.getMessage());
            }
        }
        return scenarios;
    }
}
