package com.vidnyan.ecv.adapter.out.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.ecv.application.port.out.MutationProposer.ProposedScenario;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.Form;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LlmMutationProposerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Specification specification = Specification.of(
            Form.of("Labs", Field.of("Hb", FieldType.NUMERIC)));

    private final Rule rule = Rule.formalized("HB-001", "Labs.Hb > 12");

    @Test
    void proposeMutations_ShouldParseFencedReply() {
        // Arrange
        String reply = """
                Here are some cases:
                ```json
                {"test_cases": [
                  {"description": "Hb just above", "expected_result": true, "test_data": {"Labs": {"Hb": 12.01}}},
                  {"description": "no data", "expected_result": false},
                  {"description": "Hb as text", "expected_result": false, "test_data": {"Labs": {"Hb": "high"}}}
                ]}
                ```
                """;
        LlmMutationProposer proposer = proposer(new StubClient(true, Optional.of(reply)));

        // Act
        List<ProposedScenario> scenarios = proposer.proposeMutations(rule, specification);

        // Assert
        assertEquals(2, scenarios.size());
        assertEquals("Hb just above", scenarios.get(0).description());
        assertTrue(scenarios.get(0).expectedResult());
        assertEquals(12.01, scenarios.get(0).testData().get("Labs").get("Hb"));
        assertEquals("high", scenarios.get(1).testData().get("Labs").get("Hb"));
    }

    @Test
    void proposeMutations_ShouldSkipNullForms() {
        // Arrange
        String reply = """
                {"test_cases": [
                  {"description": "null vitals", "expected_result": true,
                   "test_data": {"Labs": {"Hb": 13}, "Vitals": null}},
                  {"description": "only null", "expected_result": false, "test_data": {"Labs": null}},
                  {"description": "Hb low", "expected_result": false, "test_data": {"Labs": {"Hb": 9}}}
                ]}
                """;
        LlmMutationProposer proposer = proposer(new StubClient(true, Optional.of(reply)));

        // Act
        List<ProposedScenario> scenarios = proposer.proposeMutations(rule, specification);

        // Assert
        assertEquals(2, scenarios.size());
        assertEquals("null vitals", scenarios.get(0).description());
        assertEquals(Set.of("Labs"), scenarios.get(0).testData().keySet());
        assertEquals(13, scenarios.get(0).testData().get("Labs").get("Hb"));
        assertEquals("Hb low", scenarios.get(1).description());
    }

    @Test
    void proposeMutations_ShouldReturnEmptyForMalformedReply() {
        // Arrange
        LlmMutationProposer proposer = proposer(new StubClient(true, Optional.of("{not json at all")));

        // Act
        List<ProposedScenario> scenarios = proposer.proposeMutations(rule, specification);

        // Assert
        assertTrue(scenarios.isEmpty());
    }

    @Test
    void proposeMutations_ShouldSkipUnconfiguredClient() {
        // Arrange
        StubClient client = new StubClient(false, Optional.of("{\"test_cases\": []}"));
        LlmMutationProposer proposer = proposer(client);

        // Act
        List<ProposedScenario> scenarios = proposer.proposeMutations(rule, specification);

        // Assert
        assertTrue(scenarios.isEmpty());
        assertEquals(0, client.calls);
    }

    @Test
    void proposeMutations_ShouldSwallowClientFailure() {
        // Arrange
        LlmClient failing = new StubClient(true, Optional.empty()) {
            @Override
            public Optional<String> chat(String systemPrompt, String userPrompt) {
                throw new IllegalStateException("connection reset");
            }
        };

        // Act
        List<ProposedScenario> scenarios = proposer(failing).proposeMutations(rule, specification);

        // Assert
        assertTrue(scenarios.isEmpty());
    }

    private LlmMutationProposer proposer(LlmClient client) {
        return new LlmMutationProposer(client, new ConditionModel(), objectMapper);
    }

    private class StubClient extends LlmClient {

        private final boolean configured;
        private final Optional<String> reply;
        private int calls;

        StubClient(boolean configured, Optional<String> reply) {
            super(objectMapper);
            this.configured = configured;
            this.reply = reply;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public Optional<String> chat(String systemPrompt, String userPrompt) {
            calls++;
            assertTrue(userPrompt.contains("Labs.Hb (numeric)"));
            return reply;
        }
    }
}
