package com.vidnyan.ecv.application.port.out;

import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;

import java.util.List;
import java.util.Map;

/**
 * Port for externally proposed test scenarios.
 * Implemented by LLM adapters; must never throw past its boundary.
 */
public interface MutationProposer {

    /**
     * Propose named scenarios for a rule. Empty when the collaborator is
     * unavailable or its output could not be read.
     */
    List<ProposedScenario> proposeMutations(Rule rule, Specification specification);

    /**
     * A single proposed scenario. Test data is {@code form -> field -> value}.
     */
    record ProposedScenario(
        String description,
        boolean expectedResult,
        Map<String, Map<String, Object>> testData
    ) {}
}
