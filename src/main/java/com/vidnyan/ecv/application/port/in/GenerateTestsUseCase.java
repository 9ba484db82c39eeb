package com.vidnyan.ecv.application.port.in;

import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Primary use case: generate verified test cases for edit-check rules.
 */
public interface GenerateTestsUseCase {

    /**
     * Generate test cases for every rule.
     * @param rules         rules to cover
     * @param specification forms and fields the rules refer to
     * @param parallel      dispatch (rule, technique) tasks to a worker pool
     * @param techniques    technique tags to run; empty = all
     * @return verified test cases per rule id, in rule order
     */
    Map<String, List<TestCase>> generateTests(List<Rule> rules, Specification specification,
                                              boolean parallel, Set<String> techniques);

    default Map<String, List<TestCase>> generateTests(List<Rule> rules, Specification specification) {
        return generateTests(rules, specification, true, Set.of());
    }
}
