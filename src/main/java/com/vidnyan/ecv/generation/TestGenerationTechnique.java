package com.vidnyan.ecv.generation;

import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.domain.model.Technique;

import java.util.List;

/**
 * Interface for test generation techniques.
 * Each implementation derives candidate test cases for one rule; results are
 * verified afterwards, so a technique may emit cases that later get discarded.
 */
public interface TestGenerationTechnique {

    /**
     * Tag of the technique's work-grid column.
     */
    Technique technique();

    /**
     * Check if this technique can handle the given rule.
     */
    default boolean supports(Rule rule) {
        return true;
    }

    /**
     * Generate candidate test cases. Called from worker threads; implementations keep
     * all mutable state local to the call.
     */
    List<TestCase> generate(Rule rule, Specification specification);

    /**
     * Get the technique name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
