package com.vidnyan.ecv.verification;

import com.vidnyan.ecv.domain.model.TestCase;

import java.util.Optional;

/**
 * One independent opinion on whether a candidate test case is labelled correctly.
 */
public interface VerificationMode {

    String name();

    /**
     * True when the expected result holds, false when it is contradicted, empty for no opinion.
     */
    Optional<Boolean> opinion(VerificationContext context, TestCase testCase);
}
