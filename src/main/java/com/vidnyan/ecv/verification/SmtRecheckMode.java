package com.vidnyan.ecv.verification;

import com.vidnyan.ecv.domain.model.TestCase;
import com.vidnyan.ecv.smt.SmtVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Binds the test data into the formalized condition and asks the solver for its truth value.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class SmtRecheckMode implements VerificationMode {

    private final SmtVerifier smtVerifier;

    @Override
    public String name() {
        return "smt-recheck";
    }

    @Override
    public Optional<Boolean> opinion(VerificationContext context, TestCase testCase) {
        return smtVerifier.evaluate(context.rule(), context.specification(), testCase)
                .map(actual -> actual == testCase.expectedResult());
    }
}
