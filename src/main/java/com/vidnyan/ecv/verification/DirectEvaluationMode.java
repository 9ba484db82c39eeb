package com.vidnyan.ecv.verification;

import com.vidnyan.ecv.domain.model.TestCase;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(2)
@RequiredArgsConstructor
public class DirectEvaluationMode implements VerificationMode {

    private final SafeConditionEvaluator evaluator;

    @Override
    public String name() {
        return "direct-evaluation";
    }

    @Override
    public Optional<Boolean> opinion(VerificationContext context, TestCase testCase) {
        return evaluator.evaluate(context.analysis(), testCase)
                .map(actual -> actual == testCase.expectedResult());
    }
}
