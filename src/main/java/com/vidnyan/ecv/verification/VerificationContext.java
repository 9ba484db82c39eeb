package com.vidnyan.ecv.verification;

import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Everything the verification modes need about one rule, computed once per verification run.
 */
public final class VerificationContext {

    private final RuleAnalysis analysis;
    private final List<RuleAnalysis> relatedRules;
    private final Map<String, Optional<Boolean>> implications = new ConcurrentHashMap<>();

    public VerificationContext(RuleAnalysis analysis, List<RuleAnalysis> relatedRules) {
        this.analysis = analysis;
        this.relatedRules = List.copyOf(relatedRules);
    }

    public RuleAnalysis analysis() {
        return analysis;
    }

    public Rule rule() {
        return analysis.rule();
    }

    public Specification specification() {
        return analysis.specification();
    }

    /**
     * Other rules of the set that share at least one field with this rule.
     */
    public List<RuleAnalysis> relatedRules() {
        return relatedRules;
    }

    /**
     * Memoized implication check between two rules.
     */
    public Optional<Boolean> implication(Rule premise, Rule conclusion, Supplier<Optional<Boolean>> check) {
        return implications.computeIfAbsent(premise.id() + " => " + conclusion.id(), k -> check.get());
    }
}
