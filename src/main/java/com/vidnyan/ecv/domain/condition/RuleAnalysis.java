package com.vidnyan.ecv.domain.condition;

import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * What a rule's condition mentions, resolved against a specification.
 * Built per rule per invocation by {@link ConditionModel#analyze(Rule, Specification)}.
 *
 * @param condition   parsed tree, or null when the condition is outside the grammar
 * @param fieldRefs   referenced fields in order of first appearance
 * @param comparisons atomic comparisons, field-first and polarity-normalized
 * @param types       semantic type of every referenced field
 */
public record RuleAnalysis(
    Rule rule,
    Specification specification,
    Condition condition,
    List<FieldRef> fieldRefs,
    List<Condition.Comparison> comparisons,
    Map<FieldRef, FieldType> types
) {

    public boolean isParsed() {
        return condition != null;
    }

    public FieldType typeOf(FieldRef ref) {
        return types.getOrDefault(ref, FieldType.NUMERIC);
    }

    public Optional<Field> field(FieldRef ref) {
        return specification.field(ref);
    }

    /**
     * Comparisons of a field against a constant.
     */
    public List<Condition.Comparison> literalComparisons() {
        return comparisons.stream()
                .filter(Condition.Comparison::isFieldToLiteral)
                .filter(c -> !((Literal) c.right()).isNull())
                .toList();
    }

    /**
     * Forms a test case for this rule may populate: the rule's form list, or the
     * forms its condition references when the list is empty.
     */
    public Set<String> formsInScope() {
        Set<String> forms = new LinkedHashSet<>(rule.forms());
        if (forms.isEmpty()) {
            fieldRefs.forEach(ref -> forms.add(ref.form()));
        }
        return forms;
    }
}
