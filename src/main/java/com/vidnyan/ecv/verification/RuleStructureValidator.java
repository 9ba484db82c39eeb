package com.vidnyan.ecv.verification;

import com.vidnyan.ecv.domain.condition.Condition.Comparison;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.Literal;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;
import com.vidnyan.ecv.domain.model.IssueKind;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import com.vidnyan.ecv.domain.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that a rule only mentions forms, fields and values the specification declares.
 */
@Component
@RequiredArgsConstructor
public class RuleStructureValidator {

    private final ConditionModel conditionModel;

    public void validate(Rule rule, Specification specification, ValidationResult result) {
        RuleAnalysis analysis = conditionModel.analyze(rule, specification);

        Set<String> forms = new LinkedHashSet<>(rule.forms());
        analysis.fieldRefs().forEach(ref -> forms.add(ref.form()));
        for (String form : forms) {
            if (!specification.hasForm(form)) {
                result.addError(IssueKind.INVALID_FORM, "Form '" + form + "' is not in the specification",
                        Map.of("form", form));
            }
        }

        for (FieldRef ref : analysis.fieldRefs()) {
            if (specification.hasForm(ref.form()) && specification.field(ref).isEmpty()) {
                result.addError(IssueKind.INVALID_FIELD, "Field '" + ref + "' is not declared on form " + ref.form(),
                        Map.of("form", ref.form(), "field", ref.field()));
            }
        }

        for (Comparison c : analysis.literalComparisons()) {
            FieldRef ref = (FieldRef) c.left();
            Optional<Field> field = specification.field(ref);
            if (field.isPresent()) {
                checkLiteral(ref, field.get(), (Literal) c.right(), result);
            }
        }
    }

    private void checkLiteral(FieldRef ref, Field field, Literal literal, ValidationResult result) {
        FieldType type = field.type();
        if ((type.isOrdered() || type == FieldType.BOOLEAN)
                && FieldValues.coerce(type, literal.value()).isEmpty()) {
            result.addError(IssueKind.TYPE_MISMATCH,
                    "Field '" + ref + "' is " + type.code() + " but is compared with " + literal,
                    Map.of("field", ref.path(), "type", type.code(), "value", String.valueOf(literal.value())));
            return;
        }
        if (type == FieldType.CATEGORICAL && field.hasValidValues()) {
            String value = FieldValues.coerce(type, literal.value()).map(Object::toString).orElse("");
            if (!field.validValues().contains(value)) {
                result.addError(IssueKind.INVALID_CATEGORICAL_VALUE,
                        "Value '" + value + "' is not a valid value of " + ref,
                        Map.of("field", ref.path(), "value", value, "validValues", field.validValues()));
            }
        }
    }
}
