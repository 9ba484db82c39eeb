package com.vidnyan.ecv.domain.condition;

import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared view of what a rule condition references and compares.
 * Uses the grammar when the condition parses and falls back to pattern matching otherwise.
 * Never throws; unparseable fragments are omitted.
 */
@Slf4j
@Component
public class ConditionModel {

    private static final String FIELD = "[A-Za-z_][A-Za-z0-9_]*\\.[A-Za-z_][A-Za-z0-9_]*";
    private static final String VALUE = FIELD + "|-?\\d+(?:\\.\\d+)?|'[^']*'|\"[^\"]*\"|(?i:true|false)\\b";

    private static final Pattern FIELD_REF = Pattern.compile("\\b" + FIELD);
    private static final Pattern QUOTED = Pattern.compile("'[^']*'|\"[^\"]*\"");
    private static final Pattern COMPARISON = Pattern.compile(
            "(" + VALUE + ")\\s*(<=|>=|!=|<>|==|=|<|>)\\s*(" + VALUE + ")");

    private final ConditionParser parser;

    public ConditionModel() {
        this(new ConditionParser());
    }

    public ConditionModel(ConditionParser parser) {
        this.parser = parser;
    }

    public ConditionParser parser() {
        return parser;
    }

    public Optional<Condition> parse(String condition) {
        return parser.parse(condition);
    }

    /**
     * {@code Form.Field} references mentioned in the condition.
     */
    public Set<String> extractFieldReferences(String condition) {
        Set<String> refs = new LinkedHashSet<>();
        if (condition == null) {
            return refs;
        }
        Optional<Condition> tree = parser.parse(condition);
        if (tree.isPresent()) {
            tree.get().fieldRefs().forEach(ref -> refs.add(ref.path()));
            return refs;
        }
        Matcher matcher = FIELD_REF.matcher(QUOTED.matcher(condition).replaceAll("''"));
        while (matcher.find()) {
            refs.add(matcher.group());
        }
        return refs;
    }

    /**
     * Atomic {@code (lhs, operator, rhs)} comparisons mentioned in the condition.
     */
    public List<Condition.Comparison> extractComparisons(String condition) {
        if (condition == null || condition.isBlank()) {
            return List.of();
        }
        Optional<Condition> tree = parser.parse(condition);
        if (tree.isPresent()) {
            return tree.get().atomicComparisons();
        }
        log.debug("Condition outside grammar, matching comparisons by pattern: {}", condition);
        List<Condition.Comparison> comparisons = new ArrayList<>();
        Matcher matcher = COMPARISON.matcher(condition);
        while (matcher.find()) {
            Optional<Operand> left = operand(matcher.group(1));
            Optional<ComparisonOperator> op = ComparisonOperator.fromSymbol(matcher.group(2));
            Optional<Operand> right = operand(matcher.group(3));
            if (left.isPresent() && op.isPresent() && right.isPresent()) {
                comparisons.add(new Condition.Comparison(left.get(), op.get(), right.get()).normalized());
            }
        }
        return comparisons;
    }

    /**
     * Analyze a rule's effective condition against a specification.
     */
    public RuleAnalysis analyze(Rule rule, Specification specification) {
        String text = rule.effectiveCondition();
        Condition tree = parser.parse(text).orElse(null);

        List<Condition.Comparison> comparisons = tree != null
                ? tree.atomicComparisons()
                : extractComparisons(text);

        Set<FieldRef> refs = new LinkedHashSet<>();
        if (tree != null) {
            refs.addAll(tree.fieldRefs());
        } else {
            extractFieldReferences(text).forEach(path -> refs.add(FieldRef.parse(path)));
        }

        Map<FieldRef, FieldType> types = new LinkedHashMap<>();
        for (FieldRef ref : refs) {
            types.put(ref, specification.field(ref)
                    .map(Field::type)
                    .orElseGet(() -> inferType(ref, comparisons, specification)));
        }
        return new RuleAnalysis(rule, specification, tree, List.copyOf(refs), comparisons, types);
    }

    /**
     * Type of an undeclared field, guessed from what it is compared with.
     */
    private FieldType inferType(FieldRef ref, List<Condition.Comparison> comparisons, Specification specification) {
        for (Condition.Comparison c : comparisons) {
            if (!ref.equals(c.left()) && !ref.equals(c.right())) {
                continue;
            }
            Operand other = ref.equals(c.left()) ? c.right() : c.left();
            if (other instanceof Literal literal) {
                switch (literal.kind()) {
                    case NUMBER:
                        return FieldType.NUMERIC;
                    case BOOLEAN:
                        return FieldType.BOOLEAN;
                    case STRING:
                        return FieldValues.toEpochDay(literal.value()).isPresent() ? FieldType.DATE : FieldType.TEXT;
                    default:
                        break;
                }
            } else if (other instanceof FieldRef otherRef) {
                Optional<Field> declared = specification.field(otherRef);
                if (declared.isPresent()) {
                    return declared.get().type();
                }
            }
        }
        return FieldType.NUMERIC;
    }

    private static Optional<Operand> operand(String token) {
        String text = token.trim();
        if (text.startsWith("'") || text.startsWith("\"")) {
            return Optional.of(Literal.string(text.substring(1, text.length() - 1)));
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.equals("TRUE") || upper.equals("FALSE")) {
            return Optional.of(Literal.bool(upper.equals("TRUE")));
        }
        if (Character.isDigit(text.charAt(0)) || text.charAt(0) == '-') {
            try {
                return Optional.of(Literal.number(new BigDecimal(text)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(FieldRef.parse(text));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
