package com.vidnyan.ecv.verification;

import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import com.vidnyan.ecv.domain.condition.Condition;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.Literal;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;
import com.vidnyan.ecv.domain.model.TestCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates a condition tree on concrete test data without the solver.
 * <p>
 * The tree is rendered to a SpEL boolean expression over variables {@code #f0, #f1, ...} and run in a
 * read-only {@link SimpleEvaluationContext}, which has no type references, constructors or bean
 * access. Field values are coerced exactly as the solver binds them: ordered types become numbers
 * on the solver scale and anything that does not coerce becomes {@code null}. Leaves the solver
 * cannot translate are dropped the same way.
 */
@Slf4j
@Component
public class SafeConditionEvaluator {

    private final ExpressionParser parser = new SpelExpressionParser();

    /**
     * Truth value of the rule's condition on the test data; empty when the condition did not
     * parse or nothing in it could be rendered.
     */
    public Optional<Boolean> evaluate(RuleAnalysis analysis, TestCase testCase) {
        if (!analysis.isParsed()) {
            return Optional.empty();
        }
        String expression = render(analysis, analysis.condition());
        if (expression == null) {
            return Optional.empty();
        }

        SimpleEvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding().build();
        List<FieldRef> refs = analysis.fieldRefs();
        for (int i = 0; i < refs.size(); i++) {
            FieldRef ref = refs.get(i);
            context.setVariable(variable(i), value(analysis.typeOf(ref), testCase.value(ref).orElse(null)));
        }
        try {
            return Optional.ofNullable(parser.parseExpression(expression).getValue(context, Boolean.class));
        } catch (ExpressionException e) {
            log.debug("Could not evaluate '{}' for rule {}: {}", expression, analysis.rule().id(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * SpEL text of a condition, or null when no part of it is expressible.
     */
    String render(RuleAnalysis analysis, Condition condition) {
        if (condition instanceof Condition.Comparison c) {
            return comparison(analysis, c.normalized());
        }
        if (condition instanceof Condition.And and) {
            return join(analysis, and.children(), " and ");
        }
        if (condition instanceof Condition.Or or) {
            return join(analysis, or.children(), " or ");
        }
        if (condition instanceof Condition.Not not) {
            String inner = render(analysis, not.operand());
            return inner == null ? null : "!(" + inner + ")";
        }
        if (condition instanceof Condition.IfThenElse ite) {
            String test = render(analysis, ite.test());
            String then = render(analysis, ite.then());
            String otherwise = ite.otherwise() == null ? "true" : render(analysis, ite.otherwise());
            if (test == null || then == null || otherwise == null) {
                return null;
            }
            return "(" + test + " ? " + then + " : " + otherwise + ")";
        }
        return null;
    }

    private String join(RuleAnalysis analysis, List<Condition> children, String connective) {
        List<String> parts = new ArrayList<>();
        for (Condition child : children) {
            String part = render(analysis, child);
            if (part != null) {
                parts.add(part);
            }
        }
        return parts.isEmpty() ? null : "(" + String.join(connective, parts) + ")";
    }

    private String comparison(RuleAnalysis analysis, Condition.Comparison c) {
        if (!(c.left() instanceof FieldRef field)) {
            return null;
        }
        FieldType type = analysis.typeOf(field);
        String lhs = variableOf(analysis, field);
        ComparisonOperator op = c.operator();

        if (c.right() instanceof FieldRef other) {
            FieldType otherType = analysis.typeOf(other);
            if (!comparable(op, type, otherType)) {
                return null;
            }
            return "(" + lhs + " " + operator(op) + " " + variableOf(analysis, other) + ")";
        }

        Literal literal = (Literal) c.right();
        if (literal.isNull()) {
            if (type == FieldType.BOOLEAN) {
                // booleans are never missing for the solver either
                return op == ComparisonOperator.EQ ? "false" : "true";
            }
            return "(" + lhs + (op == ComparisonOperator.EQ ? " == null)" : " != null)");
        }
        if (!comparable(op, type, type)) {
            return null;
        }
        Object canonical = FieldValues.coerce(type, literal.value()).orElse(null);
        if (canonical == null) {
            return null;
        }
        return "(" + lhs + " " + operator(op) + " " + literal(type, canonical) + ")";
    }

    /**
     * SpEL spelling of an operator; a single {@code =} would be an assignment.
     */
    private static String operator(ComparisonOperator op) {
        return op == ComparisonOperator.EQ ? "==" : op.symbol();
    }

    private static boolean comparable(ComparisonOperator op, FieldType a, FieldType b) {
        if (a.isOrdered() && b.isOrdered()) {
            return true;
        }
        boolean sameSort = (a.isStringLike() && b.isStringLike()) || a == b;
        return sameSort && !op.isOrdering();
    }

    private static String literal(FieldType type, Object canonical) {
        if (type.isOrdered()) {
            return number(FieldValues.toScale(type, canonical).orElseThrow());
        }
        if (canonical instanceof Boolean b) {
            return b.toString();
        }
        return "'" + canonical.toString().replace("'", "''") + "'";
    }

    private static String number(double value) {
        String text = BigDecimal.valueOf(value).toPlainString();
        if (!text.contains(".")) {
            text += ".0";
        }
        return value < 0 ? "(" + text + ")" : text;
    }

    /**
     * Value bound to a SpEL variable: a double for ordered types, the canonical value otherwise.
     */
    private static Object value(FieldType type, Object raw) {
        if (type.isOrdered()) {
            return FieldValues.toScale(type, raw).orElse(null);
        }
        return FieldValues.coerce(type, raw).orElse(null);
    }

    private static String variableOf(RuleAnalysis analysis, FieldRef ref) {
        return "#" + variable(analysis.fieldRefs().indexOf(ref));
    }

    private static String variable(int index) {
        return "f" + index;
    }
}
