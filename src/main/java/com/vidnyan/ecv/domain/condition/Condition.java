package com.vidnyan.ecv.domain.condition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed expression tree of a rule condition.
 * IN, NOT IN, BETWEEN and IS [NOT] NULL are desugared into these five node kinds by the parser.
 */
public interface Condition {

    /**
     * Field references in order of first appearance.
     */
    default Set<FieldRef> fieldRefs() {
        Set<FieldRef> refs = new LinkedHashSet<>();
        atomicComparisons().forEach(c -> {
            if (c.left() instanceof FieldRef f) {
                refs.add(f);
            }
            if (c.right() instanceof FieldRef f) {
                refs.add(f);
            }
        });
        return refs;
    }

    /**
     * Leaf comparisons, field-first, with operators negated under an odd number of NOTs.
     * Combining them conjunctively is exact for negation-normal conjunctions and an
     * approximation otherwise.
     */
    default List<Comparison> atomicComparisons() {
        List<Comparison> out = new ArrayList<>();
        collect(this, true, out);
        return out;
    }

    private static void collect(Condition node, boolean positive, List<Comparison> out) {
        if (node instanceof Comparison c) {
            Comparison normalized = c.normalized();
            out.add(positive ? normalized : normalized.negated());
        } else if (node instanceof And and) {
            and.children().forEach(child -> collect(child, positive, out));
        } else if (node instanceof Or or) {
            or.children().forEach(child -> collect(child, positive, out));
        } else if (node instanceof Not not) {
            collect(not.operand(), !positive, out);
        } else if (node instanceof IfThenElse ite) {
            collect(ite.test(), positive, out);
            collect(ite.then(), positive, out);
            if (ite.otherwise() != null) {
                collect(ite.otherwise(), positive, out);
            }
        }
    }

    /**
     * Leaf predicate {@code left op right}.
     */
    record Comparison(Operand left, ComparisonOperator operator, Operand right) implements Condition {

        public Comparison {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        /**
         * Same comparison with a field on the left whenever one side is a field.
         */
        public Comparison normalized() {
            if (left instanceof Literal && right instanceof FieldRef) {
                return new Comparison(right, operator.converse(), left);
            }
            return this;
        }

        public Comparison negated() {
            return new Comparison(left, operator.negate(), right);
        }

        public Optional<FieldRef> field() {
            return left instanceof FieldRef f ? Optional.of(f) : Optional.empty();
        }

        /**
         * Right-hand field for field-to-field comparisons.
         */
        public Optional<FieldRef> otherField() {
            return right instanceof FieldRef f ? Optional.of(f) : Optional.empty();
        }

        public Optional<Literal> literal() {
            return right instanceof Literal l ? Optional.of(l) : Optional.empty();
        }

        public boolean isFieldToLiteral() {
            return left instanceof FieldRef && right instanceof Literal;
        }

        public boolean isFieldToField() {
            return left instanceof FieldRef && right instanceof FieldRef;
        }

        @Override
        public String toString() {
            return left + " " + operator.symbol() + " " + right;
        }
    }

    record And(List<Condition> children) implements Condition {
        public And {
            children = List.copyOf(children);
        }

        @Override
        public String toString() {
            return children.stream().map(Object::toString).collect(Collectors.joining(" AND ", "(", ")"));
        }
    }

    record Or(List<Condition> children) implements Condition {
        public Or {
            children = List.copyOf(children);
        }

        @Override
        public String toString() {
            return children.stream().map(Object::toString).collect(Collectors.joining(" OR ", "(", ")"));
        }
    }

    record Not(Condition operand) implements Condition {
        @Override
        public String toString() {
            return "NOT " + operand;
        }
    }

    /**
     * Conditional; {@code otherwise} is null when the rule has no ELSE branch.
     */
    record IfThenElse(Condition test, Condition then, Condition otherwise) implements Condition {
        @Override
        public String toString() {
            return "IF " + test + " THEN " + then + (otherwise == null ? "" : " ELSE " + otherwise);
        }
    }
}
