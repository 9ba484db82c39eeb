package com.vidnyan.ecv.domain.graph;

import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import com.vidnyan.ecv.domain.condition.FieldRef;

/**
 * Directed influence edge between two fields.
 * {@code operator} is set for comparison edges only and reads {@code source op target}.
 */
public record CausalEdge(
    FieldRef source,
    FieldRef target,
    EdgeType type,
    ComparisonOperator operator
) {

    /**
     * Why one field is assumed to influence another.
     */
    public enum EdgeType {
        TEMPORAL,       // earlier date precedes later date
        FORM,           // fields collected on the same form
        COMPARISON      // fields compared directly by the rule
    }

    public static CausalEdge temporal(FieldRef earlier, FieldRef later) {
        return new CausalEdge(earlier, later, EdgeType.TEMPORAL, null);
    }

    public static CausalEdge form(FieldRef source, FieldRef target) {
        return new CausalEdge(source, target, EdgeType.FORM, null);
    }

    public static CausalEdge comparison(FieldRef source, ComparisonOperator operator, FieldRef target) {
        return new CausalEdge(source, target, EdgeType.COMPARISON, operator);
    }

    @Override
    public String toString() {
        String label = operator != null ? operator.symbol() : type.name().toLowerCase();
        return source + " -[" + label + "]-> " + target;
    }
}
