package com.vidnyan.ecv.smt;

import com.vidnyan.ecv.domain.condition.Condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds duplicate and directly contradictory sibling clauses inside a single AND/OR.
 */
final class RedundancyDetector {

    private RedundancyDetector() {
    }

    static List<String> find(Condition condition) {
        List<String> findings = new ArrayList<>();
        walk(condition, findings);
        return findings;
    }

    private static void walk(Condition node, List<String> findings) {
        if (node instanceof Condition.And and) {
            checkSiblings("AND", and.children(), findings);
            and.children().forEach(child -> walk(child, findings));
        } else if (node instanceof Condition.Or or) {
            checkSiblings("OR", or.children(), findings);
            or.children().forEach(child -> walk(child, findings));
        } else if (node instanceof Condition.Not not) {
            walk(not.operand(), findings);
        } else if (node instanceof Condition.IfThenElse ite) {
            walk(ite.test(), findings);
            walk(ite.then(), findings);
            if (ite.otherwise() != null) {
                walk(ite.otherwise(), findings);
            }
        }
    }

    private static void checkSiblings(String connective, List<Condition> children, List<String> findings) {
        for (int i = 0; i < children.size(); i++) {
            for (int j = i + 1; j < children.size(); j++) {
                Condition a = children.get(i);
                Condition b = children.get(j);
                if (same(a, b)) {
                    findings.add("Duplicate clause " + a + " in " + connective);
                } else if (complementary(a, b)) {
                    findings.add("Contradictory clauses " + a + " and " + b + " in " + connective);
                }
            }
        }
    }

    private static boolean same(Condition a, Condition b) {
        if (a instanceof Condition.Comparison ca && b instanceof Condition.Comparison cb) {
            return ca.normalized().equals(cb.normalized());
        }
        return a.equals(b);
    }

    private static boolean complementary(Condition a, Condition b) {
        if (a instanceof Condition.Not na && same(na.operand(), b)) {
            return true;
        }
        if (b instanceof Condition.Not nb && same(nb.operand(), a)) {
            return true;
        }
        return a instanceof Condition.Comparison ca && b instanceof Condition.Comparison cb
                && ca.normalized().negated().equals(cb.normalized());
    }
}
