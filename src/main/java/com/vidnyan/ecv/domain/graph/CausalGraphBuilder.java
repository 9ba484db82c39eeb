package com.vidnyan.ecv.domain.graph;

import com.vidnyan.ecv.domain.condition.Condition.Comparison;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Derives a {@link CausalGraph} from the fields a rule mentions.
 * Edge kinds are added in the order temporal, form, comparison; later kinds win for a pair.
 */
@Slf4j
@Component
public class CausalGraphBuilder {

    public CausalGraph build(RuleAnalysis analysis) {
        List<FieldRef> nodes = analysis.fieldRefs();
        List<CausalEdge> edges = new ArrayList<>();

        // Dates on a subject's timeline, ordered by declaration
        List<FieldRef> dates = nodes.stream()
                .filter(ref -> analysis.typeOf(ref).isDateLike())
                .sorted(Comparator.comparingInt(ref -> analysis.specification().declarationIndex(ref)))
                .toList();
        for (int i = 0; i < dates.size(); i++) {
            for (int j = i + 1; j < dates.size(); j++) {
                edges.add(CausalEdge.temporal(dates.get(i), dates.get(j)));
            }
        }

        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                FieldRef a = nodes.get(i);
                FieldRef b = nodes.get(j);
                if (a.form().equals(b.form())) {
                    edges.add(CausalEdge.form(a, b));
                    edges.add(CausalEdge.form(b, a));
                }
            }
        }

        for (Comparison c : analysis.comparisons()) {
            if (c.isFieldToField()) {
                FieldRef left = (FieldRef) c.left();
                FieldRef right = (FieldRef) c.right();
                edges.add(CausalEdge.comparison(left, c.operator(), right));
                edges.add(CausalEdge.comparison(right, c.operator().converse(), left));
            }
        }

        CausalGraph graph = CausalGraph.build(nodes, edges);
        log.debug("Causal graph for rule {}: {}", analysis.rule().id(), graph.stats());
        return graph;
    }
}
