package com.vidnyan.ecv.domain.graph;

import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import com.vidnyan.ecv.domain.condition.ConditionModel;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.graph.CausalEdge.EdgeType;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.Form;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CausalGraphBuilderTest {

    private static final FieldRef CONSENT = new FieldRef("Screening", "ConsentDate");
    private static final FieldRef START = new FieldRef("Visit", "StartDate");
    private static final FieldRef END = new FieldRef("Visit", "EndDate");
    private static final FieldRef VISIT_DATE = new FieldRef("Visit", "VisitDate");
    private static final FieldRef HB = new FieldRef("Labs", "Hb");

    private final ConditionModel conditionModel = new ConditionModel();
    private final CausalGraphBuilder builder = new CausalGraphBuilder();

    private final Specification specification = Specification.of(
            Form.of("Screening", Field.of("ConsentDate", FieldType.DATE)),
            Form.of("Visit",
                    Field.of("StartDate", FieldType.DATE),
                    Field.of("EndDate", FieldType.DATE),
                    Field.of("VisitDate", FieldType.DATE)),
            Form.of("Labs", Field.of("Hb", FieldType.NUMERIC)));

    @Test
    void build_ShouldLetComparisonEdgesOverrideTemporalAndFormEdges() {
        // Arrange
        Rule rule = Rule.formalized("V-001", "Visit.StartDate <= Visit.EndDate");

        // Act
        CausalGraph graph = builder.build(conditionModel.analyze(rule, specification));

        // Assert
        CausalEdge forward = graph.edge(START, END).orElseThrow();
        CausalEdge reverse = graph.edge(END, START).orElseThrow();
        assertEquals(EdgeType.COMPARISON, forward.type());
        assertEquals(ComparisonOperator.LE, forward.operator());
        assertEquals(EdgeType.COMPARISON, reverse.type());
        assertEquals(ComparisonOperator.GE, reverse.operator());
        assertEquals(2, graph.stats().edgeCount());
    }

    @Test
    void build_ShouldLinkDatesAcrossFormsInDeclarationOrder() {
        // Arrange
        Rule rule = Rule.formalized("C-001",
                "Visit.VisitDate IS NOT NULL AND Screening.ConsentDate IS NOT NULL AND Labs.Hb > 5");

        // Act
        CausalGraph graph = builder.build(conditionModel.analyze(rule, specification));

        // Assert
        CausalEdge edge = graph.edge(CONSENT, VISIT_DATE).orElseThrow();
        assertEquals(EdgeType.TEMPORAL, edge.type());
        assertTrue(graph.edge(VISIT_DATE, CONSENT).isEmpty());
        assertEquals(Set.of(VISIT_DATE), graph.descendants(CONSENT));
        assertTrue(graph.descendants(VISIT_DATE).isEmpty());
        assertTrue(graph.descendants(HB).isEmpty());
        assertEquals(0.5, graph.degreeCentrality(CONSENT));
        assertEquals(0.0, graph.degreeCentrality(HB));
        assertTrue(graph.confounders().isEmpty());
        assertEquals(3, graph.nodes().size());
    }

    @Test
    void graph_ShouldReportConfoundersAndSkipSelfLoops() {
        // Arrange
        List<CausalEdge> edges = List.of(
                CausalEdge.form(START, END),
                CausalEdge.form(START, HB),
                CausalEdge.form(HB, HB),
                CausalEdge.temporal(END, VISIT_DATE));

        // Act
        CausalGraph graph = CausalGraph.build(List.of(START, END, HB, VISIT_DATE), edges);

        // Assert
        assertEquals(List.of(START), graph.confounders());
        assertEquals(Set.of(END, HB, VISIT_DATE), graph.descendants(START));
        assertEquals(3, graph.stats().edgeCount());
        assertEquals(START, graph.topByDegree(1).get(0));
        assertEquals(3, graph.spanningTree(START).size());
    }
}
