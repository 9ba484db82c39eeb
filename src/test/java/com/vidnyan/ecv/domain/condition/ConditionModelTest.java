package com.vidnyan.ecv.domain.condition;

import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.Form;
import com.vidnyan.ecv.domain.model.Rule;
import com.vidnyan.ecv.domain.model.Specification;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConditionModelTest {

    private final ConditionModel model = new ConditionModel();

    private final Specification specification = Specification.of(
            Form.of("Demographics",
                    Field.of("Age", FieldType.NUMERIC),
                    Field.builder().name("Sex").type(FieldType.CATEGORICAL).validValues(List.of("M", "F")).build()),
            Form.of("Visit", Field.of("VisitDate", FieldType.DATE)));

    @Test
    void analyze_ShouldResolveDeclaredTypes() {
        // Arrange
        Rule rule = Rule.formalized("R1", "Demographics.Age >= 18 AND Demographics.Sex = 'F'");

        // Act
        RuleAnalysis analysis = model.analyze(rule, specification);

        // Assert
        assertTrue(analysis.isParsed());
        assertEquals(List.of(new FieldRef("Demographics", "Age"), new FieldRef("Demographics", "Sex")),
                analysis.fieldRefs());
        assertEquals(FieldType.CATEGORICAL, analysis.typeOf(new FieldRef("Demographics", "Sex")));
        assertEquals(2, analysis.literalComparisons().size());
        assertEquals(Set.of("Demographics"), analysis.formsInScope());
    }

    @Test
    void analyze_ShouldInferTypesOfUndeclaredFields() {
        // Arrange
        Rule rule = Rule.formalized("R2", "Labs.Collected > '2024-01-01' AND Labs.Comment = 'ok'");

        // Act
        RuleAnalysis analysis = model.analyze(rule, specification);

        // Assert
        assertEquals(FieldType.DATE, analysis.typeOf(new FieldRef("Labs", "Collected")));
        assertEquals(FieldType.TEXT, analysis.typeOf(new FieldRef("Labs", "Comment")));
    }

    @Test
    void extract_ShouldFallBackToPatternsForFreeText() {
        // Arrange
        String text = "Query if Demographics.Age < 18 and consent missing";

        // Act
        Set<String> refs = model.extractFieldReferences(text);
        List<Condition.Comparison> comparisons = model.extractComparisons(text);

        // Assert
        assertEquals(Set.of("Demographics.Age"), refs);
        assertEquals(1, comparisons.size());
        assertEquals(ComparisonOperator.LT, comparisons.get(0).operator());
    }

    @Test
    void analyze_ShouldUseFreeTextWhenNotFormalized() {
        // Arrange
        Rule rule = Rule.builder().id("R3").condition("Demographics.Age < 18").build();

        // Act
        RuleAnalysis analysis = model.analyze(rule, specification);

        // Assert
        assertTrue(analysis.isParsed());
        assertEquals(1, analysis.comparisons().size());
    }
}
