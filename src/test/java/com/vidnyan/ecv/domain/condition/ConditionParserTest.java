package com.vidnyan.ecv.domain.condition;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionParserTest {

    private final ConditionParser parser = new ConditionParser();

    @Test
    void parse_ShouldBuildComparisonWithQualifiedField() {
        // Act
        Condition condition = parser.parseStrict("Demographics.Age >= 18");

        // Assert
        Condition.Comparison expected = new Condition.Comparison(
                new FieldRef("Demographics", "Age"), ComparisonOperator.GE, Literal.number(new BigDecimal("18")));
        assertEquals(expected, condition);
    }

    @Test
    void parse_ShouldRespectPrecedenceOfAndOverOr() {
        // Act
        Condition condition = parser.parseStrict(
                "Labs.Hb > 5 AND (Demographics.Sex = 'M' OR NOT Demographics.Age < 3)");

        // Assert
        Condition.And and = assertInstanceOf(Condition.And.class, condition);
        assertEquals(2, and.children().size());
        Condition.Or or = assertInstanceOf(Condition.Or.class, and.children().get(1));
        assertInstanceOf(Condition.Not.class, or.children().get(1));
    }

    @Test
    void parse_ShouldDesugarInAndBetween() {
        // Act
        Condition in = parser.parseStrict("Demographics.Sex IN ('M', 'F')");
        Condition notIn = parser.parseStrict("Demographics.Sex NOT IN ('M', 'F')");
        Condition between = parser.parseStrict("Labs.Hb BETWEEN 10 AND 15");

        // Assert
        Condition.Or or = assertInstanceOf(Condition.Or.class, in);
        assertEquals(2, or.children().size());
        assertInstanceOf(Condition.Or.class, assertInstanceOf(Condition.Not.class, notIn).operand());
        Condition.And and = assertInstanceOf(Condition.And.class, between);
        assertEquals(ComparisonOperator.GE, ((Condition.Comparison) and.children().get(0)).operator());
        assertEquals(ComparisonOperator.LE, ((Condition.Comparison) and.children().get(1)).operator());
    }

    @Test
    void parse_ShouldTreatIsNullAsEqualityWithNull() {
        // Act
        Condition isNull = parser.parseStrict("Visit.VisitDate IS NULL");
        Condition isNotNull = parser.parseStrict("Visit.VisitDate IS NOT NULL");

        // Assert
        assertEquals(new Condition.Comparison(new FieldRef("Visit", "VisitDate"), ComparisonOperator.EQ, Literal.NULL), isNull);
        assertEquals(ComparisonOperator.NE, ((Condition.Comparison) isNotNull).operator());
    }

    @Test
    void parse_ShouldReadIfThenElse() {
        // Act
        Condition condition = parser.parseStrict(
                "IF Demographics.Sex = 'F' THEN Demographics.Age >= 12 ELSE Demographics.Age >= 18");

        // Assert
        Condition.IfThenElse ite = assertInstanceOf(Condition.IfThenElse.class, condition);
        assertNotNull(ite.otherwise());
    }

    @Test
    void parse_ShouldRejectMalformedConditions() {
        // Assert
        assertThrows(ConditionParseException.class, () -> parser.parseStrict("Labs.Hb >"));
        assertTrue(parser.parse("Labs.Hb > NULL").isEmpty());
        assertTrue(parser.parse("Age > 5").isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
    }

    @Test
    void atomicComparisons_ShouldNormalizeAndApplyPolarity() {
        // Arrange
        Condition condition = parser.parseStrict("NOT (Labs.Hb > 5) AND 10 < Labs.Wbc");

        // Act
        List<Condition.Comparison> comparisons = condition.atomicComparisons();

        // Assert
        assertEquals(2, comparisons.size());
        assertEquals(ComparisonOperator.LE, comparisons.get(0).operator());
        assertEquals(new FieldRef("Labs", "Wbc"), comparisons.get(1).left());
        assertEquals(ComparisonOperator.GT, comparisons.get(1).operator());
    }
}
