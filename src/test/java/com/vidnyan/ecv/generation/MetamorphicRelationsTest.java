package com.vidnyan.ecv.generation;

import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MetamorphicRelationsTest {

    @ParameterizedTest
    @EnumSource(ComparisonOperator.class)
    void forOperator_ShouldLabelFollowUpsCorrectly(ComparisonOperator op) {
        // Arrange
        Random random = new Random(7);
        int checked = 0;

        // Act + Assert
        for (int i = 0; i < 500; i++) {
            double threshold = random.nextInt(201) - 100;
            double base = op == ComparisonOperator.EQ ? threshold : random.nextInt(201) - 100;
            if (!op.test(base, threshold)) {
                continue;
            }
            for (boolean wholeUnits : new boolean[] {false, true}) {
                for (MetamorphicRelations.Entry entry : MetamorphicRelations.forOperator(op)) {
                    double followUp = entry.relation().apply(base, threshold, wholeUnits);
                    assertEquals(entry.expectedResult(), op.test(followUp, threshold),
                            () -> op + " " + entry.relation().code() + " base=" + base + " t=" + threshold);
                    if (wholeUnits) {
                        assertEquals(Math.rint(followUp), followUp);
                    }
                    checked++;
                }
            }
        }
        assertTrue(checked > 0);
    }

    @Test
    void forOperator_ShouldKeepWithinRelationsTrue() {
        // Assert
        assertTrue(MetamorphicRelations.forOperator(ComparisonOperator.GE).stream()
                .filter(e -> e.relation() == MetamorphicRelations.Relation.DECREASE_WITHIN)
                .allMatch(MetamorphicRelations.Entry::expectedResult));
        assertTrue(MetamorphicRelations.forOperator(ComparisonOperator.LT).stream()
                .filter(e -> e.relation() == MetamorphicRelations.Relation.INCREASE_WITHIN)
                .allMatch(MetamorphicRelations.Entry::expectedResult));
    }

    @Test
    void apply_ShouldMoveAtBoundaryBaseByOneUnit() {
        // Act
        double beyond = MetamorphicRelations.Relation.DECREASE_BEYOND.apply(12, 12, false);
        double within = MetamorphicRelations.Relation.DECREASE_WITHIN.apply(12, 12, false);

        // Assert
        assertEquals(11.0, beyond);
        assertEquals(12.0, within);
    }
}
