package com.vidnyan.ecv.smt;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Status;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SolverSessionTest {

    @Test
    void open_ShouldSolveWithinTimeout() {
        try (SolverSession session = SolverSession.open(Duration.ofSeconds(5))) {
            // Arrange
            Context ctx = session.context();
            ArithExpr<IntSort> x = ctx.mkIntConst("x");

            // Act
            Optional<Integer> value = session.solve(
                    model -> ((IntNum) model.eval(x, true)).getInt(),
                    ctx.mkGt(x, ctx.mkInt(3)), ctx.mkLt(x, ctx.mkInt(5)));

            // Assert
            assertEquals(Optional.of(4), value);
            assertEquals(Status.UNSATISFIABLE, session.check(ctx.mkGt(x, ctx.mkInt(3)), ctx.mkLt(x, ctx.mkInt(4))));
            assertEquals(2, session.checkCount());
        }
    }

    @Test
    void open_ShouldIgnoreMissingOrNonPositiveTimeout() {
        for (Duration timeout : new Duration[] {null, Duration.ZERO, Duration.ofMillis(-1)}) {
            try (SolverSession session = SolverSession.open(timeout)) {
                // Arrange
                Context ctx = session.context();
                ArithExpr<IntSort> x = ctx.mkIntConst("x");

                // Assert
                assertTrue(session.isSatisfiable(ctx.mkEq(x, ctx.mkInt(7))));
            }
        }
    }

    @Test
    void check_ShouldNotLeakAssertionsBetweenChecks() {
        try (SolverSession session = SolverSession.open()) {
            // Arrange
            Context ctx = session.context();
            ArithExpr<IntSort> x = ctx.mkIntConst("x");

            // Act
            Status first = session.check(ctx.mkEq(x, ctx.mkInt(1)));
            Status second = session.check(ctx.mkEq(x, ctx.mkInt(2)));

            // Assert
            assertEquals(Status.SATISFIABLE, first);
            assertEquals(Status.SATISFIABLE, second);
        }
    }
}
