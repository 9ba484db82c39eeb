package com.vidnyan.ecv.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Scoped Z3 solver session.
 * <p>
 * Owns its own {@link Context}, so sessions are never shared between threads. Every check pushes
 * a fresh scope and pops it before returning, so no assertion outlives the check that made it.
 * Use with try-with-resources.
 */
@Slf4j
public final class SolverSession implements AutoCloseable {

    private final Context context;
    private final Solver solver;
    private int checks;

    private SolverSession(Duration timeout) {
        this.context = new Context();
        this.solver = context.mkSolver();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            Params params = context.mkParams();
            params.add("timeout", (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE));
            solver.setParameters(params);
        }
    }

    public static SolverSession open() {
        return new SolverSession(null);
    }

    /**
     * Session whose checks give up with {@link Status#UNKNOWN} after the timeout; null, zero or
     * negative means no limit.
     */
    public static SolverSession open(Duration timeout) {
        return new SolverSession(timeout);
    }

    public Context context() {
        return context;
    }

    /**
     * Check the conjunction of the given assertions in an isolated scope.
     */
    public Status check(BoolExpr... assertions) {
        solver.push();
        try {
            solver.add(assertions);
            Status status = solver.check();
            checks++;
            log.trace("check #{} -> {}", checks, status);
            return status;
        } finally {
            solver.pop();
        }
    }

    public boolean isSatisfiable(BoolExpr... assertions) {
        return check(assertions) == Status.SATISFIABLE;
    }

    /**
     * Read a satisfying model inside the check's scope.
     * Empty when the assertions are unsatisfiable or the solver gives up.
     */
    public <T> Optional<T> solve(Function<Model, T> reader, BoolExpr... assertions) {
        solver.push();
        try {
            solver.add(assertions);
            checks++;
            if (solver.check() != Status.SATISFIABLE) {
                return Optional.empty();
            }
            return Optional.ofNullable(reader.apply(solver.getModel()));
        } finally {
            solver.pop();
        }
    }

    public int checkCount() {
        return checks;
    }

    @Override
    public void close() {
        context.close();
    }
}
