package com.vidnyan.ecv.smt;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Model;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Sort;
import com.vidnyan.ecv.domain.condition.ComparisonOperator;
import com.vidnyan.ecv.domain.condition.Condition;
import com.vidnyan.ecv.domain.condition.FieldRef;
import com.vidnyan.ecv.domain.condition.Literal;
import com.vidnyan.ecv.domain.condition.Operand;
import com.vidnyan.ecv.domain.condition.RuleAnalysis;
import com.vidnyan.ecv.domain.model.Field;
import com.vidnyan.ecv.domain.model.FieldType;
import com.vidnyan.ecv.domain.model.FieldValues;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates condition trees into Z3 formulas over one typed variable per field.
 * <p>
 * Sorts: Real for numeric, Int days since epoch for date and datetime, Int seconds of day for
 * time, String for categorical and text, Bool for boolean. A missing value is the type's NULL
 * sentinel; boolean fields have none. Bound to a single {@link SolverSession}.
 */
@Slf4j
public final class FormulaTranslator {

    public static final BigDecimal NUMERIC_NULL = BigDecimal.valueOf(-9999);
    public static final long DATE_NULL = -9_999_999L;
    public static final long TIME_NULL = -1L;
    public static final String STRING_NULL = "__NULL__";

    private final Context ctx;
    private final Map<FieldRef, FieldType> types = new HashMap<>();
    private final Map<FieldRef, Expr<?>> variables = new HashMap<>();

    public FormulaTranslator(SolverSession session) {
        this.ctx = session.context();
    }

    /**
     * Register the fields of an analysis. The first registration of a field fixes its sort.
     */
    public FormulaTranslator register(RuleAnalysis analysis) {
        analysis.types().forEach(types::putIfAbsent);
        return this;
    }

    /**
     * Formula for an analyzed rule: the full tree when it parsed, otherwise the conjunction
     * of the pattern-matched comparisons. Empty when nothing is translatable.
     */
    public Optional<BoolExpr> translate(RuleAnalysis analysis) {
        register(analysis);
        if (analysis.isParsed()) {
            return Optional.ofNullable(translate(analysis.condition()));
        }
        return Optional.ofNullable(conjunction(new ArrayList<>(analysis.comparisons())));
    }

    /**
     * Formula for a condition, or null when no part of it is translatable.
     * Untranslatable leaves are dropped from their AND/OR.
     */
    public BoolExpr translate(Condition condition) {
        if (condition instanceof Condition.Comparison c) {
            return comparison(c);
        }
        if (condition instanceof Condition.And and) {
            return conjunction(and.children());
        }
        if (condition instanceof Condition.Or or) {
            List<BoolExpr> parts = translateAll(or.children());
            return parts.isEmpty() ? null : ctx.mkOr(parts.toArray(new BoolExpr[0]));
        }
        if (condition instanceof Condition.Not not) {
            BoolExpr inner = translate(not.operand());
            return inner == null ? null : ctx.mkNot(inner);
        }
        if (condition instanceof Condition.IfThenElse ite) {
            BoolExpr test = translate(ite.test());
            BoolExpr then = translate(ite.then());
            if (test == null || then == null) {
                return null;
            }
            BoolExpr otherwise = ite.otherwise() == null ? ctx.mkTrue() : translate(ite.otherwise());
            if (otherwise == null) {
                return null;
            }
            return ctx.mkOr(ctx.mkAnd(test, then), ctx.mkAnd(ctx.mkNot(test), otherwise));
        }
        return null;
    }

    private BoolExpr conjunction(List<? extends Condition> children) {
        List<BoolExpr> parts = translateAll(children);
        return parts.isEmpty() ? null : ctx.mkAnd(parts.toArray(new BoolExpr[0]));
    }

    private List<BoolExpr> translateAll(List<? extends Condition> children) {
        List<BoolExpr> parts = new ArrayList<>();
        for (Condition child : children) {
            BoolExpr part = translate(child);
            if (part != null) {
                parts.add(part);
            }
        }
        return parts;
    }

    // ---------------------------------------------------------------- comparisons

    private BoolExpr comparison(Condition.Comparison source) {
        Condition.Comparison c = source.normalized();
        if (!(c.left() instanceof FieldRef field)) {
            log.debug("Skipping constant comparison {}", c);
            return null;
        }
        FieldType type = typeOf(field);
        Operand right = c.right();
        ComparisonOperator op = c.operator();

        if (right instanceof Literal literal && literal.isNull()) {
            BoolExpr isNull = isNull(field);
            return op == ComparisonOperator.EQ ? isNull : ctx.mkNot(isNull);
        }
        if (right instanceof FieldRef other) {
            return compare(op, variable(field), type, variable(other), typeOf(other));
        }
        Optional<Object> value = FieldValues.coerce(type, ((Literal) right).value());
        if (value.isEmpty()) {
            log.debug("Literal {} does not fit {} field {}", right, type.code(), field);
            return null;
        }
        return compare(op, variable(field), type, constant(type, value.get()), type);
    }

    private BoolExpr compare(ComparisonOperator op, Expr<?> lhs, FieldType lhsType, Expr<?> rhs, FieldType rhsType) {
        if (lhsType.isOrdered() && rhsType.isOrdered()) {
            ArithExpr<?> a = toReal(lhs, lhsType, rhsType);
            ArithExpr<?> b = toReal(rhs, rhsType, lhsType);
            return switch (op) {
                case EQ -> eq(a, b);
                case NE -> ctx.mkNot(eq(a, b));
                case LT -> ctx.mkLt(a, b);
                case LE -> ctx.mkLe(a, b);
                case GT -> ctx.mkGt(a, b);
                case GE -> ctx.mkGe(a, b);
            };
        }
        if (!sameSort(lhsType, rhsType) || op.isOrdering()) {
            log.debug("Unsupported {} comparison between {} and {}", op, lhsType.code(), rhsType.code());
            return null;
        }
        BoolExpr eq = eq(lhs, rhs);
        return op == ComparisonOperator.EQ ? eq : ctx.mkNot(eq);
    }

    /**
     * Equality of two terms; callers pair terms of the same sort and Z3 rejects a mismatch.
     */
    @SuppressWarnings("unchecked")
    private <R extends Sort> BoolExpr eq(Expr<R> a, Expr<?> b) {
        return ctx.mkEq(a, (Expr<R>) b);
    }

    @SuppressWarnings("unchecked")
    private ArithExpr<?> toReal(Expr<?> term, FieldType type, FieldType otherType) {
        boolean isInt = type.isTemporal();
        boolean otherIsInt = otherType.isTemporal();
        if (isInt && !otherIsInt) {
            return ctx.mkInt2Real((Expr<IntSort>) term);
        }
        return (ArithExpr<?>) term;
    }

    private static boolean sameSort(FieldType a, FieldType b) {
        return (a.isStringLike() && b.isStringLike()) || a == b;
    }

    // ---------------------------------------------------------------- variables and values

    public FieldType typeOf(FieldRef ref) {
        return types.getOrDefault(ref, FieldType.NUMERIC);
    }

    /**
     * Solver variable of a field, created on first use.
     */
    public Expr<?> variable(FieldRef ref) {
        return variables.computeIfAbsent(ref, r -> {
            String name = r.path();
            return switch (typeOf(r)) {
                case NUMERIC -> ctx.mkRealConst(name);
                case DATE, DATETIME, TIME -> ctx.mkIntConst(name);
                case BOOLEAN -> ctx.mkBoolConst(name);
                case CATEGORICAL, TEXT -> ctx.mkConst(name, ctx.getStringSort());
            };
        });
    }

    /**
     * Solver constant for a canonical value (see {@link FieldValues#coerce}).
     */
    public Expr<?> constant(FieldType type, Object canonical) {
        return switch (type) {
            case NUMERIC -> real((BigDecimal) canonical);
            case DATE, DATETIME, TIME -> ctx.mkInt((Long) canonical);
            case BOOLEAN -> ctx.mkBool((Boolean) canonical);
            case CATEGORICAL, TEXT -> ctx.mkString((String) canonical);
        };
    }

    public ArithExpr<?> real(BigDecimal value) {
        if (value.signum() < 0) {
            return ctx.mkUnaryMinus(ctx.mkReal(value.negate().toPlainString()));
        }
        return ctx.mkReal(value.toPlainString());
    }

    /**
     * {@code field == value} on the solver scale of an ordered field.
     */
    public BoolExpr equalsScale(FieldRef ref, BigDecimal value) {
        FieldType type = typeOf(ref);
        Expr<?> var = variable(ref);
        if (type.isTemporal()) {
            return eq(var, ctx.mkInt(value.longValue()));
        }
        return eq(var, real(value));
    }

    /**
     * Predicate "field is missing". Always false for boolean fields.
     */
    public BoolExpr isNull(FieldRef ref) {
        FieldType type = typeOf(ref);
        if (type == FieldType.BOOLEAN) {
            return ctx.mkFalse();
        }
        return eq(variable(ref), nullSentinel(type));
    }

    private Expr<?> nullSentinel(FieldType type) {
        return switch (type) {
            case NUMERIC -> real(NUMERIC_NULL);
            case DATE, DATETIME -> ctx.mkInt(DATE_NULL);
            case TIME -> ctx.mkInt(TIME_NULL);
            default -> ctx.mkString(STRING_NULL);
        };
    }

    /**
     * Equality binding a field to a raw test-data value. A value that does not coerce to the
     * field type binds the field to NULL. Returns null when no binding is expressible
     * (a missing boolean).
     */
    public BoolExpr bind(FieldRef ref, Object raw) {
        FieldType type = typeOf(ref);
        Optional<Object> value = FieldValues.coerce(type, raw);
        if (value.isPresent()) {
            return eq(variable(ref), constant(type, value.get()));
        }
        return type == FieldType.BOOLEAN ? null : isNull(ref);
    }

    /**
     * Declared domain of a field: numeric/date bounds and the valid-value set.
     */
    public BoolExpr domain(FieldRef ref, Field field) {
        FieldType type = typeOf(ref);
        List<BoolExpr> parts = new ArrayList<>();
        if (type.isOrdered()) {
            field.lowerBound().ifPresent(lo -> parts.add(ctx.mkGe(scaled(ref), realOrInt(type, lo))));
            field.upperBound().ifPresent(hi -> parts.add(ctx.mkLe(scaled(ref), realOrInt(type, hi))));
        }
        if (type.isStringLike() && field.hasValidValues()) {
            BoolExpr[] options = field.validValues().stream()
                    .map(v -> eq(variable(ref), ctx.mkString(v)))
                    .toArray(BoolExpr[]::new);
            parts.add(ctx.mkOr(options));
        }
        return parts.isEmpty() ? ctx.mkTrue() : ctx.mkAnd(parts.toArray(new BoolExpr[0]));
    }

    private ArithExpr<?> scaled(FieldRef ref) {
        return (ArithExpr<?>) variable(ref);
    }

    private ArithExpr<?> realOrInt(FieldType type, double value) {
        if (type.isTemporal()) {
            return ctx.mkInt(Math.round(value));
        }
        return real(BigDecimal.valueOf(value));
    }

    /**
     * Value of a field in a model, rendered for test data. Empty when the model chose the
     * NULL sentinel.
     */
    public Optional<Object> read(Model model, FieldRef ref) {
        FieldType type = typeOf(ref);
        Expr<?> value = model.eval(variable(ref), true);
        switch (type) {
            case NUMERIC: {
                Optional<BigDecimal> number = decimal(value);
                if (number.isEmpty() || number.get().compareTo(NUMERIC_NULL) == 0) {
                    return Optional.empty();
                }
                return Optional.of(number.get().doubleValue());
            }
            case DATE:
            case DATETIME:
            case TIME: {
                if (!(value instanceof IntNum n)) {
                    return Optional.empty();
                }
                long raw = n.getInt64();
                if (raw == (type == FieldType.TIME ? TIME_NULL : DATE_NULL)) {
                    return Optional.empty();
                }
                return Optional.of(FieldValues.fromScale(type, raw));
            }
            case BOOLEAN:
                return Optional.of(value.isTrue());
            default: {
                if (!value.isString()) {
                    return Optional.empty();
                }
                String text = value.getString();
                return STRING_NULL.equals(text) ? Optional.empty() : Optional.of(text);
            }
        }
    }

    private static Optional<BigDecimal> decimal(Expr<?> value) {
        if (value instanceof RatNum r) {
            return Optional.of(new BigDecimal(r.getBigIntNumerator())
                    .divide(new BigDecimal(r.getBigIntDenominator()), MathContext.DECIMAL64));
        }
        if (value instanceof IntNum n) {
            return Optional.of(new BigDecimal(n.getBigInteger()));
        }
        return Optional.empty();
    }
}
