package com.vidnyan.ecv.domain.condition;

/**
 * Side of a comparison: a {@link FieldRef} or a {@link Literal}.
 */
public interface Operand {
}
