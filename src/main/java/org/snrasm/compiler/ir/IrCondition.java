package org.snrasm.compiler.ir;

import org.snrasm.compiler.isa.JumpCondition;
import org.snrasm.compiler.isa.NumberSpec;

/**
 * A lowered {@code jc} condition.
 */
public record IrCondition(JumpCondition condition, NumberSpec left, NumberSpec right) implements IrOperand {}
