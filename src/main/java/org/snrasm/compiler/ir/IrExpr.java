package org.snrasm.compiler.ir;

import org.snrasm.compiler.isa.ExpressionTerm;

import java.util.List;

/**
 * A lowered RPN expression for {@code exp}.
 */
public record IrExpr(List<ExpressionTerm> terms) implements IrOperand {
    public IrExpr {
        terms = List.copyOf(terms);
    }
}
