package org.snrasm.compiler.frontend.irgen;

import org.snrasm.compiler.frontend.semantics.ConstValue;
import org.snrasm.compiler.frontend.semantics.ValueKind;
import org.snrasm.compiler.isa.ExpressionTerm;
import org.snrasm.compiler.isa.NumberSpec;

import java.util.List;

/**
 * A typed expression value during lowering: either folded to a constant or
 * RPN code that computes it at run time.
 */
public sealed interface LoweredValue permits LoweredValue.Const, LoweredValue.Runtime {

    ValueKind kind();

    /**
     * @return The RPN terms that push this value.
     */
    List<ExpressionTerm> terms();

    record Const(int value, ValueKind kind) implements LoweredValue {
        @Override
        public List<ExpressionTerm> terms() {
            return List.of(ExpressionTerm.push(NumberSpec.constant(value)));
        }

        public ConstValue toConstValue() {
            return new ConstValue(value, kind);
        }
    }

    record Runtime(List<ExpressionTerm> terms, ValueKind kind) implements LoweredValue {
        public Runtime {
            terms = List.copyOf(terms);
        }
    }
}
