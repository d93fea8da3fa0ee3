package org.snrasm.compiler.backend.emit.features;

import org.snrasm.compiler.backend.emit.EmissionContext;
import org.snrasm.compiler.backend.emit.IEmissionRule;
import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.frontend.irgen.converters.RoutineNodeConverter;
import org.snrasm.compiler.ir.IrDirective;
import org.snrasm.compiler.ir.IrInstruction;
import org.snrasm.compiler.ir.IrItem;
import org.snrasm.compiler.ir.IrList;
import org.snrasm.compiler.ir.IrNumber;
import org.snrasm.compiler.ir.IrOperand;
import org.snrasm.compiler.ir.IrReg;
import org.snrasm.compiler.ir.IrValue;
import org.snrasm.compiler.isa.NumberSpec;
import org.snrasm.compiler.isa.Register;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Inserts the prologue and epilogue of functions and subroutines.
 * <p>
 * A function with preserved registers pushes them right after its entry and pops them, in
 * reverse order, before every {@code return}. The end of a body that can fall through gets
 * an implicit {@code return} (functions) or {@code retsub} (subroutines), with the same
 * restoration in front of it.
 */
public class PreservedRegisterRule implements IEmissionRule {

    @Override
    public List<IrItem> apply(List<IrItem> items, EmissionContext context) {
        List<IrItem> out = new ArrayList<>(items.size() + 8);
        int i = 0;
        while (i < items.size()) {
            IrItem it = items.get(i);
            if (it instanceof IrDirective dir && dir.is(RoutineNodeConverter.NAMESPACE, RoutineNodeConverter.ENTER)) {
                int bodyEndIndex = findBodyEnd(items, i);
                List<IrItem> body = items.subList(i + 1, bodyEndIndex);
                List<Register> preserved = preserved(dir);
                boolean subroutine = isSubroutine(dir);

                out.add(it);
                if (!preserved.isEmpty()) {
                    out.add(push(preserved, dir.span(), context));
                }
                for (IrItem item : body) {
                    if (item instanceof IrInstruction ins && "return".equals(ins.mnemonic())) {
                        emitEpilogue(out, ins, preserved, context);
                    } else {
                        out.add(item);
                    }
                }

                if (bodyEndIndex < items.size()) {
                    IrDirective exit = (IrDirective) items.get(bodyEndIndex);
                    if (fallsThrough(body)) {
                        String terminator = subroutine ? "retsub" : "return";
                        IrInstruction ret = new IrInstruction(context.instruction(terminator), List.of(), exit.span());
                        emitEpilogue(out, ret, preserved, context);
                    }
                    out.add(exit);
                }
                i = bodyEndIndex + 1;
            } else {
                out.add(it);
                i++;
            }
        }
        return out;
    }

    private void emitEpilogue(List<IrItem> out, IrInstruction ret, List<Register> preserved, EmissionContext context) {
        if (!preserved.isEmpty()) {
            out.add(pop(preserved, ret.span(), context));
        }
        out.add(ret);
    }

    private IrInstruction push(List<Register> preserved, Span span, EmissionContext context) {
        List<IrOperand> values = new ArrayList<>(preserved.size());
        for (Register r : preserved) {
            values.add(new IrNumber(NumberSpec.of(r)));
        }
        return new IrInstruction(context.instruction("push"), List.of(new IrList(values)), span);
    }

    private IrInstruction pop(List<Register> preserved, Span span, EmissionContext context) {
        List<IrOperand> registers = new ArrayList<>(preserved.size());
        for (Register r : preserved) {
            registers.add(new IrReg(r));
        }
        Collections.reverse(registers);
        return new IrInstruction(context.instruction("pop"), List.of(new IrList(registers)), span);
    }

    /**
     * The last item decides: a label can be jumped to, so only an instruction that never
     * falls through makes the implicit terminator unreachable.
     */
    private boolean fallsThrough(List<IrItem> body) {
        for (int j = body.size() - 1; j >= 0; j--) {
            IrItem item = body.get(j);
            if (item instanceof IrDirective) {
                continue;
            }
            return !(item instanceof IrInstruction ins && ins.definition().neverFallsThrough());
        }
        return true;
    }

    private int findBodyEnd(List<IrItem> items, int startIndex) {
        int j = startIndex + 1;
        while (j < items.size()) {
            IrItem item = items.get(j);
            if (item instanceof IrDirective d && d.is(RoutineNodeConverter.NAMESPACE, RoutineNodeConverter.EXIT)) {
                return j;
            }
            j++;
        }
        return j;
    }

    private static List<Register> preserved(IrDirective dir) {
        return dir.args().get("preserved") instanceof IrValue.Regs regs ? regs.registers() : List.of();
    }

    private static boolean isSubroutine(IrDirective dir) {
        return dir.args().get("kind") instanceof IrValue.Str kind && "subroutine".equals(kind.value());
    }
}
