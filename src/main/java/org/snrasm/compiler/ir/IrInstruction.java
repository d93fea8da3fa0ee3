package org.snrasm.compiler.ir;

import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.isa.InstructionDef;
import org.snrasm.compiler.isa.InstructionFlag;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Represents an instruction in the intermediate representation.
 *
 * @param definition The instruction layout.
 * @param operands   One operand per positional field. Omitted optional {@code uo}/{@code bo}
 *                   operands are absent, which clears the explicit bit.
 * @param flags      The flags given after the operands.
 * @param span       The source span.
 */
public record IrInstruction(InstructionDef definition, List<IrOperand> operands, Set<InstructionFlag> flags, Span span)
        implements IrItem {

    public IrInstruction {
        operands = List.copyOf(operands);
        flags = flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public IrInstruction(InstructionDef definition, List<IrOperand> operands, Span span) {
        this(definition, operands, Set.of(), span);
    }

    public String mnemonic() {
        return definition.mnemonic();
    }

    public boolean hasErrors() {
        return operands.stream().anyMatch(IrInstruction::containsError);
    }

    private static boolean containsError(IrOperand operand) {
        if (operand instanceof IrError) {
            return true;
        }
        return operand instanceof IrList list && list.elements().stream().anyMatch(IrInstruction::containsError);
    }

    @Override
    public String toString() {
        return "IrInstruction{" + definition.mnemonic() + " " + operands + (flags.isEmpty() ? "" : " " + flags) + "}";
    }
}
