package org.snrasm.compiler.disasm;

import org.snrasm.compiler.ir.IrAddress;
import org.snrasm.compiler.ir.IrInstruction;
import org.snrasm.compiler.ir.IrList;
import org.snrasm.compiler.ir.IrOperand;

import java.util.ArrayList;
import java.util.List;

/**
 * An instruction read back from a code block.
 *
 * @param address     The absolute address of the opcode byte.
 * @param size        The encoded size in bytes.
 * @param instruction The instruction; code addresses are {@link IrAddress} operands.
 */
public record DecodedInstruction(long address, int size, IrInstruction instruction) {

    public long end() {
        return address + size;
    }

    public String mnemonic() {
        return instruction.mnemonic();
    }

    /**
     * @return Every code address the instruction refers to, in operand order.
     */
    public List<Long> targets() {
        List<Long> targets = new ArrayList<>();
        for (IrOperand op : instruction.operands()) {
            collect(op, targets);
        }
        return targets;
    }

    private static void collect(IrOperand op, List<Long> targets) {
        if (op instanceof IrAddress a) {
            targets.add(a.address());
        } else if (op instanceof IrList list) {
            list.elements().forEach(e -> collect(e, targets));
        }
    }
}
