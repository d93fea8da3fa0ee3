package org.snrasm.compiler.backend.encode;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.ir.IrInstruction;
import org.snrasm.compiler.ir.IrItem;
import org.snrasm.compiler.ir.IrLabelDef;
import org.snrasm.compiler.ir.IrProgram;
import org.snrasm.compiler.isa.CodeWriter;
import org.snrasm.compiler.isa.EncodingException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes the IR of one unit into position independent code plus relocations.
 * Directives are not encoded.
 */
public final class UnitEncoder {

    private final InstructionEncoder instructions;

    public UnitEncoder(InstructionEncoder instructions) {
        this.instructions = instructions;
    }

    /**
     * Encodes a unit. An instruction that cannot be encoded is reported and left out;
     * the remaining instructions are still encoded.
     *
     * @param program     The unit after the emission rules ran.
     * @param diagnostics The engine of the unit.
     * @return The encoded unit.
     */
    public EncodedUnit encode(IrProgram program, DiagnosticsEngine diagnostics) {
        CodeWriter code = new CodeWriter();
        List<Relocation> relocations = new ArrayList<>();
        Map<String, Integer> labels = new LinkedHashMap<>();

        for (IrItem item : program.items()) {
            if (item instanceof IrLabelDef label) {
                labels.putIfAbsent(label.key(), code.position());
            } else if (item instanceof IrInstruction ins) {
                CodeWriter scratch = new CodeWriter();
                List<Relocation> pending = new ArrayList<>();
                try {
                    instructions.encode(ins, scratch, pending);
                } catch (EncodingException e) {
                    diagnostics.reportError(e.getMessage(), ins.span());
                    continue;
                }
                int base = code.position();
                for (Relocation r : pending) {
                    relocations.add(new Relocation(base + r.offset(), r.targetKey(), r.displayName(), r.span()));
                }
                code.bytes(scratch.toByteArray());
            }
        }
        return new EncodedUnit(code.toByteArray(), relocations, labels);
    }
}
