package org.snrasm.compiler.backend.encode;

import org.snrasm.compiler.ir.IrAddress;
import org.snrasm.compiler.ir.IrCondition;
import org.snrasm.compiler.ir.IrError;
import org.snrasm.compiler.ir.IrExpr;
import org.snrasm.compiler.ir.IrImm;
import org.snrasm.compiler.ir.IrInstruction;
import org.snrasm.compiler.ir.IrLabelRef;
import org.snrasm.compiler.ir.IrList;
import org.snrasm.compiler.ir.IrNumber;
import org.snrasm.compiler.ir.IrOperand;
import org.snrasm.compiler.ir.IrReg;
import org.snrasm.compiler.ir.IrString;
import org.snrasm.compiler.isa.CodeWriter;
import org.snrasm.compiler.isa.EncodingException;
import org.snrasm.compiler.isa.ExpressionTerm;
import org.snrasm.compiler.isa.Field;
import org.snrasm.compiler.isa.InstructionDef;
import org.snrasm.compiler.isa.NumberSpec;
import org.snrasm.compiler.isa.NumberSpecCodec;
import org.snrasm.compiler.isa.OperandKind;
import org.snrasm.compiler.isa.Shape;
import org.snrasm.compiler.isa.TermOp;
import org.snrasm.compiler.isa.TextCodec;

import java.util.List;

/**
 * Writes a single {@link IrInstruction} in the binary encoding.
 * <p>
 * Code address fields are written as zero and recorded as {@link Relocation}s. Error
 * placeholders are written as zeros of the field's width so that the layout of the unit
 * stays stable while the errors are reported elsewhere.
 */
public final class InstructionEncoder {

    private static final int PAD = 4;

    private final TextCodec text;

    public InstructionEncoder(TextCodec text) {
        this.text = text;
    }

    /**
     * Encodes one instruction.
     *
     * @param ins         The instruction.
     * @param out         The writer; relocation offsets are relative to its start.
     * @param relocations Receives the address fields written.
     * @throws EncodingException If an operand does not fit its field.
     */
    public void encode(IrInstruction ins, CodeWriter out, List<Relocation> relocations) throws EncodingException {
        InstructionDef def = ins.definition();
        out.u8(def.opcode());
        if (def.shape() != Shape.PLAIN) {
            encodeOperation(ins, out);
            return;
        }
        List<IrOperand> operands = ins.operands();
        int next = 0;
        for (Field field : def.fields()) {
            if (!field.isPositional()) {
                boolean set = ins.flags().contains(field.flag());
                out.u8(set != field.inverted() ? 1 : 0);
                continue;
            }
            if (next >= operands.size()) {
                throw new EncodingException("`" + def.mnemonic() + "` is missing an operand");
            }
            writeField(field.kind(), operands.get(next++), ins, out, relocations);
        }
    }

    /**
     * {@code uo}/{@code bo}: type byte, destination, then the optional explicit source or left
     * operand, then the right operand of binary operations.
     */
    private void encodeOperation(IrInstruction ins, CodeWriter out) throws EncodingException {
        InstructionDef def = ins.definition();
        List<IrOperand> operands = ins.operands();
        int full = def.positionalFields().size();
        boolean explicit = operands.size() == full;
        out.u8(def.subtype() | (explicit ? 0x80 : 0));
        writeRegister(operands.get(0), out);
        for (int i = 1; i < operands.size(); i++) {
            writeNumber(operands.get(i), out);
        }
    }

    private void writeField(OperandKind kind, IrOperand op, IrInstruction ins, CodeWriter out,
                            List<Relocation> relocations) throws EncodingException {
        switch (kind) {
            case REGISTER -> writeRegister(op, out);
            case NUMBER -> writeNumber(op, out);
            case U8, BOOL -> out.u8((int) immediate(op, kind == OperandKind.U8 ? 0xFF : 1));
            case U16 -> out.u16((int) immediate(op, 0xFFFF));
            case MESSAGE_ID -> out.u24((int) immediate(op, 0xFFFFFF));
            case STRING -> writeString(op, out, false);
            case FIXUP_STRING -> writeString(op, out, true);
            case STRING_ARRAY -> writeStringArray(list(op), out);
            case NUMBER_LIST -> {
                List<IrOperand> elements = list(op);
                out.u8(count(elements, kind));
                for (IrOperand e : elements) {
                    writeNumber(e, out);
                }
            }
            case REGISTER_LIST -> {
                List<IrOperand> elements = list(op);
                out.u8(count(elements, kind));
                for (IrOperand e : elements) {
                    writeRegister(e, out);
                }
            }
            case BITMASK -> writeBitmask(list(op), out);
            case CODE_ADDRESS -> writeAddress(op, ins, out, relocations);
            case EXPRESSION -> writeExpression(op, out);
            case CONDITION -> writeCondition(op, out);
            case NUMBER_TABLE -> {
                List<IrOperand> elements = list(op);
                out.u16(count(elements, kind));
                for (IrOperand e : elements) {
                    int start = out.position();
                    writeNumber(e, out);
                    while (out.position() - start < PAD) {
                        out.u8(0);
                    }
                }
            }
            case ADDRESS_TABLE -> {
                List<IrOperand> elements = list(op);
                out.u16(count(elements, kind));
                for (IrOperand e : elements) {
                    writeAddress(e, ins, out, relocations);
                }
            }
        }
    }

    private void writeRegister(IrOperand op, CodeWriter out) throws EncodingException {
        if (op instanceof IrReg r) {
            out.u16(r.register().id());
        } else if (op instanceof IrError) {
            out.u16(0);
        } else {
            throw unexpected("a register", op);
        }
    }

    private void writeNumber(IrOperand op, CodeWriter out) throws EncodingException {
        if (op instanceof IrNumber n) {
            NumberSpecCodec.encode(n.value(), out);
        } else if (op instanceof IrError) {
            out.u8(0);
        } else {
            throw unexpected("a number", op);
        }
    }

    private long immediate(IrOperand op, long max) throws EncodingException {
        if (op instanceof IrError) {
            return 0;
        }
        if (!(op instanceof IrImm imm)) {
            throw unexpected("an immediate", op);
        }
        if (imm.value() < 0 || imm.value() > max) {
            throw new EncodingException("Value " + imm.value() + " does not fit into 0.." + max);
        }
        return imm.value();
    }

    private void writeString(IrOperand op, CodeWriter out, boolean fixup) throws EncodingException {
        if (op instanceof IrError) {
            out.u16(1);
            out.u8(0);
            return;
        }
        if (!(op instanceof IrString s)) {
            throw unexpected("a string", op);
        }
        byte[] bytes = fixup ? text.encodeFixup(s.value()) : text.encode(s.value());
        if (bytes.length + 1 > 0xFFFF) {
            throw new EncodingException("String is too long: " + bytes.length + " bytes");
        }
        out.u16(bytes.length + 1);
        out.bytes(bytes);
        out.u8(0);
    }

    private void writeStringArray(List<IrOperand> elements, CodeWriter out) throws EncodingException {
        CodeWriter buffer = new CodeWriter();
        for (IrOperand e : elements) {
            if (e instanceof IrError) {
                continue;
            }
            if (!(e instanceof IrString s)) {
                throw unexpected("a string", e);
            }
            if (s.value().isEmpty()) {
                throw new EncodingException("Elements of a string array cannot be empty");
            }
            buffer.bytes(text.encode(s.value()));
            buffer.u8(0);
        }
        buffer.u8(0);
        if (buffer.position() > 0xFFFF) {
            throw new EncodingException("String array is too long: " + buffer.position() + " bytes");
        }
        out.u16(buffer.position());
        out.bytes(buffer.toByteArray());
    }

    /** Zero constants are left out of the mask; the VM reads absent entries as zero. */
    private void writeBitmask(List<IrOperand> elements, CodeWriter out) throws EncodingException {
        if (elements.size() > OperandKind.BITMASK.maxElements()) {
            throw new EncodingException("A bitmask holds at most 8 numbers, found " + elements.size());
        }
        int mask = 0;
        for (int i = 0; i < elements.size(); i++) {
            IrOperand e = elements.get(i);
            if (e instanceof IrNumber n && !n.value().isZero()) {
                mask |= 1 << i;
            }
        }
        out.u8(mask);
        for (IrOperand e : elements) {
            if (e instanceof IrNumber n && !n.value().isZero()) {
                NumberSpecCodec.encode(n.value(), out);
            }
        }
    }

    private void writeAddress(IrOperand op, IrInstruction ins, CodeWriter out, List<Relocation> relocations)
            throws EncodingException {
        if (op instanceof IrLabelRef ref) {
            relocations.add(new Relocation(out.position(), ref.targetKey(), ref.displayName(), ins.span()));
            out.u32(0);
        } else if (op instanceof IrAddress address) {
            out.u32(address.address());
        } else if (op instanceof IrError) {
            out.u32(0);
        } else {
            throw unexpected("a code address", op);
        }
    }

    private void writeExpression(IrOperand op, CodeWriter out) throws EncodingException {
        if (op instanceof IrExpr expr) {
            for (ExpressionTerm term : expr.terms()) {
                out.u8(term.op().code());
                if (term.op() == TermOp.PUSH) {
                    NumberSpecCodec.encode(term.operand(), out);
                }
            }
        } else if (!(op instanceof IrError)) {
            throw unexpected("an expression", op);
        }
        out.u8(TermOp.END_MARKER);
    }

    private void writeCondition(IrOperand op, CodeWriter out) throws EncodingException {
        if (op instanceof IrCondition c) {
            out.u8(c.condition().encode());
            NumberSpecCodec.encode(c.left(), out);
            NumberSpecCodec.encode(c.right(), out);
        } else if (op instanceof IrError) {
            out.u8(0);
            NumberSpecCodec.encode(NumberSpec.constant(0), out);
            NumberSpecCodec.encode(NumberSpec.constant(0), out);
        } else {
            throw unexpected("a condition", op);
        }
    }

    private static List<IrOperand> list(IrOperand op) throws EncodingException {
        if (op instanceof IrList list) {
            return list.elements();
        }
        if (op instanceof IrError) {
            return List.of();
        }
        throw unexpected("a list", op);
    }

    private static int count(List<IrOperand> elements, OperandKind kind) throws EncodingException {
        if (elements.size() > kind.maxElements()) {
            throw new EncodingException("Too many elements: " + elements.size() + ", at most " + kind.maxElements());
        }
        return elements.size();
    }

    private static EncodingException unexpected(String expected, IrOperand op) {
        return new EncodingException("Expected " + expected + ", found " + op.getClass().getSimpleName());
    }
}
