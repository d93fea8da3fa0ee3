package org.snrasm.compiler.disasm;

import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.ir.IrAddress;
import org.snrasm.compiler.ir.IrCondition;
import org.snrasm.compiler.ir.IrExpr;
import org.snrasm.compiler.ir.IrImm;
import org.snrasm.compiler.ir.IrInstruction;
import org.snrasm.compiler.ir.IrList;
import org.snrasm.compiler.ir.IrNumber;
import org.snrasm.compiler.ir.IrOperand;
import org.snrasm.compiler.ir.IrReg;
import org.snrasm.compiler.ir.IrString;
import org.snrasm.compiler.isa.CodeReader;
import org.snrasm.compiler.isa.DecodingException;
import org.snrasm.compiler.isa.ExpressionTerm;
import org.snrasm.compiler.isa.Field;
import org.snrasm.compiler.isa.IInstructionSet;
import org.snrasm.compiler.isa.InstructionDef;
import org.snrasm.compiler.isa.InstructionFlag;
import org.snrasm.compiler.isa.JumpCondition;
import org.snrasm.compiler.isa.NumberSpec;
import org.snrasm.compiler.isa.NumberSpecCodec;
import org.snrasm.compiler.isa.OperandKind;
import org.snrasm.compiler.isa.Register;
import org.snrasm.compiler.isa.Shape;
import org.snrasm.compiler.isa.TermOp;
import org.snrasm.compiler.isa.TextCodec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads instructions from a code block into IR.
 * <p>
 * Decoding is strict: every accepted instruction must be the only encoding the assembler
 * produces for its text. Anything else is rejected with a {@link DecodingException}, since
 * printing it would not reassemble to the same bytes.
 */
public final class InstructionDecoder {

    private static final int PAD = 4;

    private final IInstructionSet isa;
    private final TextCodec text;

    public InstructionDecoder(IInstructionSet isa, TextCodec text) {
        this.isa = isa;
        this.text = text;
    }

    /**
     * Decodes the instruction at the reader's position.
     *
     * @param in          The reader, left after the instruction.
     * @param baseAddress The address of the first byte of the block.
     * @return The decoded instruction.
     * @throws DecodingException If the bytes are unknown, truncated or not canonical.
     */
    public DecodedInstruction decode(CodeReader in, long baseAddress) throws DecodingException {
        int start = in.position();
        int opcode = in.u8();
        int typeByte = isa.hasSubtype(opcode) ? in.u8() : -1;
        InstructionDef def = isa.byOpcode(opcode, typeByte & 0x7F)
                .orElseThrow(() -> new DecodingException(typeByte < 0
                        ? String.format("Unknown opcode 0x%02x", opcode)
                        : String.format("Unknown operation type 0x%02x for opcode 0x%02x", typeByte & 0x7F, opcode), start));

        List<IrOperand> operands = new ArrayList<>();
        Set<InstructionFlag> flags = EnumSet.noneOf(InstructionFlag.class);
        if (def.shape() != Shape.PLAIN) {
            boolean explicit = (typeByte & 0x80) != 0;
            operands.add(register(in));
            if (explicit) {
                operands.add(number(in));
            }
            if (def.shape() == Shape.BINARY) {
                operands.add(number(in));
            }
        } else {
            for (Field field : def.fields()) {
                if (!field.isPositional()) {
                    boolean set = bool(in) == 1;
                    if (set != field.inverted()) {
                        flags.add(field.flag());
                    }
                    continue;
                }
                operands.add(field(field.kind(), in));
            }
        }
        int size = in.position() - start;
        IrInstruction ins = new IrInstruction(def, operands, flags, new Span(start, start + size));
        return new DecodedInstruction(baseAddress + start, size, ins);
    }

    private IrOperand field(OperandKind kind, CodeReader in) throws DecodingException {
        return switch (kind) {
            case REGISTER -> register(in);
            case NUMBER -> number(in);
            case U8 -> new IrImm(in.u8());
            case U16 -> new IrImm(in.u16());
            case BOOL -> new IrImm(bool(in));
            case MESSAGE_ID -> new IrImm(in.u24());
            case STRING -> string(in, false);
            case FIXUP_STRING -> string(in, true);
            case STRING_ARRAY -> stringArray(in);
            case NUMBER_LIST -> {
                int count = in.u8();
                List<IrOperand> elements = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    elements.add(number(in));
                }
                yield new IrList(elements);
            }
            case REGISTER_LIST -> {
                int count = in.u8();
                List<IrOperand> elements = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    elements.add(register(in));
                }
                yield new IrList(elements);
            }
            case BITMASK -> bitmask(in);
            case CODE_ADDRESS -> new IrAddress(in.u32());
            case EXPRESSION -> expression(in);
            case CONDITION -> {
                int at = in.position();
                JumpCondition condition = JumpCondition.decode(in.u8(), at);
                yield new IrCondition(condition, NumberSpecCodec.decode(in), NumberSpecCodec.decode(in));
            }
            case NUMBER_TABLE -> numberTable(in);
            case ADDRESS_TABLE -> {
                int count = in.u16();
                List<IrOperand> elements = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    elements.add(new IrAddress(in.u32()));
                }
                yield new IrList(elements);
            }
        };
    }

    private IrOperand register(CodeReader in) throws DecodingException {
        int at = in.position();
        int id = in.u16();
        if (id > Register.ARGUMENTS_START + Register.MAX_INDEX) {
            throw new DecodingException(String.format("Register id 0x%04x out of range", id), at);
        }
        return new IrReg(new Register(id));
    }

    private IrOperand number(CodeReader in) throws DecodingException {
        return new IrNumber(NumberSpecCodec.decode(in));
    }

    private int bool(CodeReader in) throws DecodingException {
        int at = in.position();
        int value = in.u8();
        if (value > 1) {
            throw new DecodingException("Boolean byte must be 0 or 1, found " + value, at);
        }
        return value;
    }

    private IrOperand string(CodeReader in, boolean fixup) throws DecodingException {
        int at = in.position();
        int length = in.u16();
        if (length == 0) {
            throw new DecodingException("String length must include the terminator", at);
        }
        byte[] bytes = in.bytes(length - 1);
        for (byte b : bytes) {
            if (b == 0) {
                throw new DecodingException("String contains a NUL before its end", at);
            }
        }
        if (in.u8() != 0) {
            throw new DecodingException("String is not NUL-terminated", at);
        }
        return new IrString(fixup ? text.decodeFixup(bytes, at) : text.decode(bytes, at));
    }

    private IrOperand stringArray(CodeReader in) throws DecodingException {
        int at = in.position();
        int size = in.u16();
        int start = in.position();
        List<IrOperand> elements = new ArrayList<>();
        while (true) {
            int elementAt = in.position();
            byte[] bytes = in.untilNul();
            if (bytes.length == 0) {
                break;
            }
            elements.add(new IrString(text.decode(bytes, elementAt)));
        }
        if (in.position() - start != size) {
            throw new DecodingException("String array size " + size + " does not match its contents ("
                    + (in.position() - start) + " bytes)", at);
        }
        return new IrList(elements);
    }

    private IrOperand bitmask(CodeReader in) throws DecodingException {
        int mask = in.u8();
        int highest = 31 - Integer.numberOfLeadingZeros(mask);
        List<IrOperand> elements = new ArrayList<>();
        for (int i = 0; i <= highest; i++) {
            if ((mask & (1 << i)) == 0) {
                elements.add(new IrNumber(NumberSpec.constant(0)));
                continue;
            }
            int at = in.position();
            NumberSpec spec = NumberSpecCodec.decode(in);
            if (spec.isZero()) {
                throw new DecodingException("Bitmask entry " + i + " is an explicit zero", at);
            }
            elements.add(new IrNumber(spec));
        }
        return new IrList(elements);
    }

    private IrOperand numberTable(CodeReader in) throws DecodingException {
        int count = in.u16();
        List<IrOperand> elements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int start = in.position();
            elements.add(number(in));
            while (in.position() - start < PAD) {
                int at = in.position();
                if (in.u8() != 0) {
                    throw new DecodingException("Table padding must be zero", at);
                }
            }
        }
        return new IrList(elements);
    }

    /**
     * Reads RPN terms up to the end marker and checks that the expression is printable:
     * a single result, no constant sub-expression the assembler would fold, and no
     * division by a constant zero.
     */
    private IrOperand expression(CodeReader in) throws DecodingException {
        int start = in.position();
        List<ExpressionTerm> terms = new ArrayList<>();
        Deque<Optional<Integer>> stack = new ArrayDeque<>();
        while (true) {
            int at = in.position();
            int code = in.u8();
            if (code == TermOp.END_MARKER) {
                break;
            }
            TermOp op = TermOp.fromCode(code)
                    .orElseThrow(() -> new DecodingException(String.format("Unknown expression operation 0x%02x", code), at));
            if (op == TermOp.PUSH) {
                NumberSpec value = NumberSpecCodec.decode(in);
                terms.add(ExpressionTerm.push(value));
                stack.push(value instanceof NumberSpec.Constant c ? Optional.of(c.value()) : Optional.empty());
                continue;
            }
            if (stack.size() < op.arity()) {
                throw new DecodingException("Expression stack underflow at `" + op.name().toLowerCase() + "`", at);
            }
            boolean allConstant = true;
            Optional<Integer> last = Optional.empty();
            for (int i = 0; i < op.arity(); i++) {
                Optional<Integer> arg = stack.pop();
                if (i == 0) {
                    last = arg;
                }
                allConstant &= arg.isPresent();
            }
            if (op.isFoldable() && allConstant) {
                throw new DecodingException("Expression contains a constant sub-expression that the assembler would fold", at);
            }
            boolean divides = op == TermOp.DIV || op == TermOp.MOD || op == TermOp.DIV_REAL;
            if (divides && last.isPresent() && last.get() == 0) {
                throw new DecodingException("Expression divides by a constant zero", at);
            }
            terms.add(ExpressionTerm.of(op));
            stack.push(Optional.empty());
        }
        if (stack.size() != 1) {
            throw new DecodingException("Expression must leave exactly one value, leaves " + stack.size(), start);
        }
        return new IrExpr(terms);
    }
}
