package org.snrasm.compiler.isa;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Static description of a mnemonic: its opcode, operation subtype and field layout.
 *
 * @param mnemonic The canonical spelling: lower-case for VM instructions, upper-case for commands.
 * @param opcode   The opcode byte.
 * @param subtype  The operation type for {@code uo}/{@code bo} mnemonics, -1 otherwise.
 * @param shape    How fields follow the opcode.
 * @param fields   The encoded fields in order.
 */
public record InstructionDef(String mnemonic, int opcode, int subtype, Shape shape, List<Field> fields) {

    public InstructionDef {
        fields = List.copyOf(fields);
    }

    /**
     * @return The kinds of the operands written in source, in order.
     */
    public List<OperandKind> operandKinds() {
        return fields.stream().filter(Field::isPositional).map(Field::kind).toList();
    }

    public List<Field> positionalFields() {
        return fields.stream().filter(Field::isPositional).toList();
    }

    public Set<InstructionFlag> allowedFlags() {
        EnumSet<InstructionFlag> flags = EnumSet.noneOf(InstructionFlag.class);
        fields.stream().filter(f -> !f.isPositional()).forEach(f -> flags.add(f.flag()));
        return flags;
    }

    /**
     * @return The fewest source arguments the mnemonic accepts.
     */
    public int minArity() {
        int min = 0;
        for (Field f : positionalFields()) {
            if (f.defaultValue() == null && !f.kind().isTrailingList()) {
                min++;
            }
        }
        if (shape != Shape.PLAIN) {
            min--;
        }
        return min;
    }

    /**
     * @return The most source arguments, or {@link Integer#MAX_VALUE} if a trailing list is present.
     */
    public int maxArity() {
        List<OperandKind> kinds = operandKinds();
        if (!kinds.isEmpty() && kinds.get(kinds.size() - 1).isTrailingList()) {
            return Integer.MAX_VALUE;
        }
        return kinds.size();
    }

    public boolean isCommand() {
        return opcode == 0x00 || opcode >= 0x80;
    }

    /**
     * @return {@code true} if execution never continues with the next instruction.
     */
    public boolean neverFallsThrough() {
        return mnemonic.equals("j") || mnemonic.equals("return") || mnemonic.equals("retsub");
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
