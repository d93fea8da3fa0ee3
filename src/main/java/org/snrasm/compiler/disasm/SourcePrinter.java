package org.snrasm.compiler.disasm;

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
import org.snrasm.compiler.isa.Field;
import org.snrasm.compiler.isa.InstructionDef;
import org.snrasm.compiler.isa.InstructionFlag;
import org.snrasm.compiler.isa.NumberSpec;
import org.snrasm.compiler.isa.Shape;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongFunction;

/**
 * Prints decoded instructions in canonical form: mnemonic, a space, operands separated by
 * {@code ", "}, flags last. Trailing operands equal to their default are left out.
 */
final class SourcePrinter {

    static final String INDENT = "    ";

    private final LongFunction<String> names;

    /**
     * @param names Gives the name a code address is printed as.
     */
    SourcePrinter(LongFunction<String> names) {
        this.names = names;
    }

    String print(IrInstruction ins) {
        InstructionDef def = ins.definition();
        List<String> parts = new ArrayList<>();
        if (def.shape() != Shape.PLAIN) {
            for (IrOperand op : ins.operands()) {
                parts.add(operand(op));
            }
        } else {
            List<Field> fields = def.positionalFields();
            int count = ins.operands().size();
            while (count > 0 && isDefault(fields.get(count - 1), ins.operands().get(count - 1))) {
                count--;
            }
            for (int i = 0; i < count; i++) {
                IrOperand op = ins.operands().get(i);
                if (fields.get(i).kind().isTrailingList() && op instanceof IrList list) {
                    list.elements().forEach(e -> parts.add(operand(e)));
                } else {
                    parts.add(operand(op));
                }
            }
        }
        for (Field field : def.fields()) {
            InstructionFlag flag = field.flag();
            if (flag != null && ins.flags().contains(flag)) {
                parts.add(flag.sourceName());
            }
        }
        return parts.isEmpty() ? def.mnemonic() : def.mnemonic() + " " + String.join(", ", parts);
    }

    private String operand(IrOperand op) {
        if (op instanceof IrReg r) {
            return r.register().toString();
        } else if (op instanceof IrNumber n) {
            return ExpressionPrinter.number(n.value());
        } else if (op instanceof IrImm imm) {
            return Long.toString(imm.value());
        } else if (op instanceof IrString s) {
            return quote(s.value());
        } else if (op instanceof IrAddress a) {
            return names.apply(a.address());
        } else if (op instanceof IrExpr expr) {
            return ExpressionPrinter.expression(expr.terms());
        } else if (op instanceof IrCondition c) {
            return ExpressionPrinter.condition(c);
        } else if (op instanceof IrList list) {
            return table(list);
        }
        throw new IllegalArgumentException("Cannot print operand " + op);
    }

    /** Only address tables are printed as lists; other lists are spread into operands. */
    private String table(IrList list) {
        List<String> entries = new ArrayList<>();
        for (int key = 0; key < list.elements().size(); key++) {
            entries.add(key + " => " + operand(list.elements().get(key)));
        }
        return "{" + String.join(", ", entries) + "}";
    }

    private static boolean isDefault(Field field, IrOperand op) {
        if (field.defaultValue() == null) {
            return false;
        }
        int value = field.defaultValue();
        if (op instanceof IrNumber n) {
            return n.value().equals(NumberSpec.constant(value));
        }
        return op instanceof IrImm imm && imm.value() == value;
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
