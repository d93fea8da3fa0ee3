package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.isa.Field;
import org.snrasm.compiler.isa.InstructionDef;
import org.snrasm.compiler.isa.Shape;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Assigns the source operands of an instruction to its positional fields.
 *
 * @param field    The field.
 * @param index    The index of the field among the positional fields.
 * @param elements The bound syntax: one node for scalar fields, the elements for list fields.
 */
public record OperandBinding(Field field, int index, List<SyntaxNode> elements) {

    public OperandBinding {
        elements = List.copyOf(elements);
    }

    public SyntaxNode node() {
        return elements.get(0);
    }

    /**
     * Binds operands to fields. For {@link Shape#UNARY} and {@link Shape#BINARY} the optional
     * middle operand is left unbound when omitted. A trailing list takes all remaining operands,
     * or the elements of a single array operand.
     *
     * @param definition The instruction.
     * @param operands   The source operands, flags excluded.
     * @return The bindings, or empty if the operand count does not fit the instruction.
     */
    public static Optional<List<OperandBinding>> bind(InstructionDef definition, List<SyntaxNode> operands) {
        int n = operands.size();
        if (n < definition.minArity() || n > definition.maxArity()) {
            return Optional.empty();
        }
        List<Field> fields = definition.positionalFields();
        List<OperandBinding> result = new ArrayList<>();
        if (definition.shape() != Shape.PLAIN) {
            // dest, [source/left], right
            result.add(new OperandBinding(fields.get(0), 0, List.of(operands.get(0))));
            if (n == fields.size()) {
                for (int i = 1; i < n; i++) {
                    result.add(new OperandBinding(fields.get(i), i, List.of(operands.get(i))));
                }
            } else if (n == fields.size() - 1 && definition.shape() == Shape.BINARY) {
                result.add(new OperandBinding(fields.get(2), 2, List.of(operands.get(1))));
            }
            return Optional.of(result);
        }
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            if (field.kind().isTrailingList()) {
                List<SyntaxNode> rest = i < n ? operands.subList(i, n) : List.of();
                if (rest.size() == 1 && rest.get(0).kind() == SyntaxKind.ARRAY_EXPR) {
                    rest = rest.get(0).childNodes();
                }
                result.add(new OperandBinding(field, i, rest));
            } else if (i < n) {
                result.add(new OperandBinding(field, i, List.of(operands.get(i))));
            }
        }
        return Optional.of(result);
    }

    /**
     * Describes the accepted operand count for diagnostics.
     * @param definition The instruction.
     * @return E.g. {@code "2 or 3 operands"}.
     */
    public static String describeArity(InstructionDef definition) {
        int min = definition.minArity();
        int max = definition.maxArity();
        if (max == Integer.MAX_VALUE) {
            return "at least " + plural(min);
        }
        if (min == max) {
            return plural(min);
        }
        if (max == min + 1) {
            return min + " or " + plural(max);
        }
        return min + " to " + plural(max);
    }

    private static String plural(int n) {
        return n + (n == 1 ? " operand" : " operands");
    }
}
