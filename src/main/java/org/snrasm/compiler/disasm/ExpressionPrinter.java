package org.snrasm.compiler.disasm;

import org.snrasm.compiler.ir.IrCondition;
import org.snrasm.compiler.isa.ConditionType;
import org.snrasm.compiler.isa.ExpressionTerm;
import org.snrasm.compiler.isa.NumberSpec;
import org.snrasm.compiler.isa.TermOp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Prints RPN expressions as infix source in the integer-only dialect: every value is
 * treated as an integer, so each printed operator lowers to exactly the operation it came
 * from ({@code idiv} for {@code Div}, {@code .*} for {@code MulReal}, {@code raw(sin(x))}
 * for {@code Sin}).
 */
public final class ExpressionPrinter {

    private static final int PREFIX = 12;
    private static final int ATOM = 13;

    private sealed interface Node permits Leaf, Op {}

    private record Leaf(NumberSpec value) implements Node {}

    private record Op(TermOp op, List<Node> args) implements Node {}

    /**
     * Prints a NumberSpec operand.
     * @param value The value.
     * @return A decimal literal or a register name.
     */
    public static String number(NumberSpec value) {
        return value.toString();
    }

    /**
     * Prints a {@code jc} condition.
     * @param condition The condition.
     * @return {@code L op R}, {@code bitset(L, R)}, or either wrapped in {@code !( ... )}.
     */
    public static String condition(IrCondition condition) {
        ConditionType type = condition.condition().type();
        String l = number(condition.left());
        String r = number(condition.right());
        String body = type == ConditionType.BIT_SET
                ? "bitset(" + l + ", " + r + ")"
                : l + " " + type.operator() + " " + r;
        return condition.condition().negated() ? "!(" + body + ")" : body;
    }

    /**
     * Prints the terms of an {@code exp} instruction.
     * @param terms Terms that leave exactly one value on the stack.
     * @return The infix expression.
     * @throws IllegalArgumentException If the terms are not a well-formed expression.
     */
    public static String expression(List<ExpressionTerm> terms) {
        Deque<Node> stack = new ArrayDeque<>();
        for (ExpressionTerm term : terms) {
            if (term.op() == TermOp.PUSH) {
                stack.push(new Leaf(term.operand()));
                continue;
            }
            int arity = term.op().arity();
            if (stack.size() < arity) {
                throw new IllegalArgumentException("Expression stack underflow at " + term);
            }
            Node[] args = new Node[arity];
            for (int i = arity - 1; i >= 0; i--) {
                args[i] = stack.pop();
            }
            stack.push(new Op(term.op(), List.of(args)));
        }
        if (stack.size() != 1) {
            throw new IllegalArgumentException("Expression leaves " + stack.size() + " values");
        }
        return print(stack.pop());
    }

    private static String print(Node node) {
        if (node instanceof Leaf leaf) {
            return number(leaf.value());
        }
        Op op = (Op) node;
        List<Node> a = op.args();
        return switch (op.op()) {
            case NEG -> "-" + operand(a.get(0), PREFIX);
            case BIT_NOT -> "~" + operand(a.get(0), PREFIX);
            case CMP_ZERO -> "!" + operand(a.get(0), PREFIX);
            case CMP_NOT_ZERO -> call("bool", a);
            case ABS -> call("abs", a);
            case MIN -> call("min", a);
            case MAX -> call("max", a);
            case DIV -> call("idiv", a);
            // pushed as false, true, condition
            case SELECT -> call("select", List.of(a.get(2), a.get(1), a.get(0)));
            case SIN -> "raw(" + call("sin", a) + ")";
            case COS -> "raw(" + call("cos", a) + ")";
            case TAN -> "raw(" + call("tan", a) + ")";
            default -> {
                int power = bindingPower(op.op());
                yield operand(a.get(0), power) + " " + symbol(op.op()) + " " + operand(a.get(1), power + 1);
            }
        };
    }

    private static String operand(Node node, int minPower) {
        String text = print(node);
        return precedence(node) < minPower ? "(" + text + ")" : text;
    }

    private static String call(String name, List<Node> args) {
        List<String> printed = new ArrayList<>(args.size());
        for (Node arg : args) {
            printed.add(print(arg));
        }
        return name + "(" + String.join(", ", printed) + ")";
    }

    private static int precedence(Node node) {
        if (node instanceof Leaf leaf) {
            return leaf.value() instanceof NumberSpec.Constant c && c.value() < 0 ? PREFIX : ATOM;
        }
        return switch (((Op) node).op()) {
            case NEG, BIT_NOT, CMP_ZERO -> PREFIX;
            case CMP_NOT_ZERO, ABS, MIN, MAX, DIV, SELECT, SIN, COS, TAN -> ATOM;
            default -> bindingPower(((Op) node).op());
        };
    }

    private static int bindingPower(TermOp op) {
        return switch (op) {
            case LOGICAL_OR -> 3;
            case LOGICAL_AND -> 4;
            case CMP_EQ, CMP_NE, CMP_GE, CMP_GT, CMP_LE, CMP_LT -> 5;
            case BIT_OR -> 6;
            case BIT_XOR -> 7;
            case BIT_AND -> 8;
            case SHL, SHR -> 9;
            case ADD, SUB -> 10;
            case MUL, MOD, MUL_REAL, DIV_REAL -> 11;
            default -> throw new IllegalArgumentException("Not an infix operation: " + op);
        };
    }

    private static String symbol(TermOp op) {
        return switch (op) {
            case LOGICAL_OR -> "||";
            case LOGICAL_AND -> "&&";
            case CMP_EQ -> "==";
            case CMP_NE -> "!=";
            case CMP_GE -> ">=";
            case CMP_GT -> ">";
            case CMP_LE -> "<=";
            case CMP_LT -> "<";
            case BIT_OR -> "|";
            case BIT_XOR -> "^";
            case BIT_AND -> "&";
            case SHL -> "<<";
            case SHR -> ">>";
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case MOD -> "mod";
            case MUL_REAL -> ".*";
            case DIV_REAL -> "./";
            default -> throw new IllegalArgumentException("Not an infix operation: " + op);
        };
    }

    private ExpressionPrinter() {
    }
}
