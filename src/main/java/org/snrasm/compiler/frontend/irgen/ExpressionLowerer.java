package org.snrasm.compiler.frontend.irgen;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.lexer.Literals;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.frontend.semantics.ConstValue;
import org.snrasm.compiler.frontend.semantics.ValueKind;
import org.snrasm.compiler.ir.IrCondition;
import org.snrasm.compiler.isa.ConditionType;
import org.snrasm.compiler.isa.ExpressionTerm;
import org.snrasm.compiler.isa.JumpCondition;
import org.snrasm.compiler.isa.NumberSpec;
import org.snrasm.compiler.isa.Register;
import org.snrasm.compiler.isa.TermOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.snrasm.compiler.frontend.semantics.ValueKind.INT;
import static org.snrasm.compiler.frontend.semantics.ValueKind.REAL;

/**
 * Lowers expression syntax into typed values, folding constant sub-trees with the
 * arithmetic of the VM.
 * <p>
 * Every method returns an empty optional when the expression is invalid. The error has
 * been reported by then, either here or by the {@link NameResolver}.
 */
public final class ExpressionLowerer {

    /**
     * Supplies the values of names and registers. Implementations report their own
     * errors and return empty for unresolvable references.
     */
    public interface NameResolver {
        Optional<ConstValue> constant(SyntaxNode nameRef);

        Optional<Register> register(SyntaxNode registerRef);
    }

    private final NameResolver resolver;
    private final DiagnosticsEngine diagnostics;

    public ExpressionLowerer(NameResolver resolver, DiagnosticsEngine diagnostics) {
        this.resolver = resolver;
        this.diagnostics = diagnostics;
    }

    /**
     * Lowers an operand that is encoded as a NumberSpec.
     * @param node The expression.
     * @return A constant or a plain register.
     */
    public Optional<NumberSpec> lowerNumberSpec(SyntaxNode node) {
        Optional<LoweredValue> value = lower(node);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.get() instanceof LoweredValue.Const c) {
            if (c.value() < NumberSpec.MIN_CONSTANT || c.value() > NumberSpec.MAX_CONSTANT) {
                diagnostics.reportError("NumberSpec constant value out of range: " + c.value(), node.significantSpan());
                return Optional.empty();
            }
            return Optional.of(NumberSpec.constant(c.value()));
        }
        List<ExpressionTerm> terms = value.get().terms();
        if (terms.size() == 1 && terms.get(0).op() == TermOp.PUSH) {
            return Optional.of(terms.get(0).operand());
        }
        diagnostics.reportError("Operand must be a constant or a register; compute the value with `exp` first",
                node.significantSpan());
        return Optional.empty();
    }

    /**
     * Lowers the source expression of {@code exp}.
     * @param node The expression.
     * @return The RPN terms, without the end marker.
     */
    public Optional<List<ExpressionTerm>> lowerExpression(SyntaxNode node) {
        return lower(node).map(LoweredValue::terms);
    }

    /**
     * Evaluates an expression that must be known at compile time.
     * @param node The expression.
     * @return The constant.
     */
    public Optional<ConstValue> evaluateConstant(SyntaxNode node) {
        Optional<LoweredValue> value = lower(node);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.get() instanceof LoweredValue.Const c) {
            return Optional.of(c.toConstValue());
        }
        diagnostics.reportError("Expression is not a compile-time constant", node.significantSpan());
        return Optional.empty();
    }

    /**
     * Lowers a {@code jc} condition: {@code L op R}, {@code L & R} or {@code bitset(L, R)},
     * optionally negated with {@code !( ... )}.
     * @param node The expression.
     * @return The condition.
     */
    public Optional<IrCondition> lowerCondition(SyntaxNode node) {
        SyntaxNode inner = unwrapParens(node);
        boolean negated = false;
        if (inner.kind() == SyntaxKind.PREFIX_EXPR && operator(inner).type() == TokenType.BANG) {
            negated = true;
            inner = unwrapParens(operand(inner));
        }
        ConditionType type = null;
        SyntaxNode left = null;
        SyntaxNode right = null;
        if (inner.kind() == SyntaxKind.BINARY_EXPR) {
            String op = operator(inner).text();
            type = ConditionType.fromOperator(op).filter(t -> t != ConditionType.BIT_SET).orElse(null);
            List<SyntaxNode> sides = inner.childNodes();
            left = sides.get(0);
            right = sides.size() > 1 ? sides.get(1) : null;
        } else if (inner.kind() == SyntaxKind.CALL_EXPR && calleeName(inner).equals("bitset")) {
            List<SyntaxNode> args = callArguments(inner);
            if (args.size() != 2) {
                diagnostics.reportError("`bitset` takes 2 arguments, found " + args.size(), inner.significantSpan());
                return Optional.empty();
            }
            type = ConditionType.BIT_SET;
            left = args.get(0);
            right = args.get(1);
        }
        if (inner.kind() == SyntaxKind.ERROR) {
            return Optional.empty();
        }
        if (type == null || right == null) {
            diagnostics.reportError("Expected a condition: `L op R`, `L & R` or `bitset(L, R)`", node.significantSpan());
            return Optional.empty();
        }
        Optional<NumberSpec> l = lowerNumberSpec(left);
        Optional<NumberSpec> r = lowerNumberSpec(right);
        if (l.isEmpty() || r.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new IrCondition(new JumpCondition(type, negated), l.get(), r.get()));
    }

    /**
     * Lowers an arbitrary expression into a typed value.
     * @param node The expression.
     * @return The value.
     */
    public Optional<LoweredValue> lower(SyntaxNode node) {
        return switch (node.kind()) {
            case LITERAL -> literal(node);
            case REGISTER_REF -> resolver.register(node)
                    .map(r -> new LoweredValue.Runtime(List.of(ExpressionTerm.push(NumberSpec.of(r))), INT));
            case NAME_REF -> resolver.constant(node).map(c -> new LoweredValue.Const(c.value(), c.kind()));
            case PAREN_EXPR -> node.childNodes().isEmpty() ? Optional.empty() : lower(node.childNodes().get(0));
            case PREFIX_EXPR -> prefix(node);
            case BINARY_EXPR -> binary(node);
            case CALL_EXPR -> call(node);
            case ERROR -> Optional.empty();
            default -> {
                diagnostics.reportError("Expected a number, found " + describe(node), node.significantSpan());
                yield Optional.empty();
            }
        };
    }

    private Optional<LoweredValue> literal(SyntaxNode node) {
        Token token = node.childTokens().get(0);
        long value;
        ValueKind kind;
        try {
            if (token.type() == TokenType.INT_NUMBER) {
                value = Literals.parseInteger(token.text());
                kind = INT;
            } else if (token.type() == TokenType.REAL_NUMBER) {
                value = Literals.parseReal(token.text());
                kind = REAL;
            } else {
                diagnostics.reportError("Expected a number, found a string", token.span());
                return Optional.empty();
            }
        } catch (NumberFormatException | ArithmeticException e) {
            diagnostics.reportError("Invalid number literal: `" + token.text() + "`", token.span());
            return Optional.empty();
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            diagnostics.reportError("Number literal out of range: `" + token.text() + "`", token.span());
            return Optional.empty();
        }
        return Optional.of(new LoweredValue.Const((int) value, kind));
    }

    private Optional<LoweredValue> prefix(SyntaxNode node) {
        Token op = operator(node);
        Optional<LoweredValue> operand = lower(operand(node));
        if (operand.isEmpty()) {
            return Optional.empty();
        }
        LoweredValue v = operand.get();
        return switch (op.type()) {
            case MINUS -> apply(TermOp.NEG, v.kind(), node, v);
            case BANG -> apply(TermOp.CMP_ZERO, INT, node, v);
            case TILDE -> requireInt(op, node, v) ? apply(TermOp.BIT_NOT, INT, node, v) : Optional.empty();
            default -> Optional.empty();
        };
    }

    private Optional<LoweredValue> binary(SyntaxNode node) {
        List<SyntaxNode> sides = node.childNodes();
        if (sides.size() < 2) {
            return Optional.empty();
        }
        Optional<LoweredValue> left = lower(sides.get(0));
        Optional<LoweredValue> right = lower(sides.get(1));
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        Token op = operator(node);
        LoweredValue l = left.get();
        LoweredValue r = right.get();
        return switch (op.type()) {
            case PLUS -> promoted(TermOp.ADD, node, l, r, false);
            case MINUS -> promoted(TermOp.SUB, node, l, r, false);
            case IDENTIFIER -> divisor(TermOp.MOD, node, r) ? promoted(TermOp.MOD, node, l, r, false) : Optional.empty();
            case EQUAL_EQUAL -> promoted(TermOp.CMP_EQ, node, l, r, true);
            case BANG_EQUAL -> promoted(TermOp.CMP_NE, node, l, r, true);
            case GREATER_EQUAL -> promoted(TermOp.CMP_GE, node, l, r, true);
            case GREATER -> promoted(TermOp.CMP_GT, node, l, r, true);
            case LESS_EQUAL -> promoted(TermOp.CMP_LE, node, l, r, true);
            case LESS -> promoted(TermOp.CMP_LT, node, l, r, true);
            case STAR -> multiply(node, l, r);
            case SLASH -> divide(node, l, r);
            case DOT_STAR, DOT_SLASH -> {
                if (l.kind() != r.kind()) {
                    diagnostics.reportError("Operands of `" + op.text() + "` must have the same type, found "
                            + l.kind().describe() + " and " + r.kind().describe(), node.significantSpan());
                    yield Optional.empty();
                }
                TermOp termOp = op.type() == TokenType.DOT_STAR ? TermOp.MUL_REAL : TermOp.DIV_REAL;
                if (termOp == TermOp.DIV_REAL && !divisor(termOp, node, r)) {
                    yield Optional.empty();
                }
                yield apply(termOp, l.kind(), node, l, r);
            }
            case AMP, PIPE, CARET, SHIFT_LEFT, SHIFT_RIGHT -> {
                if (!requireInt(op, node, l) || !requireInt(op, node, r)) {
                    yield Optional.empty();
                }
                TermOp termOp = switch (op.type()) {
                    case AMP -> TermOp.BIT_AND;
                    case PIPE -> TermOp.BIT_OR;
                    case CARET -> TermOp.BIT_XOR;
                    case SHIFT_LEFT -> TermOp.SHL;
                    default -> TermOp.SHR;
                };
                yield apply(termOp, INT, node, l, r);
            }
            case AMP_AMP -> apply(TermOp.LOGICAL_AND, INT, node, l, r);
            case PIPE_PIPE -> apply(TermOp.LOGICAL_OR, INT, node, l, r);
            default -> Optional.empty();
        };
    }

    private Optional<LoweredValue> multiply(SyntaxNode node, LoweredValue l, LoweredValue r) {
        if (l.kind() == REAL && r.kind() == REAL) {
            return apply(TermOp.MUL_REAL, REAL, node, l, r);
        }
        ValueKind kind = l.kind() == INT && r.kind() == INT ? INT : REAL;
        return apply(TermOp.MUL, kind, node, l, r);
    }

    private Optional<LoweredValue> divide(SyntaxNode node, LoweredValue l, LoweredValue r) {
        if (l.kind() == REAL && r.kind() == INT) {
            return divisor(TermOp.DIV, node, r) ? apply(TermOp.DIV, REAL, node, l, r) : Optional.empty();
        }
        if (!divisor(TermOp.DIV_REAL, node, r)) {
            return Optional.empty();
        }
        if (l.kind() == INT && r.kind() == REAL) {
            Optional<LoweredValue> scaled = toReal(l, node);
            return scaled.flatMap(s -> apply(TermOp.DIV_REAL, REAL, node, s, r));
        }
        return apply(TermOp.DIV_REAL, REAL, node, l, r);
    }

    private Optional<LoweredValue> promoted(TermOp op, SyntaxNode node, LoweredValue l, LoweredValue r, boolean comparison) {
        if (l.kind() == r.kind()) {
            return apply(op, comparison ? INT : l.kind(), node, l, r);
        }
        Optional<LoweredValue> pl = toReal(l, node);
        Optional<LoweredValue> pr = toReal(r, node);
        if (pl.isEmpty() || pr.isEmpty()) {
            return Optional.empty();
        }
        return apply(op, comparison ? INT : REAL, node, pl.get(), pr.get());
    }

    private Optional<LoweredValue> call(SyntaxNode node) {
        String name = calleeName(node);
        List<SyntaxNode> argNodes = callArguments(node);
        int expected = switch (name) {
            case "abs", "bool", "real", "int", "raw", "sin", "cos", "tan" -> 1;
            case "min", "max", "idiv" -> 2;
            case "select" -> 3;
            case "bitset" -> {
                diagnostics.reportError("`bitset` is only valid in `jc` conditions", node.significantSpan());
                yield -1;
            }
            default -> {
                diagnostics.reportError("Unknown function `" + name + "`", node.significantSpan());
                yield -1;
            }
        };
        if (expected < 0) {
            return Optional.empty();
        }
        if (argNodes.size() != expected) {
            diagnostics.reportError("`" + name + "` takes " + expected + (expected == 1 ? " argument" : " arguments")
                    + ", found " + argNodes.size(), node.significantSpan());
            return Optional.empty();
        }
        List<LoweredValue> args = new ArrayList<>();
        for (SyntaxNode argNode : argNodes) {
            Optional<LoweredValue> arg = lower(argNode);
            if (arg.isEmpty()) {
                return Optional.empty();
            }
            args.add(arg.get());
        }
        LoweredValue a = args.get(0);
        return switch (name) {
            case "abs" -> apply(TermOp.ABS, a.kind(), node, a);
            case "bool" -> apply(TermOp.CMP_NOT_ZERO, INT, node, a);
            case "min" -> promoted(TermOp.MIN, node, a, args.get(1), false);
            case "max" -> promoted(TermOp.MAX, node, a, args.get(1), false);
            case "idiv" -> {
                LoweredValue b = args.get(1);
                if (a.kind() == INT && b.kind() == REAL) {
                    diagnostics.reportError("`idiv` cannot divide an integer by a real", node.significantSpan());
                    yield Optional.empty();
                }
                if (!divisor(TermOp.DIV, node, b)) {
                    yield Optional.empty();
                }
                yield apply(TermOp.DIV, b.kind() == REAL ? INT : a.kind(), node, a, b);
            }
            case "select" -> {
                if (args.get(1).kind() == args.get(2).kind()) {
                    yield apply(TermOp.SELECT, args.get(1).kind(), node, args.get(2), args.get(1), a);
                }
                Optional<LoweredValue> t = toReal(args.get(1), node);
                Optional<LoweredValue> f = toReal(args.get(2), node);
                if (t.isEmpty() || f.isEmpty()) {
                    yield Optional.empty();
                }
                yield apply(TermOp.SELECT, REAL, node, f.get(), t.get(), a);
            }
            case "real" -> {
                if (a.kind() != INT) {
                    diagnostics.reportError("`real` expects an integer argument", node.significantSpan());
                    yield Optional.empty();
                }
                yield toReal(a, node);
            }
            case "int" -> {
                if (a.kind() != REAL) {
                    diagnostics.reportError("`int` expects a real argument", node.significantSpan());
                    yield Optional.empty();
                }
                yield apply(TermOp.DIV, INT, node, a, new LoweredValue.Const(Literals.REAL_SCALE, INT));
            }
            case "raw" -> Optional.of(a instanceof LoweredValue.Const c
                    ? new LoweredValue.Const(c.value(), INT)
                    : new LoweredValue.Runtime(a.terms(), INT));
            case "sin" -> apply(TermOp.SIN, REAL, node, a);
            case "cos" -> apply(TermOp.COS, REAL, node, a);
            default -> apply(TermOp.TAN, REAL, node, a);
        };
    }

    private Optional<LoweredValue> toReal(LoweredValue value, SyntaxNode at) {
        if (value.kind() == REAL) {
            return Optional.of(value);
        }
        return apply(TermOp.MUL, REAL, at, value, new LoweredValue.Const(Literals.REAL_SCALE, INT));
    }

    /**
     * Folds the operation when every argument is constant, otherwise emits it.
     * @param args The operands in push order.
     */
    private Optional<LoweredValue> apply(TermOp op, ValueKind kind, SyntaxNode at, LoweredValue... args) {
        boolean constant = op.isFoldable();
        for (LoweredValue arg : args) {
            constant &= arg instanceof LoweredValue.Const;
        }
        if (constant) {
            int[] values = new int[args.length];
            for (int i = 0; i < args.length; i++) {
                values[i] = ((LoweredValue.Const) args[i]).value();
            }
            try {
                return Optional.of(new LoweredValue.Const(op.apply(values), kind));
            } catch (ArithmeticException e) {
                diagnostics.reportError(e.getMessage(), at.significantSpan());
                return Optional.empty();
            }
        }
        List<ExpressionTerm> terms = new ArrayList<>();
        for (LoweredValue arg : args) {
            terms.addAll(arg.terms());
        }
        terms.add(ExpressionTerm.of(op));
        return Optional.of(new LoweredValue.Runtime(terms, kind));
    }

    private boolean divisor(TermOp op, SyntaxNode at, LoweredValue divisor) {
        if (divisor instanceof LoweredValue.Const c && c.value() == 0) {
            diagnostics.reportError(op == TermOp.MOD ? "Modulo by zero" : "Division by zero", at.significantSpan());
            return false;
        }
        return true;
    }

    private boolean requireInt(Token op, SyntaxNode at, LoweredValue value) {
        if (value.kind() != INT) {
            diagnostics.reportError("Type mismatch: `" + op.text() + "` requires integer operands, found a real",
                    at.significantSpan());
            return false;
        }
        return true;
    }

    private static SyntaxNode unwrapParens(SyntaxNode node) {
        SyntaxNode current = node;
        while (current.kind() == SyntaxKind.PAREN_EXPR && !current.childNodes().isEmpty()) {
            current = current.childNodes().get(0);
        }
        return current;
    }

    private static Token operator(SyntaxNode node) {
        List<Token> tokens = node.childTokens();
        return tokens.isEmpty() ? new Token(TokenType.ERROR, "", node.span().start()) : tokens.get(0);
    }

    private static SyntaxNode operand(SyntaxNode prefix) {
        List<SyntaxNode> nodes = prefix.childNodes();
        return nodes.isEmpty() ? new SyntaxNode(SyntaxKind.ERROR, List.of(), prefix.span().end()) : nodes.get(0);
    }

    static String calleeName(SyntaxNode call) {
        return call.childTokens().get(0).text();
    }

    static List<SyntaxNode> callArguments(SyntaxNode call) {
        return call.firstChild(SyntaxKind.ARGUMENT_LIST).map(SyntaxNode::childNodes).orElse(List.of());
    }

    private static String describe(SyntaxNode node) {
        return switch (node.kind()) {
            case MAPPING_EXPR -> "a mapping";
            case ARRAY_EXPR -> "an array";
            case LITERAL -> "a string";
            default -> node.kind().name().toLowerCase();
        };
    }
}
