package org.snrasm.compiler.frontend.semantics.analysis;

import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;
import org.snrasm.compiler.frontend.parser.ast.AstNode;
import org.snrasm.compiler.frontend.parser.ast.InstructionNode;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.frontend.semantics.ConstValue;
import org.snrasm.compiler.frontend.semantics.JumpTableEntry;
import org.snrasm.compiler.frontend.semantics.OperandBinding;
import org.snrasm.compiler.frontend.semantics.Resolution;
import org.snrasm.compiler.frontend.semantics.RoutineInfo;
import org.snrasm.compiler.frontend.semantics.Symbol;
import org.snrasm.compiler.frontend.semantics.SymbolTable;
import org.snrasm.compiler.isa.InstructionDef;
import org.snrasm.compiler.isa.InstructionFlag;
import org.snrasm.compiler.isa.OperandKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Handles the semantic analysis of {@link InstructionNode}s.
 * This involves checking the mnemonic, the operand count and the flags, and resolving every
 * name and register the operands refer to according to the operand kind they occupy.
 */
public class InstructionAnalysisHandler implements IAnalysisHandler {

    /** The largest {@code jt} case value; the table length must fit into a u16. */
    public static final int MAX_JUMP_TABLE_KEY = 0xFFFE;

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (!(node instanceof InstructionNode instruction)) {
            return;
        }
        DiagnosticsEngine diagnostics = context.diagnostics();
        Token mnemonic = instruction.mnemonic();
        Optional<InstructionDef> lookup = context.instructionSet().byMnemonic(mnemonic.text());
        if (lookup.isEmpty()) {
            diagnostics.reportError("Unknown instruction `" + mnemonic.text() + "`", mnemonic.span());
            return;
        }
        InstructionDef definition = lookup.get();
        boolean valid = checkFlags(instruction, definition, diagnostics);
        valid &= checkPlacement(mnemonic, definition, context);

        List<SyntaxNode> operands = instruction.operands();
        if (operands.stream().anyMatch(n -> n.kind() == SyntaxKind.ERROR)) {
            // the parser reported the malformed operand; the count would only add noise
            return;
        }
        Optional<List<OperandBinding>> bindings = OperandBinding.bind(definition, operands);
        if (bindings.isEmpty()) {
            diagnostics.reportError("`" + definition.mnemonic() + "` expects " + OperandBinding.describeArity(definition)
                    + ", found " + operands.size(), instruction.span());
            return;
        }
        for (OperandBinding binding : bindings.get()) {
            resolveOperand(instruction, definition, binding, context);
        }
        if (valid) {
            // unresolved operands become placeholders, the instruction keeps its place
            context.result().accept(instruction.syntax(), definition);
        }
    }

    private boolean checkFlags(InstructionNode instruction, InstructionDef definition, DiagnosticsEngine diagnostics) {
        boolean valid = true;
        Set<InstructionFlag> seen = EnumSet.noneOf(InstructionFlag.class);
        boolean flagSeen = false;
        for (SyntaxNode argument : instruction.arguments()) {
            if (argument.kind() != SyntaxKind.FLAG) {
                if (flagSeen) {
                    diagnostics.reportError("Flags must follow all operands", argument.significantSpan());
                    valid = false;
                }
                continue;
            }
            flagSeen = true;
            Token token = argument.childTokens().get(0);
            InstructionFlag flag = InstructionFlag.fromSourceName(token.text()).orElseThrow();
            if (!definition.allowedFlags().contains(flag)) {
                diagnostics.reportError("`" + flag.sourceName() + "` is not a flag of `" + definition.mnemonic() + "`",
                        token.span());
                valid = false;
            } else if (!seen.add(flag)) {
                diagnostics.reportError("Duplicate flag `" + flag.sourceName() + "`", token.span());
                valid = false;
            }
        }
        return valid;
    }

    private boolean checkPlacement(Token mnemonic, InstructionDef definition, AnalysisContext context) {
        boolean inFunction = context.routine() != null && !context.routine().isSubroutine();
        if (definition.mnemonic().equals("return") && !inFunction) {
            context.diagnostics().reportError("`return` is only valid inside a function", mnemonic.span());
            return false;
        }
        if (definition.mnemonic().equals("retsub") && inFunction) {
            context.diagnostics().reportError("`retsub` is not valid inside a function; use `return`", mnemonic.span());
            return false;
        }
        return true;
    }

    private void resolveOperand(InstructionNode instruction, InstructionDef definition, OperandBinding binding,
                                AnalysisContext context) {
        OperandKind kind = binding.field().kind();
        switch (kind) {
            case CODE_ADDRESS -> {
                Optional<Symbol> target = resolveCodeTarget(binding.node(), definition.mnemonic(), context);
                if (target.isPresent() && definition.mnemonic().equals("call")) {
                    checkCallArity(instruction, target.get(), context);
                }
            }
            case REGISTER -> requireRegister(binding.node(), context);
            case REGISTER_LIST -> binding.elements().forEach(e -> requireRegister(e, context));
            case STRING, FIXUP_STRING, STRING_ARRAY -> binding.elements().forEach(e -> requireString(e, context));
            case ADDRESS_TABLE -> resolveJumpTable(instruction, binding.node(), context);
            default -> binding.elements().forEach(e -> resolveNumeric(e, context));
        }
        if (binding.elements().size() > kind.maxElements()) {
            context.diagnostics().reportError("Too many elements: `" + definition.mnemonic() + "` accepts at most "
                    + kind.maxElements(), instruction.span());
        }
    }

    private Optional<Symbol> resolveCodeTarget(SyntaxNode node, String mnemonic, AnalysisContext context) {
        if (node.kind() != SyntaxKind.NAME_REF) {
            context.diagnostics().reportError("Expected a label name", node.significantSpan());
            return Optional.empty();
        }
        Token name = node.childTokens().get(0);
        Predicate<Symbol.Type> accepted = switch (mnemonic) {
            case "call" -> t -> t == Symbol.Type.FUNCTION;
            case "gosub" -> t -> t == Symbol.Type.SUBROUTINE || t == Symbol.Type.LABEL;
            default -> t -> t == Symbol.Type.LABEL;
        };
        Optional<Symbol> symbol = context.resolve(name.text(), accepted);
        if (symbol.isPresent()) {
            context.result().resolve(node, new Resolution.CodeTarget(symbol.get()));
            return symbol;
        }
        Optional<Symbol> other = context.resolve(name.text(), t -> true);
        if (other.isPresent()) {
            context.diagnostics().reportError("`" + name.text() + "` is a " + other.get().type().describe()
                            + " and cannot be the target of `" + mnemonic + "`", name.span());
        } else {
            context.diagnostics().reportError("Could not find the definition of `" + name.text() + "`", name.span());
        }
        return Optional.empty();
    }

    private void checkCallArity(InstructionNode instruction, Symbol target, AnalysisContext context) {
        Optional<RoutineInfo> info = context.program().routine(target.name());
        List<SyntaxNode> operands = instruction.operands();
        int arguments = operands.size() == 2 && operands.get(1).kind() == SyntaxKind.ARRAY_EXPR
                ? operands.get(1).childNodes().size()
                : operands.size() - 1;
        if (info.isPresent() && info.get().parameterCount() != arguments) {
            context.diagnostics().reportError("`" + target.name() + "` takes " + info.get().parameterCount()
                    + (info.get().parameterCount() == 1 ? " argument" : " arguments") + ", found " + arguments,
                    instruction.span());
        }
    }

    private void requireRegister(SyntaxNode node, AnalysisContext context) {
        if (node.kind() == SyntaxKind.REGISTER_REF) {
            context.register(node);
        } else if (node.kind() != SyntaxKind.ERROR) {
            context.diagnostics().reportError("Expected a register", node.significantSpan());
        }
    }

    private void requireString(SyntaxNode node, AnalysisContext context) {
        boolean string = node.kind() == SyntaxKind.LITERAL
                && node.childTokens().get(0).type() == TokenType.STRING;
        if (!string && node.kind() != SyntaxKind.ERROR) {
            context.diagnostics().reportError("Expected a string literal", node.significantSpan());
        }
    }

    private void resolveNumeric(SyntaxNode node, AnalysisContext context) {
        node.walk(n -> {
            if (n.kind() == SyntaxKind.NAME_REF) {
                context.constant(n);
            } else if (n.kind() == SyntaxKind.REGISTER_REF) {
                context.register(n);
            }
        });
    }

    private void resolveJumpTable(InstructionNode instruction, SyntaxNode node, AnalysisContext context) {
        if (node.kind() != SyntaxKind.MAPPING_EXPR) {
            context.diagnostics().reportError("Expected a jump table `{ key => label, ... }`", node.significantSpan());
            return;
        }
        SymbolTable table = context.symbolTable();
        SymbolTable.Scope cases = table.createScope("jt@" + instruction.span().start(), context.scope());
        List<JumpTableEntry> entries = new ArrayList<>();
        for (SyntaxNode entry : node.childNodes(SyntaxKind.MAPPING_ENTRY)) {
            List<SyntaxNode> parts = entry.childNodes();
            if (parts.size() < 2) {
                continue;
            }
            SyntaxNode keyNode = parts.get(0);
            SyntaxNode target = parts.get(1);
            Optional<Symbol> label = resolveCodeTarget(target, "jt", context);
            Optional<ConstValue> key = context.lowerer().evaluateConstant(keyNode);
            if (key.isEmpty()) {
                continue;
            }
            int value = key.get().value();
            if (value < 0 || value > MAX_JUMP_TABLE_KEY) {
                context.diagnostics().reportError("Jump table key must be between 0 and " + MAX_JUMP_TABLE_KEY
                        + ", found " + value, keyNode.significantSpan());
                continue;
            }
            Symbol symbol = new Symbol(Integer.toString(value), Symbol.Type.JUMP_TABLE_ENTRY,
                    keyNode.significantSpan(), cases.name());
            Optional<Symbol> existing = cases.lookupLocal(symbol.name(), t -> t == Symbol.Type.JUMP_TABLE_ENTRY);
            if (existing.isPresent()) {
                context.diagnostics().reportWarning("Duplicate jump table key `" + value + "`; the first entry is used",
                        keyNode.significantSpan(), new Diagnostic.Label(existing.get().span(), "first defined here"));
                continue;
            }
            table.define(cases, symbol);
            if (label.isPresent()) {
                entries.add(new JumpTableEntry(value, target));
            }
        }
        context.result().jumpTable(instruction.syntax(), entries);
    }
}
