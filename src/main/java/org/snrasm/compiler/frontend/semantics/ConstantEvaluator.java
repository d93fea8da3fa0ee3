package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.irgen.ExpressionLowerer;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.isa.Register;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates the file-level {@code def} constants and resolves register alias chains.
 * Definitions may refer to each other in any order; cycles are reported once, at the
 * reference that closes them.
 */
class ConstantEvaluator implements ExpressionLowerer.NameResolver {

    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final ExpressionLowerer lowerer;

    private final Map<String, SyntaxNode> constantDefinitions = new LinkedHashMap<>();
    private final Map<String, ConstValue> constants = new LinkedHashMap<>();
    private final Map<String, Token> aliasDefinitions = new LinkedHashMap<>();
    private final Map<String, Register> aliases = new LinkedHashMap<>();
    private final Set<String> inProgress = new HashSet<>();
    private final Set<String> failed = new HashSet<>();

    ConstantEvaluator(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
        this.lowerer = new ExpressionLowerer(this, diagnostics);
    }

    void addConstant(String name, SyntaxNode value) {
        constantDefinitions.putIfAbsent(name, value);
    }

    /**
     * @param name   The alias including its {@code $}.
     * @param target The register token the alias refers to.
     */
    void addAlias(String name, Token target) {
        aliasDefinitions.putIfAbsent(name, target);
    }

    void evaluateAll() {
        for (String name : aliasDefinitions.keySet()) {
            resolveAlias(name, new HashSet<>());
        }
        for (String name : constantDefinitions.keySet()) {
            evaluate(name, null);
        }
    }

    Map<String, ConstValue> constants() {
        return constants;
    }

    Map<String, Register> aliases() {
        return aliases;
    }

    @Override
    public Optional<ConstValue> constant(SyntaxNode nameRef) {
        Token token = nameRef.childTokens().get(0);
        String name = token.text();
        if (constantDefinitions.containsKey(name)) {
            return evaluate(name, token);
        }
        Optional<Symbol> other = symbolTable.resolve(name, symbolTable.root(), t -> true);
        if (other.isPresent()) {
            diagnostics.reportError("`" + name + "` is a " + other.get().type().describe() + ", not a constant", token.span());
        } else {
            diagnostics.reportError("Could not find the definition of `" + name + "`", token.span());
        }
        return Optional.empty();
    }

    @Override
    public Optional<Register> register(SyntaxNode registerRef) {
        diagnostics.reportError("Constant expressions cannot read registers", registerRef.significantSpan());
        return Optional.empty();
    }

    private Optional<ConstValue> evaluate(String name, Token reference) {
        if (constants.containsKey(name)) {
            return Optional.of(constants.get(name));
        }
        if (failed.contains(name)) {
            return Optional.empty();
        }
        if (!inProgress.add(name)) {
            diagnostics.reportError("Cyclic constant definition involving `" + name + "`", reference.span());
            failed.add(name);
            return Optional.empty();
        }
        Optional<ConstValue> value = lowerer.evaluateConstant(constantDefinitions.get(name));
        inProgress.remove(name);
        if (value.isPresent() && !failed.contains(name)) {
            constants.put(name, value.get());
            return value;
        }
        failed.add(name);
        return Optional.empty();
    }

    private Optional<Register> resolveAlias(String name, Set<String> visiting) {
        if (aliases.containsKey(name)) {
            return Optional.of(aliases.get(name));
        }
        if (failed.contains(name)) {
            return Optional.empty();
        }
        Token target = aliasDefinitions.get(name);
        if (!visiting.add(name)) {
            diagnostics.reportError("Cyclic register alias `" + name + "`", target.span());
            failed.add(name);
            return Optional.empty();
        }
        Optional<Register> register;
        if (Register.isBuiltinName(target.text())) {
            register = Register.parseBuiltin(target.text());
            if (register.isEmpty()) {
                diagnostics.reportError("Register index out of range: `" + target.text() + "`", target.span());
            }
        } else if (aliasDefinitions.containsKey(target.text())) {
            register = resolveAlias(target.text(), visiting);
        } else {
            diagnostics.reportError("Unresolved register alias: `" + target.text() + "`", target.span());
            register = Optional.empty();
        }
        if (register.isPresent()) {
            aliases.put(name, register.get());
        } else {
            failed.add(name);
        }
        return register;
    }
}
