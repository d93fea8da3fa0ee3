package org.snrasm.compiler.frontend.semantics.analysis;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.irgen.ExpressionLowerer;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.frontend.semantics.ConstValue;
import org.snrasm.compiler.frontend.semantics.ProgramScope;
import org.snrasm.compiler.frontend.semantics.Resolution;
import org.snrasm.compiler.frontend.semantics.RoutineScope;
import org.snrasm.compiler.frontend.semantics.Symbol;
import org.snrasm.compiler.frontend.semantics.SymbolTable;
import org.snrasm.compiler.frontend.semantics.UnitAnalysis;
import org.snrasm.compiler.isa.IInstructionSet;
import org.snrasm.compiler.isa.Register;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * The state shared by the analysis handlers while one unit is analyzed.
 * Name lookups search the current routine scope first and the program scope second.
 */
public final class AnalysisContext implements ExpressionLowerer.NameResolver {

    private final ProgramScope program;
    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final IInstructionSet instructionSet;
    private final UnitAnalysis result;
    private final ExpressionLowerer lowerer;
    private RoutineScope routine;

    public AnalysisContext(ProgramScope program, DiagnosticsEngine diagnostics, IInstructionSet instructionSet) {
        this.program = program;
        this.diagnostics = diagnostics;
        this.instructionSet = instructionSet;
        this.symbolTable = new SymbolTable(diagnostics);
        this.result = new UnitAnalysis(program);
        this.lowerer = new ExpressionLowerer(this, diagnostics);
    }

    public ProgramScope program() {
        return program;
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public IInstructionSet instructionSet() {
        return instructionSet;
    }

    public UnitAnalysis result() {
        return result;
    }

    public ExpressionLowerer lowerer() {
        return lowerer;
    }

    /**
     * @return The routine being analyzed, or {@code null} at file level.
     */
    public RoutineScope routine() {
        return routine;
    }

    public void enter(RoutineScope routine) {
        this.routine = routine;
    }

    public void leave() {
        this.routine = null;
    }

    public SymbolTable.Scope scope() {
        return routine != null ? routine.scope() : symbolTable.root();
    }

    /**
     * Resolves a name from the current scope outwards.
     * @param name   The name.
     * @param filter Accepted symbol types.
     * @return The symbol.
     */
    public Optional<Symbol> resolve(String name, Predicate<Symbol.Type> filter) {
        Optional<Symbol> local = symbolTable.resolve(name, scope(), filter);
        return local.isPresent() ? local : program.resolve(name, filter);
    }

    /**
     * Resolves a register token: builtin names, then parameters of the current routine,
     * then file-level aliases. Errors are reported.
     * @param token The register token.
     * @return The register.
     */
    public Optional<Register> resolveRegister(Token token) {
        String name = token.text();
        if (Register.isBuiltinName(name)) {
            Optional<Register> builtin = Register.parseBuiltin(name);
            if (builtin.isEmpty()) {
                diagnostics.reportError("Register index out of range: `" + name + "`", token.span());
            }
            return builtin;
        }
        if (routine != null && routine.parameters().containsKey(name)) {
            return Optional.of(routine.parameters().get(name));
        }
        Optional<Register> alias = program.alias(name);
        if (alias.isEmpty() && program.resolve(name, t -> t == Symbol.Type.REGISTER_ALIAS).isEmpty()) {
            diagnostics.reportError("Unresolved register alias: `" + name + "`", token.span());
        }
        return alias;
    }

    @Override
    public Optional<Register> register(SyntaxNode registerRef) {
        Optional<Resolution> known = result.resolution(registerRef);
        if (known.isPresent()) {
            return known.get() instanceof Resolution.RegisterRef r ? Optional.of(r.register()) : Optional.empty();
        }
        Optional<Register> register = resolveRegister(registerRef.childTokens().get(0));
        register.ifPresent(r -> result.resolve(registerRef, new Resolution.RegisterRef(r)));
        return register;
    }

    @Override
    public Optional<ConstValue> constant(SyntaxNode nameRef) {
        Optional<Resolution> known = result.resolution(nameRef);
        if (known.isPresent()) {
            return known.get() instanceof Resolution.Constant c ? Optional.of(c.value()) : Optional.empty();
        }
        Token token = nameRef.childTokens().get(0);
        String name = token.text();
        Optional<ConstValue> value = program.constant(name);
        if (value.isPresent()) {
            result.resolve(nameRef, new Resolution.Constant(value.get()));
            return value;
        }
        Optional<Symbol> symbol = resolve(name, t -> true);
        if (symbol.isEmpty()) {
            diagnostics.reportError("Could not find the definition of `" + name + "`", token.span());
        } else if (symbol.get().type() != Symbol.Type.CONSTANT) {
            diagnostics.reportError("`" + name + "` is a " + symbol.get().type().describe() + ", not a constant",
                    token.span());
        }
        // a constant whose own evaluation failed has been reported already
        return Optional.empty();
    }
}
