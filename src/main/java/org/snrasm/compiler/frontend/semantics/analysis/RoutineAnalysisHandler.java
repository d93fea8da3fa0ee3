package org.snrasm.compiler.frontend.semantics.analysis;

import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.parser.ast.AstNode;
import org.snrasm.compiler.frontend.parser.ast.RoutineNode;
import org.snrasm.compiler.frontend.semantics.RoutineScope;
import org.snrasm.compiler.frontend.semantics.Symbol;
import org.snrasm.compiler.frontend.semantics.SymbolTable;
import org.snrasm.compiler.isa.Register;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Opens the local scope of a function or subroutine: binds the parameters to the argument
 * registers and expands the preserved register ranges.
 */
public class RoutineAnalysisHandler implements IAnalysisHandler {

    /** The VM passes at most this many call arguments. */
    public static final int MAX_PARAMETERS = 16;

    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (!(node instanceof RoutineNode routine)) {
            return;
        }
        DiagnosticsEngine diagnostics = context.diagnostics();
        Symbol.Type type = routine.isSubroutine() ? Symbol.Type.SUBROUTINE : Symbol.Type.FUNCTION;
        Symbol symbol = routine.name()
                .map(name -> context.program().resolve(name.text(), t -> t == type)
                        .orElse(new Symbol(name.text(), type, name.span(), Symbol.GLOBAL)))
                .orElse(new Symbol("<unnamed@" + routine.keyword().offset() + ">", type,
                        routine.keyword().span(), Symbol.GLOBAL));
        SymbolTable table = context.symbolTable();
        SymbolTable.Scope scope = table.createScope(symbol.name(), table.root());

        Map<String, Register> parameters = new LinkedHashMap<>();
        Map<Register, Token> bound = new LinkedHashMap<>();
        List<Token> params = routine.parameters();
        for (int i = 0; i < params.size(); i++) {
            Token param = params.get(i);
            if (i >= MAX_PARAMETERS) {
                diagnostics.reportError("A function takes at most " + MAX_PARAMETERS + " parameters", param.span());
                break;
            }
            Register target = Register.argument(i);
            if (Register.isBuiltinName(param.text())) {
                if (!param.text().equals(target.toString())) {
                    diagnostics.reportError("Parameter `" + param.text() + "` must be the argument register `"
                            + target + "`", param.span());
                }
            } else if (table.define(scope, new Symbol(param.text(), Symbol.Type.REGISTER_ALIAS, param.span(), scope.name()))) {
                parameters.put(param.text(), target);
            }
            bound.putIfAbsent(target, param);
        }

        List<Register> preserved = new ArrayList<>();
        for (RoutineNode.Range range : routine.preserved()) {
            expand(range, parameters, context).ifPresent(registers -> {
                for (Register register : registers) {
                    Token at = range.first();
                    if (bound.containsKey(register)) {
                        diagnostics.reportError("Preserved register `" + register + "` is bound to parameter `"
                                        + bound.get(register).text() + "`", at.span(),
                                new Diagnostic.Label(bound.get(register).span(), "parameter declared here"));
                    } else if (preserved.contains(register)) {
                        diagnostics.reportError("Register `" + register + "` is preserved twice", at.span());
                    } else {
                        preserved.add(register);
                    }
                }
            });
        }

        RoutineScope routineScope = new RoutineScope(symbol, scope, parameters, preserved);
        context.result().routine(routine.syntax(), routineScope);
    }

    private Optional<List<Register>> expand(RoutineNode.Range range, Map<String, Register> parameters,
                                            AnalysisContext context) {
        Optional<Register> first = header(range.first(), parameters, context);
        if (range.last() == null) {
            return first.map(List::of);
        }
        Optional<Register> last = header(range.last(), parameters, context);
        if (first.isEmpty() || last.isEmpty()) {
            return Optional.empty();
        }
        Register a = first.get();
        Register b = last.get();
        String text = range.first().text() + "-" + range.last().text();
        if (a.isArgument() != b.isArgument()) {
            context.diagnostics().reportError("Register range `" + text + "` crosses register banks",
                    range.first().span().cover(range.last().span()));
            return Optional.empty();
        }
        if (a.index() > b.index()) {
            context.diagnostics().reportError("Register range `" + text + "` is reversed",
                    range.first().span().cover(range.last().span()));
            return Optional.empty();
        }
        List<Register> registers = new ArrayList<>();
        for (int id = a.id(); id <= b.id(); id++) {
            registers.add(new Register(id));
        }
        return Optional.of(registers);
    }

    private Optional<Register> header(Token token, Map<String, Register> parameters, AnalysisContext context) {
        if (parameters.containsKey(token.text())) {
            // reported as bound by the caller
            return Optional.of(parameters.get(token.text()));
        }
        return context.resolveRegister(token);
    }
}
