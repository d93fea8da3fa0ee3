package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.parser.ast.AliasDefNode;
import org.snrasm.compiler.frontend.parser.ast.AstNode;
import org.snrasm.compiler.frontend.parser.ast.BlockNode;
import org.snrasm.compiler.frontend.parser.ast.InstructionNode;
import org.snrasm.compiler.frontend.parser.ast.LabelNode;
import org.snrasm.compiler.frontend.parser.ast.RoutineNode;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.frontend.semantics.analysis.AnalysisContext;
import org.snrasm.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.snrasm.compiler.frontend.semantics.analysis.InstructionAnalysisHandler;
import org.snrasm.compiler.frontend.semantics.analysis.LabelAnalysisHandler;
import org.snrasm.compiler.frontend.semantics.analysis.RoutineAnalysisHandler;
import org.snrasm.compiler.isa.IInstructionSet;
import org.snrasm.compiler.isa.Register;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Performs semantic analysis on the syntax trees of a file.
 * <p>
 * The collection pass runs over all units and builds the {@link ProgramScope}: constants,
 * register aliases, functions, subroutines and file-level labels. The unit pass then
 * analyzes one unit at a time against that frozen scope: it opens the routine scopes,
 * declares local labels and links every instruction. Unit passes are independent of each
 * other and may run concurrently.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final IInstructionSet instructionSet;
    private final Map<Class<? extends AstNode>, IAnalysisHandler> declarationHandlers = new HashMap<>();
    private final Map<Class<? extends AstNode>, IAnalysisHandler> linkingHandlers = new HashMap<>();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param instructionSet The instruction set to check instructions against.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, IInstructionSet instructionSet) {
        this.diagnostics = diagnostics;
        this.instructionSet = instructionSet;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        declarationHandlers.put(RoutineNode.class, new RoutineAnalysisHandler());
        declarationHandlers.put(LabelNode.class, new LabelAnalysisHandler());
        linkingHandlers.put(InstructionNode.class, new InstructionAnalysisHandler());
    }

    /**
     * Collects the file-level symbols of all units and evaluates constants and aliases.
     * @param units The unit trees with absolute offsets, in source order.
     * @return The frozen program scope.
     */
    public ProgramScope collect(List<SyntaxNode> units) {
        SymbolTable symbolTable = new SymbolTable(diagnostics);
        SymbolTable.Scope global = symbolTable.root();
        ConstantEvaluator evaluator = new ConstantEvaluator(symbolTable, diagnostics);
        Map<String, RoutineInfo> routines = new LinkedHashMap<>();

        for (SyntaxNode root : units) {
            for (SyntaxNode item : root.childNodes()) {
                AstNode node = AstNode.of(item);
                if (node instanceof AliasDefNode def) {
                    collectDefinition(def, symbolTable, evaluator);
                } else if (node instanceof RoutineNode routine && routine.name().isPresent()) {
                    Token name = routine.name().get();
                    Symbol.Type type = routine.isSubroutine() ? Symbol.Type.SUBROUTINE : Symbol.Type.FUNCTION;
                    Symbol symbol = new Symbol(name.text(), type, name.span(), Symbol.GLOBAL);
                    if (symbolTable.define(global, symbol)) {
                        int parameters = routine.isSubroutine() ? 0 : routine.parameters().size();
                        routines.put(symbol.name(), new RoutineInfo(symbol, parameters));
                    }
                } else if (node instanceof BlockNode block) {
                    for (SyntaxNode label : block.syntax().childNodes(SyntaxKind.LABEL)) {
                        Token name = new LabelNode(label).name();
                        symbolTable.define(global, new Symbol(name.text(), Symbol.Type.LABEL, name.span(), Symbol.GLOBAL));
                    }
                }
            }
        }
        evaluator.evaluateAll();
        return new ProgramScope(symbolTable, evaluator.constants(), evaluator.aliases(), routines);
    }

    private void collectDefinition(AliasDefNode def, SymbolTable symbolTable, ConstantEvaluator evaluator) {
        Optional<Token> name = def.name();
        Optional<SyntaxNode> value = def.value();
        if (name.isEmpty() || value.isEmpty()) {
            return;
        }
        Token token = name.get();
        if (!def.isRegisterAlias()) {
            if (symbolTable.define(symbolTable.root(), new Symbol(token.text(), Symbol.Type.CONSTANT, token.span(), Symbol.GLOBAL))) {
                evaluator.addConstant(token.text(), value.get());
            }
            return;
        }
        if (Register.isBuiltinName(token.text())) {
            diagnostics.reportError("Cannot define an alias for the builtin register `" + token.text() + "`", token.span());
            return;
        }
        if (value.get().kind() != SyntaxKind.REGISTER_REF) {
            diagnostics.reportError("A register alias must name a register", value.get().significantSpan());
            return;
        }
        if (symbolTable.define(symbolTable.root(), new Symbol(token.text(), Symbol.Type.REGISTER_ALIAS, token.span(), Symbol.GLOBAL))) {
            evaluator.addAlias(token.text(), value.get().childTokens().get(0));
        }
    }

    /**
     * Analyzes one unit against the program scope.
     * @param unit    The unit tree; offsets may be relative to the unit.
     * @param program The result of {@link #collect}.
     * @return The resolutions and scopes of the unit.
     */
    public UnitAnalysis analyzeUnit(SyntaxNode unit, ProgramScope program) {
        AnalysisContext context = new AnalysisContext(program, diagnostics, instructionSet);
        List<SyntaxNode> items = unit.childNodes();
        traverse(items, context, declarationHandlers);
        traverse(items, context, linkingHandlers);
        return context.result();
    }

    private void traverse(List<SyntaxNode> items, AnalysisContext context,
                          Map<Class<? extends AstNode>, IAnalysisHandler> handlers) {
        for (SyntaxNode item : items) {
            AstNode node = AstNode.of(item);
            if (node instanceof RoutineNode routine) {
                IAnalysisHandler handler = handlers.get(RoutineNode.class);
                if (handler != null) {
                    handler.analyze(routine, context);
                }
                context.result().routine(routine.syntax()).ifPresent(context::enter);
                dispatch(routine.statements(), context, handlers);
                context.leave();
            } else if (node instanceof BlockNode block) {
                dispatch(block.statements(), context, handlers);
            }
        }
    }

    private void dispatch(List<AstNode> statements, AnalysisContext context,
                          Map<Class<? extends AstNode>, IAnalysisHandler> handlers) {
        for (AstNode statement : statements) {
            IAnalysisHandler handler = handlers.get(statement.getClass());
            if (handler != null) {
                handler.analyze(statement, context);
            }
        }
    }
}
