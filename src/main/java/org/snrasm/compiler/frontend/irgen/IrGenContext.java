package org.snrasm.compiler.frontend.irgen;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.parser.ast.AstNode;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.frontend.semantics.ConstValue;
import org.snrasm.compiler.frontend.semantics.Resolution;
import org.snrasm.compiler.frontend.semantics.RoutineScope;
import org.snrasm.compiler.frontend.semantics.UnitAnalysis;
import org.snrasm.compiler.ir.IrItem;
import org.snrasm.compiler.ir.IrProgram;
import org.snrasm.compiler.isa.Register;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mutable context passed to converters during IR generation.
 * Provides emission utilities, diagnostics access and the analysis result of the unit.
 */
public final class IrGenContext implements ExpressionLowerer.NameResolver {

	private final String programName;
	private final DiagnosticsEngine diagnostics;
	private final IrConverterRegistry registry;
	private final UnitAnalysis analysis;
	private final ExpressionLowerer lowerer;
	private final List<IrItem> out = new ArrayList<>();
	private RoutineScope routine;

	/**
	 * Constructs a new IR generation context.
	 * @param programName The name of the program being compiled.
	 * @param diagnostics The diagnostics engine for reporting errors and warnings.
	 * @param registry The registry for resolving AST node converters.
	 * @param analysis The analysis result of the unit.
	 */
	public IrGenContext(String programName, DiagnosticsEngine diagnostics, IrConverterRegistry registry,
						UnitAnalysis analysis) {
		this.programName = programName;
		this.diagnostics = diagnostics;
		this.registry = registry;
		this.analysis = analysis;
		this.lowerer = new ExpressionLowerer(this, diagnostics);
	}

	/**
	 * Emits a new IR item.
	 * @param item The item to add to the program.
	 */
	public void emit(IrItem item) {
		out.add(item);
	}

	/**
	 * Converts the given AST node by resolving and invoking the appropriate converter.
	 * @param node The node to convert.
	 */
	public void convert(AstNode node) {
		registry.resolve(node).ifPresent(c -> c.convert(node, this));
	}

	/**
	 * @return The diagnostics engine.
	 */
	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public UnitAnalysis analysis() {
		return analysis;
	}

	public ExpressionLowerer lowerer() {
		return lowerer;
	}

	/**
	 * @return The routine whose body is being converted, or {@code null}.
	 */
	public RoutineScope routine() {
		return routine;
	}

	public void enterRoutine(RoutineScope routine) {
		this.routine = routine;
	}

	public void leaveRoutine() {
		this.routine = null;
	}

	// Names were resolved and reported by the analysis; missing entries are known errors.

	@Override
	public Optional<ConstValue> constant(SyntaxNode nameRef) {
		return analysis.resolution(nameRef)
				.filter(Resolution.Constant.class::isInstance)
				.map(r -> ((Resolution.Constant) r).value());
	}

	@Override
	public Optional<Register> register(SyntaxNode registerRef) {
		return analysis.resolution(registerRef)
				.filter(Resolution.RegisterRef.class::isInstance)
				.map(r -> ((Resolution.RegisterRef) r).register());
	}

	/**
	 * Builds the final {@link IrProgram} from the emitted items.
	 * @return The constructed program.
	 */
	public IrProgram build() {
		return new IrProgram(programName, List.copyOf(out));
	}
}
