package org.snrasm.compiler.frontend.irgen;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.frontend.parser.ast.AstNode;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;
import org.snrasm.compiler.frontend.semantics.UnitAnalysis;
import org.snrasm.compiler.ir.IrProgram;

/**
 * Phase: Generates IR from an analyzed unit by delegating to converters
 * resolved via the {@link IrConverterRegistry}.
 */
public final class IrGenerator {

	private final DiagnosticsEngine diagnostics;
	private final IrConverterRegistry registry;

	/**
	 * Creates a new IR generator with a diagnostics engine and a prepared registry.
	 *
	 * @param diagnostics The diagnostics engine for reporting issues.
	 * @param registry    The converter registry.
	 */
	public IrGenerator(DiagnosticsEngine diagnostics, IrConverterRegistry registry) {
		this.diagnostics = diagnostics;
		this.registry = registry;
	}

	/**
	 * Generates a linear IR program by dispatching each item of the unit to a converter.
	 *
	 * @param unit        The unit tree that was analyzed.
	 * @param analysis    The analysis result of the unit.
	 * @param programName The program name used for IR metadata.
	 * @return The generated IR program.
	 */
	public IrProgram generate(SyntaxNode unit, UnitAnalysis analysis, String programName) {
		IrGenContext ctx = new IrGenContext(programName, diagnostics, registry, analysis);
		for (SyntaxNode item : unit.childNodes()) {
			AstNode node = AstNode.of(item);
			if (node != null) {
				ctx.convert(node);
			}
		}
		return ctx.build();
	}
}
