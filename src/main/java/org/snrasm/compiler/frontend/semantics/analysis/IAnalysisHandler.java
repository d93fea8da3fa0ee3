package org.snrasm.compiler.frontend.semantics.analysis;

import org.snrasm.compiler.frontend.parser.ast.AstNode;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for analyzing a specific type of AST node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single AST node.
     * @param node The node to analyze.
     * @param context The state of the unit being analyzed.
     */
    void analyze(AstNode node, AnalysisContext context);
}
