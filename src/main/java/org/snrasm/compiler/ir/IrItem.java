package org.snrasm.compiler.ir;

import org.snrasm.compiler.diagnostics.Span;

/**
 * Marker interface for all IR elements emitted by the frontend and
 * consumed by backend phases. Every item carries its source span
 * for diagnostics; synthesized items use the span of their origin.
 */
public interface IrItem {
	Span span();
}
