package org.snrasm.compiler.ir;

import org.snrasm.compiler.diagnostics.Span;

/**
 * Marks the position of a code address symbol.
 *
 * @param key  The qualified name of the symbol.
 * @param name The name as written in source.
 * @param span The source span of the definition.
 */
public record IrLabelDef(String key, String name, Span span) implements IrItem {

	/** Keys with this prefix are only visible inside the unit that defines them. */
	public static final String UNIT_LOCAL_PREFIX = "%";

	/**
	 * @return {@code true} for synthetic labels that the linker resolves within the defining unit.
	 */
	public boolean isUnitLocal() {
		return key.startsWith(UNIT_LOCAL_PREFIX);
	}
}
