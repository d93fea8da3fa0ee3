package org.snrasm.compiler.backend.encode;

import org.snrasm.compiler.diagnostics.Span;

/**
 * A pending u32 code address inside an encoded unit.
 *
 * @param offset      The byte offset of the address field within the unit.
 * @param targetKey   The qualified name of the target symbol.
 * @param displayName The name as written in source, for diagnostics.
 * @param span        The unit-relative source span of the reference.
 */
public record Relocation(int offset, String targetKey, String displayName, Span span) {}
