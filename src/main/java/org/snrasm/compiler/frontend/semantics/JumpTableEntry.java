package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;

/**
 * One case of a {@code jt} mapping that survived duplicate checking.
 *
 * @param key    The case value, 0..65534.
 * @param target The {@code NAME_REF} of the case label.
 */
public record JumpTableEntry(int key, SyntaxNode target) {}
