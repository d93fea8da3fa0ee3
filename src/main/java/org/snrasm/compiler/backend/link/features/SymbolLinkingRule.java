package org.snrasm.compiler.backend.link.features;

import org.snrasm.compiler.backend.encode.Relocation;
import org.snrasm.compiler.backend.link.ILinkingRule;
import org.snrasm.compiler.backend.link.LinkingContext;

import java.util.Optional;

/**
 * Resolves labels, functions and subroutines through the global layout.
 */
public class SymbolLinkingRule implements ILinkingRule {

    @Override
    public Optional<Long> resolve(Relocation relocation, LinkingContext context) {
        return Optional.ofNullable(context.layout().labelToAddress().get(relocation.targetKey()));
    }
}
