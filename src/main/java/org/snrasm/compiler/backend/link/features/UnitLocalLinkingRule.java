package org.snrasm.compiler.backend.link.features;

import org.snrasm.compiler.backend.encode.Relocation;
import org.snrasm.compiler.backend.link.ILinkingRule;
import org.snrasm.compiler.backend.link.LinkingContext;
import org.snrasm.compiler.ir.IrLabelDef;

import java.util.Optional;

/**
 * Resolves synthetic labels such as the fall-through target of a jump table. They are only
 * visible inside the unit that defines them.
 */
public class UnitLocalLinkingRule implements ILinkingRule {

    @Override
    public Optional<Long> resolve(Relocation relocation, LinkingContext context) {
        if (!relocation.targetKey().startsWith(IrLabelDef.UNIT_LOCAL_PREFIX)) {
            return Optional.empty();
        }
        Integer offset = context.unit().labelOffsets().get(relocation.targetKey());
        return offset == null ? Optional.empty() : Optional.of(context.unitAddress() + offset);
    }
}
