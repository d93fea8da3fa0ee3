package org.snrasm.compiler.backend.link;

import org.snrasm.compiler.backend.encode.EncodedUnit;
import org.snrasm.compiler.backend.encode.Relocation;
import org.snrasm.compiler.backend.layout.LayoutResult;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.isa.CodeWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Linking pass: patches every relocation with the absolute address of its target.
 */
public final class Linker {

    /** The largest address a code address field can hold. */
    public static final long MAX_ADDRESS = 0xFFFFFFFFL;

    private final LinkingRegistry registry;

    /**
     * Constructs a new linker.
     * @param registry The registry of linking rules to apply.
     */
    public Linker(LinkingRegistry registry) { this.registry = registry; }

    /**
     * Links the given units. The units are not modified; patched copies of their code are returned.
     *
     * @param units       The encoded units in layout order.
     * @param spanOffsets The file offset of every unit, used to report relocation spans.
     * @param layout      The layout of the units.
     * @param diagnostics Receives unresolved and overflowing addresses.
     * @return The linked code of every unit.
     */
    public List<byte[]> link(List<EncodedUnit> units, List<Integer> spanOffsets, LayoutResult layout,
                             DiagnosticsEngine diagnostics) {
        LinkingContext context = new LinkingContext(layout);
        List<byte[]> linked = new ArrayList<>(units.size());
        for (int u = 0; u < units.size(); u++) {
            EncodedUnit unit = units.get(u);
            context.enterUnit(unit, layout.unitAddresses().get(u), spanOffsets.get(u));
            CodeWriter code = new CodeWriter();
            code.bytes(unit.code());
            for (Relocation relocation : unit.relocations()) {
                Optional<Long> address = resolve(relocation, context);
                if (address.isEmpty()) {
                    diagnostics.reportError("Could not find the address of `" + relocation.displayName() + "`",
                            context.toFileSpan(relocation.span()));
                } else if (address.get() > MAX_ADDRESS) {
                    diagnostics.reportError(String.format("Address 0x%x of `%s` does not fit into u32",
                            address.get(), relocation.displayName()), context.toFileSpan(relocation.span()));
                } else {
                    code.patchU32(relocation.offset(), address.get());
                }
            }
            linked.add(code.toByteArray());
        }
        return linked;
    }

    private Optional<Long> resolve(Relocation relocation, LinkingContext context) {
        for (ILinkingRule rule : registry.rules()) {
            Optional<Long> address = rule.resolve(relocation, context);
            if (address.isPresent()) {
                return address;
            }
        }
        return Optional.empty();
    }
}
