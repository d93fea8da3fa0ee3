package org.snrasm.compiler.backend.emit;

import org.snrasm.compiler.backend.layout.LayoutResult;
import org.snrasm.compiler.isa.CodeWriter;

import java.util.List;

/**
 * Produces the final code block from the linked units.
 */
public final class Emitter {

    /**
     * Concatenates the linked units in layout order.
     *
     * @param linkedUnits The code of every unit after linking.
     * @param layout      The layout the units were linked against.
     * @return The code block; its first byte lives at the base address.
     */
    public byte[] emit(List<byte[]> linkedUnits, LayoutResult layout) {
        CodeWriter out = new CodeWriter();
        for (byte[] unit : linkedUnits) {
            out.bytes(unit);
        }
        if (layout.baseAddress() + out.position() != layout.endAddress()) {
            throw new IllegalStateException("Linked code size differs from the layout: "
                    + out.position() + " bytes, expected " + (layout.endAddress() - layout.baseAddress()));
        }
        return out.toByteArray();
    }
}
