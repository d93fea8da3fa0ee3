package org.snrasm.compiler.backend.link;

import org.snrasm.compiler.backend.encode.EncodedUnit;
import org.snrasm.compiler.backend.layout.LayoutResult;
import org.snrasm.compiler.diagnostics.Span;

/**
 * Context for the linking phase, moved from unit to unit by the {@link Linker}.
 */
public final class LinkingContext {

    private final LayoutResult layout;
    private EncodedUnit unit;
    private long unitAddress;
    private int spanOffset;

    public LinkingContext(LayoutResult layout) {
        this.layout = layout;
    }

    void enterUnit(EncodedUnit unit, long unitAddress, int spanOffset) {
        this.unit = unit;
        this.unitAddress = unitAddress;
        this.spanOffset = spanOffset;
    }

    public LayoutResult layout() { return layout; }

    /**
     * @return The unit whose relocations are being patched.
     */
    public EncodedUnit unit() { return unit; }

    /**
     * @return The absolute address of the current unit.
     */
    public long unitAddress() { return unitAddress; }

    /**
     * Converts a unit-relative span into a file span.
     * @param span The span stored in the unit.
     * @return The span in the whole file.
     */
    public Span toFileSpan(Span span) {
        return span.shift(spanOffset);
    }
}
