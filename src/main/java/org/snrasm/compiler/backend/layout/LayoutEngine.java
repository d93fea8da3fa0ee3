package org.snrasm.compiler.backend.layout;

import org.snrasm.compiler.backend.encode.EncodedUnit;
import org.snrasm.compiler.ir.IrLabelDef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places encoded units one after another and assigns absolute addresses to their symbols.
 * This pass does not perform linking; relocations are not patched here.
 */
public final class LayoutEngine {

    /**
     * Lays out the given units in order.
     * <p>
     * A symbol defined by more than one unit keeps the address of its first definition; the
     * duplicate has already been reported by the analysis. Unit-local keys are not exported.
     *
     * @param units       The encoded units in source order.
     * @param baseAddress The address of the first unit.
     * @return The result of the layout process.
     */
    public LayoutResult layout(List<EncodedUnit> units, long baseAddress) {
        List<Long> unitAddresses = new ArrayList<>(units.size());
        Map<String, Long> labelToAddress = new LinkedHashMap<>();
        long address = baseAddress;
        for (EncodedUnit unit : units) {
            unitAddresses.add(address);
            for (Map.Entry<String, Integer> label : unit.labelOffsets().entrySet()) {
                if (!label.getKey().startsWith(IrLabelDef.UNIT_LOCAL_PREFIX)) {
                    labelToAddress.putIfAbsent(label.getKey(), address + label.getValue());
                }
            }
            address += unit.size();
        }
        return new LayoutResult(baseAddress, unitAddresses, labelToAddress, address);
    }
}
