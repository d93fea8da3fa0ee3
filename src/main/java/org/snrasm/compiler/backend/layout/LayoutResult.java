package org.snrasm.compiler.backend.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of the layout phase (without linking): unit placement and symbol addresses.
 *
 * @param baseAddress    The address of the first unit.
 * @param unitAddresses  The absolute address of every unit, in source order.
 * @param labelToAddress The absolute addresses of all global code address symbols, by qualified name.
 * @param endAddress     The address after the last unit.
 */
public record LayoutResult(long baseAddress, List<Long> unitAddresses, Map<String, Long> labelToAddress, long endAddress) {

    public LayoutResult {
        unitAddresses = List.copyOf(unitAddresses);
        labelToAddress = Collections.unmodifiableMap(new LinkedHashMap<>(labelToAddress));
    }
}
