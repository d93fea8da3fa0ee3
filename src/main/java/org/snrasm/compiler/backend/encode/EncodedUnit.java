package org.snrasm.compiler.backend.encode;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The machine code of one unit before linking. Instances are immutable and may be shared
 * through the stage cache; the code array is copied on access.
 *
 * @param code         The encoded bytes with zeroed address fields.
 * @param relocations  The address fields to patch.
 * @param labelOffsets The offsets of the code address symbols defined in the unit, in definition order.
 */
public record EncodedUnit(byte[] code, List<Relocation> relocations, Map<String, Integer> labelOffsets) {

    public EncodedUnit {
        code = code.clone();
        relocations = List.copyOf(relocations);
        labelOffsets = Collections.unmodifiableMap(new LinkedHashMap<>(labelOffsets));
    }

    @Override
    public byte[] code() {
        return code.clone();
    }

    public int size() {
        return code.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EncodedUnit other
                && Arrays.equals(code, other.code)
                && relocations.equals(other.relocations)
                && labelOffsets.equals(other.labelOffsets);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(code) + relocations.hashCode()) + labelOffsets.hashCode();
    }

    @Override
    public String toString() {
        return "EncodedUnit{" + code.length + " bytes, " + relocations.size() + " relocations, labels=" + labelOffsets.keySet() + "}";
    }
}
