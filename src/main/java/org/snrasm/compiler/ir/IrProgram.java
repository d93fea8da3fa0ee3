package org.snrasm.compiler.ir;

import java.util.List;

/**
 * Linear IR of one compilation unit. The order of items is the emission order
 * as produced by the frontend and is preserved by backends.
 */
public record IrProgram(String programName, List<IrItem> items) {
    public IrProgram {
        items = List.copyOf(items);
    }
}
