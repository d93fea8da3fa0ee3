package org.snrasm.compiler.isa;

import java.util.Optional;

/**
 * Named flags written after the operands of a command, e.g. {@code MSGSET 1, "text", nowait}.
 */
public enum InstructionFlag {
    NOWAIT("nowait"),
    INTERRUPTABLE("interruptable");

    private final String sourceName;

    InstructionFlag(String sourceName) {
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }

    public static Optional<InstructionFlag> fromSourceName(String name) {
        for (InstructionFlag flag : values()) {
            if (flag.sourceName.equals(name)) {
                return Optional.of(flag);
            }
        }
        return Optional.empty();
    }
}
