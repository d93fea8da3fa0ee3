package org.snrasm.compiler.isa;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A VM register address. Regular registers {@code $v0..$v4095} occupy {@code 0x000..0xFFF},
 * argument registers {@code $a0..$a4095} occupy {@code 0x1000..0x1FFF}.
 *
 * @param id The 16-bit register id as it appears in the encoding.
 */
public record Register(int id) {

    public static final int ARGUMENTS_START = 0x1000;
    public static final int MAX_INDEX = 0xFFF;

    private static final Pattern BUILTIN = Pattern.compile("\\$([va])([0-9]+)");

    public Register {
        if (id < 0 || id > ARGUMENTS_START + MAX_INDEX) {
            throw new IllegalArgumentException("Register id out of range: " + id);
        }
    }

    public static Register regular(int index) {
        if (index < 0 || index > MAX_INDEX) {
            throw new IllegalArgumentException("Regular register index out of range: " + index);
        }
        return new Register(index);
    }

    public static Register argument(int index) {
        if (index < 0 || index > MAX_INDEX) {
            throw new IllegalArgumentException("Argument register index out of range: " + index);
        }
        return new Register(ARGUMENTS_START + index);
    }

    /**
     * Checks whether a register token uses the builtin {@code $vN}/{@code $aN} spelling.
     * Such names can never be aliases, even when the index is out of range.
     * @param text The token text including the {@code $}.
     * @return {@code true} for builtin spellings.
     */
    public static boolean isBuiltinName(String text) {
        return BUILTIN.matcher(text).matches();
    }

    /**
     * Parses a builtin register name.
     * @param text The token text including the {@code $}.
     * @return The register, or empty if the text is not builtin or the index is out of range.
     */
    public static Optional<Register> parseBuiltin(String text) {
        Matcher m = BUILTIN.matcher(text);
        if (!m.matches() || m.group(2).length() > 5) {
            return Optional.empty();
        }
        int index = Integer.parseInt(m.group(2));
        if (index > MAX_INDEX) {
            return Optional.empty();
        }
        return Optional.of(m.group(1).equals("v") ? regular(index) : argument(index));
    }

    public boolean isArgument() {
        return id >= ARGUMENTS_START;
    }

    public int index() {
        return isArgument() ? id - ARGUMENTS_START : id;
    }

    @Override
    public String toString() {
        return (isArgument() ? "$a" : "$v") + index();
    }
}
