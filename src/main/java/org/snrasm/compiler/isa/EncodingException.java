package org.snrasm.compiler.isa;

/**
 * Thrown when a value cannot be represented in the binary encoding.
 */
public class EncodingException extends Exception {

    public EncodingException(String message) {
        super(message);
    }
}
