package org.snrasm.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Settings of the assembler and disassembler, read from the {@code snrasm} block of a
 * Typesafe {@link Config}.
 *
 * @param baseAddress     The load address of the code block.
 * @param textEncoding    The encoding of string operands.
 * @param parallelism     The number of unit worker threads.
 * @param cacheEnabled    Whether per-unit stage results are memoized between runs.
 * @param cacheMaxEntries The number of entries each stage cache keeps.
 * @param labelPrefix     The prefix of labels the disassembler synthesizes.
 */
public record AssemblerOptions(long baseAddress, Charset textEncoding, int parallelism,
                               boolean cacheEnabled, int cacheMaxEntries, String labelPrefix) {

    public static final String ROOT = "snrasm";

    public AssemblerOptions {
        if (baseAddress < 0 || baseAddress > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("base-address must fit into u32, got " + baseAddress);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
        }
        if (cacheMaxEntries < 1) {
            throw new IllegalArgumentException("cache.max-entries must be positive, got " + cacheMaxEntries);
        }
    }

    /**
     * @return The options of {@code reference.conf} and any {@code application.conf} on the classpath.
     */
    public static AssemblerOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the options from the {@code snrasm} block of a resolved configuration.
     * A parallelism of 0 means one thread per available processor.
     *
     * @param config The configuration root.
     * @return The options.
     * @throws ConfigException if a setting is missing or has the wrong type.
     */
    public static AssemblerOptions fromConfig(Config config) {
        Config c = config.getConfig(ROOT);
        int parallelism = c.getInt("parallelism");
        if (parallelism == 0) {
            parallelism = Runtime.getRuntime().availableProcessors();
        }
        String encoding = c.getString("text-encoding");
        Charset charset;
        try {
            charset = Charset.forName(encoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigException.BadValue(c.origin(), "text-encoding", "Unknown charset `" + encoding + "`", e);
        }
        return new AssemblerOptions(
                c.getLong("base-address"),
                charset,
                parallelism,
                c.getBoolean("cache.enabled"),
                c.getInt("cache.max-entries"),
                c.getString("disassembler.label-prefix"));
    }

    public AssemblerOptions withBaseAddress(long address) {
        return new AssemblerOptions(address, textEncoding, parallelism, cacheEnabled, cacheMaxEntries, labelPrefix);
    }
}
