package org.snrasm.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class AssemblerOptionsTest {

    private static Config withDefaults(String hocon) {
        return ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()).resolve();
    }

    @Test
    void testReferenceDefaults() {
        AssemblerOptions options = AssemblerOptions.defaults();

        assertThat(options.baseAddress()).isZero();
        assertThat(options.textEncoding()).isEqualTo(Charset.forName("Shift_JIS"));
        assertThat(options.parallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(options.cacheEnabled()).isTrue();
        assertThat(options.labelPrefix()).isEqualTo("LABEL_");
    }

    @Test
    void testOverrides() {
        AssemblerOptions options = AssemblerOptions.fromConfig(withDefaults("""
                snrasm {
                  base-address = 256
                  text-encoding = "UTF-8"
                  parallelism = 2
                  cache.enabled = false
                }
                """));

        assertThat(options.baseAddress()).isEqualTo(256);
        assertThat(options.textEncoding()).isEqualTo(Charset.forName("UTF-8"));
        assertThat(options.parallelism()).isEqualTo(2);
        assertThat(options.cacheEnabled()).isFalse();
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> AssemblerOptions.fromConfig(withDefaults("snrasm.text-encoding = \"NOPE-42\"")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("Unknown charset `NOPE-42`");
        assertThatThrownBy(() -> AssemblerOptions.fromConfig(withDefaults("snrasm.base-address = -1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AssemblerOptions.fromConfig(withDefaults("snrasm.parallelism = abc")))
                .isInstanceOf(ConfigException.WrongType.class);
        assertThatThrownBy(() -> AssemblerOptions.defaults().withBaseAddress(0x1_0000_0000L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
