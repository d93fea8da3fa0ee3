package org.snrasm.compiler.incremental;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class StageCacheTest {

    @Test
    void testComputeIfAbsentRunsOncePerKey() {
        // Arrange
        StageCache<String> cache = new StageCache<>("parse", 4);
        AtomicInteger computations = new AtomicInteger();

        // Act
        String first = cache.computeIfAbsent("k", () -> "v" + computations.incrementAndGet());
        String second = cache.computeIfAbsent("k", () -> "v" + computations.incrementAndGet());

        // Assert
        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(computations).hasValue(1);
        assertThat(cache.hits()).isEqualTo(1);
        assertThat(cache.misses()).isEqualTo(1);
    }

    /**
     * The least recently used entry is dropped first; reading an entry refreshes it.
     */
    @Test
    void testLeastRecentlyUsedEntryIsEvicted() {
        // Arrange
        StageCache<Integer> cache = new StageCache<>("unit", 2);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.get("a");

        // Act
        cache.put("c", 3);

        // Assert
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("a")).contains(1);
        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("c")).contains(3);
    }

    @Test
    void testInvalidate() {
        StageCache<Integer> cache = new StageCache<>("unit", 8);
        cache.put("a", 1);
        cache.put("b", 2);

        assertThat(cache.invalidate("a")).isTrue();
        assertThat(cache.invalidate("a")).isFalse();
        assertThat(cache.get("a")).isEmpty();

        cache.invalidateAll();
        assertThat(cache.size()).isZero();
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new StageCache<String>("parse", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testContentHashSeparatesParts() {
        assertThat(ContentHash.of("ab", "c")).isNotEqualTo(ContentHash.of("a", "bc"));
        assertThat(ContentHash.of("x")).isEqualTo(ContentHash.of("x")).hasSize(64);
    }
}
