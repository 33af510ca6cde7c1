package tinytalk.runtime.interpreter.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Caffeine 缓存")
class CaffeineCacheTest {

    @Test
    @DisplayName("命中与未命中计入统计")
    void testStats() {
        BoundedCache<String, Integer> cache = new CaffeineCache<String, Integer>(10);
        cache.put("a", 1);
        assertEquals(1, cache.get("a"));
        assertNull(cache.get("b"));

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.getHitCount());
        assertEquals(1, stats.getMissCount());
        assertEquals(0.5, stats.getHitRate());
        assertEquals(10, stats.getMaximumSize());
        assertThat(stats.toString()).contains("hits=1").contains("misses=1");
    }

    @Test
    @DisplayName("invalidate 与 clear")
    void testInvalidate() {
        BoundedCache<String, Integer> cache = new CaffeineCache<String, Integer>(10);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.invalidate("a");
        assertNull(cache.get("a"));
        assertEquals(1, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("容量必须为正")
    void testInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new CaffeineCache<String, Integer>(0));
    }

    @Test
    @DisplayName("空统计的命中率为零")
    void testEmptyHitRate() {
        assertEquals(0.0, new CacheStats(0, 0, 0, 0, 1).getHitRate());
    }
}
