package tinytalk.runtime.interpreter.cache;

/**
 * 容量有上限的缓存
 */
public interface BoundedCache<K, V> {

    /**
     * @return 缓存值，未命中返回 null
     */
    V get(K key);

    void put(K key, V value);

    /**
     * 移除单个条目
     */
    void invalidate(K key);

    /**
     * 当前条目数（估计值）
     */
    long size();

    void clear();

    CacheStats getStats();
}
