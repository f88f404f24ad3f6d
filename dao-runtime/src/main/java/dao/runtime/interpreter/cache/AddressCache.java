package dao.runtime.interpreter.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import dao.runtime.Address;

/**
 * 地址文本解析缓存
 *
 * <p>宿主 API 以字符串指定模块与系统调用，同一地址往往被反复解析。
 * 基于 Caffeine 的有界缓存（Window TinyLfu 淘汰），线程安全。
 * 解析失败不缓存，异常直接抛给调用方。</p>
 */
public final class AddressCache {

    private final Cache<String, Address> cache;
    private final long maximumSize;

    /**
     * @param maximumSize 最大条目数
     */
    public AddressCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()  // 启用统计（低开销）
                .build();
    }

    /**
     * 解析地址，命中时直接返回缓存结果
     *
     * @throws dao.runtime.AddressFormatException 文本不是合法地址
     */
    public Address parse(String text) {
        if (text == null) return Address.parse(null);
        Address cached = cache.getIfPresent(text);
        if (cached != null) return cached;
        Address parsed = Address.parse(text);
        cache.put(text, parsed);
        return parsed;
    }

    public long size() {
        return cache.estimatedSize();
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();  // 立即清理
    }

    public CacheStats getStats() {
        return cache.stats();
    }

    @Override
    public String toString() {
        CacheStats s = cache.stats();
        return String.format("hits=%d, misses=%d, hitRate=%.2f%%, evictions=%d, size=%d/%d",
                s.hitCount(), s.missCount(), s.hitRate() * 100, s.evictionCount(),
                cache.estimatedSize(), maximumSize);
    }
}
