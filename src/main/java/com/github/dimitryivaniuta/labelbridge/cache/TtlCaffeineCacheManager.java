package com.github.dimitryivaniuta.labelbridge.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.AbstractCacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caffeine CacheManager that reads per-cache settings from the cache name:
 *
 *   "principalById:ttl=30"          -> expireAfterWrite 30 seconds
 *   "principalById:ttl=30:max=5000" -> additionally bounded to 5000 entries
 *
 * Names without suffixes fall back to the base builder's configuration plus the default maximum
 * size. Caffeine rejects a second maximumSize, so the base builder must not set one itself.
 * Caffeine builders are mutable, so a fresh builder is requested per cache.
 */
public final class TtlCaffeineCacheManager extends AbstractCacheManager {

    private static final Pattern SPEC_PATTERN =
            Pattern.compile("^(?<base>[^:]+)(?::ttl=(?<ttl>\\d+))?(?::max=(?<max>\\d+))?$");
    private static final long MIN_TTL_SECONDS = 1;
    private static final long MAX_TTL_SECONDS = 24 * 60 * 60;

    private final Supplier<Caffeine<Object, Object>> baseBuilderFactory;
    private final long defaultMaximumSize;
    private final Map<String, Cache> cacheMap = new ConcurrentHashMap<>();

    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> baseBuilderFactory) {
        this(baseBuilderFactory, 0);
    }

    /**
     * @param defaultMaximumSize applied to caches whose name has no {@code :max=}; 0 for none
     */
    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> baseBuilderFactory, long defaultMaximumSize) {
        this.baseBuilderFactory = Objects.requireNonNull(baseBuilderFactory, "baseBuilderFactory must not be null");
        this.defaultMaximumSize = defaultMaximumSize;
    }

    @Override
    protected Collection<? extends Cache> loadCaches() {
        return List.of();
    }

    @Override
    protected Cache getMissingCache(String name) {
        return cacheMap.computeIfAbsent(name, this::createCache);
    }

    private Cache createCache(String name) {
        CacheSpec spec = CacheSpec.parse(name);
        Caffeine<Object, Object> builder = baseBuilderFactory.get();
        if (spec.ttl() != null) {
            builder = builder.expireAfterWrite(spec.ttl());
        }
        if (spec.maximumSize() != null) {
            builder = builder.maximumSize(spec.maximumSize());
        } else if (defaultMaximumSize > 0) {
            builder = builder.maximumSize(defaultMaximumSize);
        }
        // full name is the identity, so different TTLs never share a cache
        return new CaffeineCache(name, builder.build());
    }

    record CacheSpec(Duration ttl, Long maximumSize) {

        static CacheSpec parse(String name) {
            if (name == null || name.isBlank()) {
                return new CacheSpec(null, null);
            }
            Matcher m = SPEC_PATTERN.matcher(name.trim());
            if (!m.matches()) {
                return new CacheSpec(null, null);
            }
            Long ttl = parseLong(m.group("ttl"));
            Long max = parseLong(m.group("max"));
            Duration ttlDuration = (ttl == null)
                    ? null
                    : Duration.ofSeconds(Math.max(MIN_TTL_SECONDS, Math.min(MAX_TTL_SECONDS, ttl)));
            return new CacheSpec(ttlDuration, max);
        }

        private static Long parseLong(String group) {
            if (group == null) return null;
            try {
                return Long.parseLong(group);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
    }
}
