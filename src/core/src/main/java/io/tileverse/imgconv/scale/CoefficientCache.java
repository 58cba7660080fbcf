/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.imgconv.scale;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * A bounded in-memory cache of {@link ScaleCoefficients#compute(int, int)
 * coefficient lists}, keyed by {@code (sourceLen, destLen)}.
 * <p>
 * Pipelines processing pages of the same size repeatedly scale between the
 * same dimensions; the coefficient lists are immutable, so they are shared
 * between all {@link Scaler scalers} through this cache. Entries are evicted
 * by Caffeine's size-based policy.
 */
@Slf4j
public class CoefficientCache {

    /** Default maximum number of cached coefficient lists. */
    public static final int DEFAULT_MAXIMUM_SIZE = 64;

    private static final CoefficientCache DEFAULT = new CoefficientCache(DEFAULT_MAXIMUM_SIZE);

    private final Cache<Key, List<ScaleCoefficient>> cache;

    private final long maximumSize;

    private record Key(int sourceLen, int destLen) {}

    /**
     * @param maximumSize the maximum number of cached coefficient lists
     * @throws IllegalArgumentException if maximumSize is not positive
     */
    public CoefficientCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("Maximum size must be positive: " + maximumSize);
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder().maximumSize(maximumSize).recordStats().build();
    }

    /**
     * @return the shared cache, holding up to {@link #DEFAULT_MAXIMUM_SIZE} entries
     */
    public static CoefficientCache getDefault() {
        return DEFAULT;
    }

    /**
     * Returns the coefficients for the given axis lengths, computing them on a miss.
     *
     * @param sourceLen number of source samples
     * @param destLen number of destination samples
     * @return the immutable coefficient list
     */
    public List<ScaleCoefficient> get(int sourceLen, int destLen) {
        return cache.get(new Key(sourceLen, destLen), key -> {
            log.trace("Computing scale coefficients {} -> {}", key.sourceLen(), key.destLen());
            return ScaleCoefficients.compute(key.sourceLen(), key.destLen());
        });
    }

    /**
     * @return the configured maximum number of entries
     */
    public long maximumSize() {
        return maximumSize;
    }

    /**
     * @return a snapshot of the cache statistics
     */
    public CacheStats stats() {
        return CacheStats.fromCaffeine(cache.stats(), cache.estimatedSize());
    }

    /**
     * Discards all cached entries.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public String toString() {
        return "CoefficientCache[maximumSize=" + maximumSize + ", " + stats() + "]";
    }

    /**
     * Coefficient cache statistics.
     *
     * @param hitCount number of lookups served from the cache
     * @param missCount number of lookups that computed the coefficients
     * @param evictionCount number of evicted entries
     * @param entryCount current number of entries
     * @param hitRate {@code hitCount / (hitCount + missCount)}, 1.0 when there were no requests
     */
    public record CacheStats(long hitCount, long missCount, long evictionCount, long entryCount, double hitRate) {

        static CacheStats fromCaffeine(com.github.benmanes.caffeine.cache.stats.CacheStats stats, long entryCount) {
            return new CacheStats(
                    stats.hitCount(), stats.missCount(), stats.evictionCount(), entryCount, stats.hitRate());
        }

        /**
         * @return {@code hitCount + missCount}
         */
        public long requestCount() {
            return hitCount + missCount;
        }

        @Override
        public String toString() {
            return String.format(
                    "CacheStats{entries=%d, hitRate=%.2f%%, hits=%d, misses=%d, evictions=%d}",
                    entryCount, hitRate * 100.0, hitCount, missCount, evictionCount);
        }
    }
}
