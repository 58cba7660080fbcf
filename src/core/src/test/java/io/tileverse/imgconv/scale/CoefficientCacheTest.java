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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CoefficientCacheTest {

    private CoefficientCache cache;

    @BeforeEach
    void setUp() {
        cache = new CoefficientCache(16);
    }

    @Test
    void constructor_nonPositiveSize_throwsException() {
        assertThatThrownBy(() -> new CoefficientCache(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
    }

    @Test
    void get_computesOnceThenHits() {
        List<ScaleCoefficient> first = cache.get(100, 30);
        List<ScaleCoefficient> second = cache.get(100, 30);

        assertThat(second).isSameAs(first);
        assertThat(first).isEqualTo(ScaleCoefficients.compute(100, 30));

        CoefficientCache.CacheStats stats = cache.stats();
        assertThat(stats.missCount()).isEqualTo(1);
        assertThat(stats.hitCount()).isEqualTo(1);
        assertThat(stats.requestCount()).isEqualTo(2);
        assertThat(stats.hitRate()).isEqualTo(0.5);
        assertThat(stats.entryCount()).isEqualTo(1);
    }

    @Test
    void get_distinguishesDirection() {
        assertThat(cache.get(4, 2)).isNotEqualTo(cache.get(2, 4));
        assertThat(cache.stats().missCount()).isEqualTo(2);
    }

    @Test
    void invalidateAll_forcesRecomputation() {
        cache.get(10, 5);
        cache.invalidateAll();
        cache.get(10, 5);
        assertThat(cache.stats().missCount()).isEqualTo(2);
    }

    @Test
    void maximumSize_isReported() {
        assertThat(cache.maximumSize()).isEqualTo(16);
        assertThat(cache.toString()).startsWith("CoefficientCache[maximumSize=16, CacheStats{");
    }

    @Test
    void getDefault_isShared() {
        assertThat(CoefficientCache.getDefault()).isSameAs(CoefficientCache.getDefault());
        assertThat(CoefficientCache.getDefault().maximumSize()).isEqualTo(CoefficientCache.DEFAULT_MAXIMUM_SIZE);
    }
}
