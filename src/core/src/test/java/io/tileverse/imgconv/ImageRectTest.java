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
package io.tileverse.imgconv;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ImageRectTest {

    @Test
    void constructor_swapsReversedEdges() {
        ImageRect rect = new ImageRect(10, 20, 2, 4);
        assertThat(rect).isEqualTo(new ImageRect(2, 4, 10, 20));
        assertThat(rect.width()).isEqualTo(8);
        assertThat(rect.height()).isEqualTo(16);
    }

    @Test
    void of_placesSizeAtOrigin() {
        ImageRect rect = ImageRect.of(-3, 5, new ImageSize(4, 2));
        assertThat(rect).isEqualTo(new ImageRect(-3, 5, 1, 7));
        assertThat(rect.size()).isEqualTo(new ImageSize(4, 2));
    }

    @Test
    void isEmpty_withZeroWidthOrHeight() {
        assertThat(new ImageRect(1, 1, 1, 5).isEmpty()).isTrue();
        assertThat(new ImageRect(1, 1, 5, 1).isEmpty()).isTrue();
        assertThat(new ImageRect(1, 1, 2, 2).isEmpty()).isFalse();
    }

    @Test
    void contains_isHalfOpen() {
        ImageRect rect = new ImageRect(0, 0, 2, 2);
        assertThat(rect.contains(0, 0)).isTrue();
        assertThat(rect.contains(1, 1)).isTrue();
        assertThat(rect.contains(2, 1)).isFalse();
        assertThat(rect.contains(1, 2)).isFalse();
        assertThat(rect.contains(-1, 0)).isFalse();
    }

    @Test
    void intersect_overlappingRectangles() {
        ImageRect a = new ImageRect(0, 0, 10, 10);
        ImageRect b = new ImageRect(-5, 4, 3, 20);
        assertThat(a.intersect(b)).isEqualTo(new ImageRect(0, 4, 3, 10));
        assertThat(b.intersect(a)).isEqualTo(a.intersect(b));
    }

    @Test
    void intersect_disjointRectangles_isEmpty() {
        ImageRect a = new ImageRect(0, 0, 10, 10);
        ImageRect b = new ImageRect(20, 20, 30, 30);
        assertThat(a.intersect(b).isEmpty()).isTrue();
        assertThat(a.intersect(new ImageRect(10, 0, 12, 10)).isEmpty()).isTrue();
    }

    @Test
    void imageSize_negativeDimensions_throwsException() {
        assertThatThrownBy(() -> new ImageSize(-1, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1x3");
    }

    @Test
    void imageSize_boundsAndToString() {
        ImageSize size = new ImageSize(640, 480);
        assertThat(size.bounds()).isEqualTo(new ImageRect(0, 0, 640, 480));
        assertThat(size).hasToString("640x480");
        assertThat(size.isEmpty()).isFalse();
        assertThat(new ImageSize(0, 480).isEmpty()).isTrue();
    }
}
