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
package io.tileverse.imgconv.transform;

import io.tileverse.imgconv.adapters.RandomAccessImage;
import io.tileverse.imgconv.adapters.WritableRandomAccessImage;

/**
 * A whole-image algorithm written against random-access images, run by a
 * {@link Transformer}.
 * <p>
 * The source only retains a window of recent rows and the target only buffers
 * a window of rows that can still change, so the algorithm should visit both
 * roughly top to bottom. Pixels it cannot reach read as the transparent color,
 * and pixels it sets too late are dropped.
 */
@FunctionalInterface
public interface ImageTransform {

    /**
     * Renders {@code target} from {@code source}.
     *
     * @param target the destination image
     * @param source the source image
     */
    void transform(WritableRandomAccessImage target, RandomAccessImage source);

    /**
     * A transform copying the overlapping area of source and target, pixel by pixel.
     *
     * @return the copying transform
     */
    static ImageTransform copy() {
        return (target, source) -> {
            final int width = Math.min(target.size().width(), source.size().width());
            final int height = Math.min(target.size().height(), source.size().height());
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    target.set(x, y, source.get(x, y));
                }
            }
        };
    }
}
