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
package io.tileverse.imgconv.adapters;

import io.tileverse.imgconv.ImageSize;
import io.tileverse.imgconv.PixelColor;
import io.tileverse.imgconv.PixelEncoding;

/**
 * A read-only image addressed by pixel coordinates, as expected by classic
 * whole-image algorithms.
 */
public interface RandomAccessImage {

    /**
     * @return the encoding of the image pixels
     */
    PixelEncoding encoding();

    /**
     * @return the image dimensions
     */
    ImageSize size();

    /**
     * Returns the pixel at {@code (x, y)}.
     * <p>
     * Implementations backed by a stream may not be able to serve every
     * position; they return {@link PixelEncoding#transparent()} instead of
     * failing.
     *
     * @param x column
     * @param y row
     * @return the pixel color
     */
    PixelColor get(int x, int y);
}
