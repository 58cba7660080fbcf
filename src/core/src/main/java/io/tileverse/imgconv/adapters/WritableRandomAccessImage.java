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

import io.tileverse.imgconv.PixelColor;
import java.io.IOException;

/**
 * A {@link RandomAccessImage} that can also be written to.
 */
public interface WritableRandomAccessImage extends RandomAccessImage {

    /**
     * Sets the pixel at {@code (x, y)}. Positions the image cannot store are ignored.
     *
     * @param x column
     * @param y row
     * @param color the new color
     */
    void set(int x, int y, PixelColor color);

    /**
     * Completes the image, making every written pixel visible to its consumer.
     *
     * @throws IOException if the image cannot be completed
     */
    void flush() throws IOException;
}
