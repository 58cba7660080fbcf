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

/**
 * Dimensions of an image, in pixels.
 *
 * @param width image width
 * @param height image height, the number of rows of a stream
 */
public record ImageSize(int width, int height) {

    /**
     * @param width image width
     * @param height image height
     * @throws IllegalArgumentException if either dimension is negative
     */
    public ImageSize {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image dimensions cannot be negative: " + width + "x" + height);
        }
    }

    /**
     * @return {@code true} if the image has no pixels
     */
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * @return the {@code [0, 0, width, height)} rectangle
     */
    public ImageRect bounds() {
        return new ImageRect(0, 0, width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
