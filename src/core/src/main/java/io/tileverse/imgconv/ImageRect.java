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
 * A half-open rectangle {@code [minX, maxX) x [minY, maxY)} in image coordinates.
 * <p>
 * The rectangle is canonical: if a minimum exceeds its maximum the two are
 * swapped on construction. Coordinates may be negative or extend beyond an
 * image, which is how a {@link io.tileverse.imgconv.resize.Resizer} expresses
 * padding.
 *
 * @param minX left edge, inclusive
 * @param minY top edge, inclusive
 * @param maxX right edge, exclusive
 * @param maxY bottom edge, exclusive
 */
public record ImageRect(int minX, int minY, int maxX, int maxY) {

    /**
     * Canonicalises the rectangle.
     *
     * @param minX left edge
     * @param minY top edge
     * @param maxX right edge
     * @param maxY bottom edge
     */
    public ImageRect {
        if (minX > maxX) {
            int t = minX;
            minX = maxX;
            maxX = t;
        }
        if (minY > maxY) {
            int t = minY;
            minY = maxY;
            maxY = t;
        }
    }

    /**
     * @param x left edge
     * @param y top edge
     * @param size rectangle size
     * @return the rectangle of the given size with its origin at {@code (x, y)}
     */
    public static ImageRect of(int x, int y, ImageSize size) {
        return new ImageRect(x, y, x + size.width(), y + size.height());
    }

    /**
     * @return {@code maxX - minX}
     */
    public int width() {
        return maxX - minX;
    }

    /**
     * @return {@code maxY - minY}
     */
    public int height() {
        return maxY - minY;
    }

    /**
     * @return the width and height of this rectangle
     */
    public ImageSize size() {
        return new ImageSize(width(), height());
    }

    /**
     * @return {@code true} if the rectangle contains no pixels
     */
    public boolean isEmpty() {
        return minX == maxX || minY == maxY;
    }

    /**
     * @param x column
     * @param y row
     * @return {@code true} if the pixel lies within this rectangle
     */
    public boolean contains(int x, int y) {
        return x >= minX && x < maxX && y >= minY && y < maxY;
    }

    /**
     * Returns the intersection of two rectangles. Disjoint rectangles intersect
     * in an empty rectangle.
     *
     * @param other the other rectangle
     * @return the intersection
     */
    public ImageRect intersect(ImageRect other) {
        int x0 = Math.max(minX, other.minX);
        int y0 = Math.max(minY, other.minY);
        int x1 = Math.min(maxX, other.maxX);
        int y1 = Math.min(maxY, other.maxY);
        if (x0 >= x1 || y0 >= y1) {
            return new ImageRect(x0, y0, x0, y0);
        }
        return new ImageRect(x0, y0, x1, y1);
    }
}
