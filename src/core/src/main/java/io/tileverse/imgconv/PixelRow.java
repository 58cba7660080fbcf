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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * A single scanline of pixels in a fixed {@link PixelEncoding}.
 * <p>
 * A row is a mutable, fixed-width window over a primitive array. Its width never
 * changes after construction and every pixel access is bounds-checked against it.
 * {@link #slice(int, int) Slices} are views sharing the storage of their parent
 * row, so writing through a slice modifies the parent.
 * <p>
 * Conversion between encodings is the responsibility of the destination row:
 * {@link #set(int, PixelColor)} and {@link #copyFrom(PixelRow)} accept pixels of
 * any encoding and convert them. Each concrete row type has dedicated fast paths
 * for the pairings that matter to the pipeline (same encoding, 8 and 16 bit
 * variants of the same family, integer and floating point variants of the same
 * family); every other pairing goes through the generic {@link PixelColor} path,
 * so new encodings stay correct without a dedicated fast path.
 * <p>
 * Rows are not thread-safe. They are created by whichever component owns the
 * buffer, typically through {@link RowSource#newRow()}.
 */
public abstract sealed class PixelRow permits Gray8Row, Gray16Row, Rgba32Row, Rgba64Row, FloatPixelRow {

    /** Index of the first pixel of this row within the backing array, in pixels. */
    protected final int offset;

    private final int width;

    /**
     * @param offset first pixel within the backing array
     * @param width row width, in pixels
     */
    PixelRow(int offset, int width) {
        if (width < 0) {
            throw new IllegalArgumentException("Row width cannot be negative: " + width);
        }
        this.offset = offset;
        this.width = width;
    }

    /**
     * Allocates a new row of the given encoding and width, with all channels set to zero.
     *
     * @param encoding pixel encoding
     * @param width row width, in pixels
     * @return the new row
     * @throws IllegalArgumentException if width is negative
     */
    public static PixelRow create(PixelEncoding encoding, int width) {
        requireNonNull(encoding, "encoding cannot be null");
        return switch (encoding) {
            case GRAY8 -> new Gray8Row(width);
            case GRAY16 -> new Gray16Row(width);
            case RGBA32 -> new Rgba32Row(width);
            case RGBA64 -> new Rgba64Row(width);
            case GRAY_F32 -> new GrayF32Row(width);
            case RGBA_F32 -> new RgbaF32Row(width);
        };
    }

    /**
     * @return the encoding of the pixels stored in this row
     */
    public abstract PixelEncoding encoding();

    /**
     * @return the row width, in pixels
     */
    public final int width() {
        return width;
    }

    /**
     * Returns the pixel at the given position.
     *
     * @param x pixel position
     * @return the pixel, as an encoding-neutral color
     * @throws IndexOutOfBoundsException if x is outside {@code [0, width)}
     */
    public final PixelColor get(int x) {
        Objects.checkIndex(x, width);
        return colorAt(offset + x);
    }

    /**
     * Sets the pixel at the given position, converting the color into this row's encoding.
     *
     * @param x pixel position
     * @param color the color
     * @throws IndexOutOfBoundsException if x is outside {@code [0, width)}
     */
    public final void set(int x, PixelColor color) {
        Objects.checkIndex(x, width);
        setColor(offset + x, requireNonNull(color, "color cannot be null"));
    }

    /**
     * Returns a {@code [low, high)} view of this row. The view shares storage with this row.
     *
     * @param low first pixel, inclusive
     * @param high last pixel, exclusive
     * @return the view
     * @throws IndexOutOfBoundsException if the range is not within {@code [0, width]}
     */
    public final PixelRow slice(int low, int high) {
        Objects.checkFromToIndex(low, high, width);
        return view(offset + low, high - low);
    }

    /**
     * Sets every pixel of this row to the given color.
     *
     * @param color the fill color
     */
    public void fill(PixelColor color) {
        requireNonNull(color, "color cannot be null");
        for (int i = offset, end = offset + width; i < end; i++) {
            setColor(i, color);
        }
    }

    /**
     * Copies pixels from another row into this one, converting them into this
     * row's encoding when the encodings differ.
     *
     * @param source the row to copy from
     * @return the number of copied pixels, {@code min(width(), source.width())}
     */
    public final int copyFrom(PixelRow source) {
        requireNonNull(source, "source row cannot be null");
        final int count = Math.min(width, source.width());
        if (count > 0) {
            copyPixels(source, count);
        }
        return count;
    }

    /**
     * Copies {@code count} pixels from the start of {@code source} to the start of
     * this row. Subclasses override it to add fast paths and delegate to this
     * generic implementation for everything else.
     *
     * @param source the row to copy from
     * @param count number of pixels, already clipped to both widths
     */
    void copyPixels(PixelRow source, int count) {
        for (int x = 0; x < count; x++) {
            setColor(offset + x, source.colorAt(source.offset + x));
        }
    }

    /**
     * @param index absolute pixel index in the backing array
     * @return the pixel at that index
     */
    abstract PixelColor colorAt(int index);

    /**
     * @param index absolute pixel index in the backing array
     * @param color the color to convert and store
     */
    abstract void setColor(int index, PixelColor color);

    /**
     * @param offset absolute index of the first pixel of the view
     * @param width view width
     * @return a row sharing this row's backing array
     */
    abstract PixelRow view(int offset, int width);

    @Override
    public String toString() {
        return "%s[width=%d]".formatted(getClass().getSimpleName(), width);
    }
}
