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
 * The closed set of in-memory pixel layouts a {@link PixelRow} can use.
 * <p>
 * Each encoding fixes the number of channels per pixel, the storage size of a
 * channel and the numeric range of its values:
 * <ul>
 * <li>{@link #GRAY8}, {@link #GRAY16}: a single luminance channel, unsigned
 *     8 or 16 bits</li>
 * <li>{@link #RGBA32}, {@link #RGBA64}: red, green, blue and alpha, unsigned
 *     8 or 16 bits per channel</li>
 * <li>{@link #GRAY_F32}, {@link #RGBA_F32}: the floating point accumulation
 *     counterparts, every channel in the range {@code [0.0, 1.0]}</li>
 * </ul>
 * The floating point encodings are used internally by the
 * {@link io.tileverse.imgconv.scale.Scaler} and are never produced by codecs.
 */
public enum PixelEncoding {
    /** 8-bit grayscale. */
    GRAY8(1, 8, false),
    /** 16-bit grayscale. */
    GRAY16(1, 16, false),
    /** 8 bits per channel R-G-B-A. */
    RGBA32(4, 8, false),
    /** 16 bits per channel R-G-B-A. */
    RGBA64(4, 16, false),
    /** Floating point grayscale, in the range [0.0, 1.0]. */
    GRAY_F32(1, 32, true),
    /** Floating point R-G-B-A, every channel in the range [0.0, 1.0]. */
    RGBA_F32(4, 32, true);

    private final int channels;
    private final int bitsPerChannel;
    private final boolean floatingPoint;

    PixelEncoding(int channels, int bitsPerChannel, boolean floatingPoint) {
        this.channels = channels;
        this.bitsPerChannel = bitsPerChannel;
        this.floatingPoint = floatingPoint;
    }

    /**
     * @return the number of channels per pixel (1 for gray, 4 for RGBA)
     */
    public int channels() {
        return channels;
    }

    /**
     * @return the storage size of a single channel, in bits
     */
    public int bitsPerChannel() {
        return bitsPerChannel;
    }

    /**
     * @return {@code true} for the floating point accumulation encodings
     */
    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    /**
     * @return {@code true} if pixels of this encoding carry no color information
     */
    public boolean isGray() {
        return channels == 1;
    }

    /**
     * @return {@code true} if pixels of this encoding carry an alpha channel
     */
    public boolean hasAlpha() {
        return channels == 4;
    }

    /**
     * Returns the floating point encoding of the same family (gray or RGBA),
     * used for accumulation while resampling.
     *
     * @return {@link #GRAY_F32} for gray encodings, {@link #RGBA_F32} otherwise
     */
    public PixelEncoding accumulationEncoding() {
        return switch (this) {
            case GRAY8, GRAY16, GRAY_F32 -> GRAY_F32;
            case RGBA32, RGBA64, RGBA_F32 -> RGBA_F32;
        };
    }

    /**
     * The white point of this encoding, used to fill synthesized areas.
     *
     * @return {@link PixelColor#WHITE}
     */
    public PixelColor white() {
        return PixelColor.WHITE;
    }

    /**
     * The default color returned for pixels that cannot be looked up: fully
     * transparent for RGBA encodings, which reads as black for gray ones.
     *
     * @return the transparent default color, as seen through this encoding
     */
    public PixelColor transparent() {
        return isGray() ? PixelColor.BLACK : PixelColor.TRANSPARENT;
    }
}
