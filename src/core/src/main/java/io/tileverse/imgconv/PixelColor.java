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
 * Encoding-neutral color used to exchange pixels between rows of different
 * {@link PixelEncoding encodings}.
 * <p>
 * Channels are non-premultiplied and stored with 16 bits of precision, so every
 * encoding can be converted to and from a {@code PixelColor} without loss.
 *
 * @param r red, {@code [0, 0xffff]}
 * @param g green, {@code [0, 0xffff]}
 * @param b blue, {@code [0, 0xffff]}
 * @param a alpha, {@code [0, 0xffff]}
 */
public record PixelColor(int r, int g, int b, int a) {

    /** Maximum channel value. */
    public static final int MAX = 0xffff;

    /** Opaque white. */
    public static final PixelColor WHITE = new PixelColor(MAX, MAX, MAX, MAX);

    /** Opaque black. */
    public static final PixelColor BLACK = new PixelColor(0, 0, 0, MAX);

    /** Fully transparent black. */
    public static final PixelColor TRANSPARENT = new PixelColor(0, 0, 0, 0);

    /**
     * Validates the channel ranges.
     *
     * @param r red
     * @param g green
     * @param b blue
     * @param a alpha
     */
    public PixelColor {
        checkChannel(r, "r");
        checkChannel(g, "g");
        checkChannel(b, "b");
        checkChannel(a, "a");
    }

    private static void checkChannel(int value, String name) {
        if (value < 0 || value > MAX) {
            throw new IllegalArgumentException("Channel " + name + " out of range: " + value);
        }
    }

    /**
     * Creates an opaque gray color from an 8-bit luminance value.
     *
     * @param y luminance, {@code [0, 0xff]}
     * @return the color
     */
    public static PixelColor gray8(int y) {
        int v = expand8(y);
        return new PixelColor(v, v, v, MAX);
    }

    /**
     * Creates an opaque gray color from a 16-bit luminance value.
     *
     * @param y luminance, {@code [0, 0xffff]}
     * @return the color
     */
    public static PixelColor gray16(int y) {
        return new PixelColor(y, y, y, MAX);
    }

    /**
     * Creates a color from 8-bit channels.
     *
     * @param r red
     * @param g green
     * @param b blue
     * @param a alpha
     * @return the color
     */
    public static PixelColor rgba8(int r, int g, int b, int a) {
        return new PixelColor(expand8(r), expand8(g), expand8(b), expand8(a));
    }

    /**
     * Creates a color from 16-bit channels.
     *
     * @param r red
     * @param g green
     * @param b blue
     * @param a alpha
     * @return the color
     */
    public static PixelColor rgba16(int r, int g, int b, int a) {
        return new PixelColor(r, g, b, a);
    }

    /**
     * Creates a color from floating point channels, clamping them to {@code [0.0, 1.0]}.
     *
     * @param r red
     * @param g green
     * @param b blue
     * @param a alpha
     * @return the color
     */
    public static PixelColor rgbaFloat(float r, float g, float b, float a) {
        return new PixelColor(floatTo16(r), floatTo16(g), floatTo16(b), floatTo16(a));
    }

    /**
     * Computes the 16-bit luma of this color with the 0.299/0.587/0.114 weights,
     * in the exact integer form {@code (19595R + 38470G + 7471B + 32768) >> 16}.
     *
     * @return luma, {@code [0, 0xffff]}
     */
    public int luma16() {
        return luma(r, g, b);
    }

    /**
     * @return the 8-bit luma of this color
     */
    public int luma8() {
        return luma16() >> 8;
    }

    /**
     * @return the red channel truncated to 8 bits
     */
    public int r8() {
        return r >> 8;
    }

    /**
     * @return the green channel truncated to 8 bits
     */
    public int g8() {
        return g >> 8;
    }

    /**
     * @return the blue channel truncated to 8 bits
     */
    public int b8() {
        return b >> 8;
    }

    /**
     * @return the alpha channel truncated to 8 bits
     */
    public int a8() {
        return a >> 8;
    }

    /**
     * Returns this color with all color channels replaced by its luma. Alpha is kept.
     *
     * @return the gray version of this color
     */
    public PixelColor toGray() {
        int y = luma16();
        return new PixelColor(y, y, y, a);
    }

    /**
     * Luma of 8- or 16-bit channels. The weights sum up to 65536, so the result
     * has the same precision as the inputs.
     *
     * @param r red
     * @param g green
     * @param b blue
     * @return the luma
     */
    public static int luma(int r, int g, int b) {
        return (int) ((19595L * r + 38470L * g + 7471L * b + 32768L) >> 16);
    }

    /**
     * Expands an 8-bit value to 16 bits by bit replication.
     *
     * @param v 8-bit value
     * @return 16-bit value
     */
    public static int expand8(int v) {
        return (v & 0xff) * 0x101;
    }

    /**
     * Converts a floating point intensity into the 8-bit range, clamping out of range values.
     *
     * @param f intensity
     * @return 8-bit value
     */
    public static int floatTo8(float f) {
        if (!(f > 0f)) {
            return 0;
        }
        if (f >= 1f) {
            return 0xff;
        }
        return Math.round(f * 0xff);
    }

    /**
     * Converts a floating point intensity into the 16-bit range, clamping out of range values.
     *
     * @param f intensity
     * @return 16-bit value
     */
    public static int floatTo16(float f) {
        if (!(f > 0f)) {
            return 0;
        }
        if (f >= 1f) {
            return MAX;
        }
        return Math.round(f * MAX);
    }
}
