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

import java.util.Objects;

/**
 * A row of R-G-B-A pixels with 16 bits per channel, stored as four consecutive
 * unsigned {@code short} values per pixel.
 */
public final class Rgba64Row extends PixelRow {

    private final short[] data;

    Rgba64Row(int width) {
        this(new short[width * 4], 0, width);
    }

    private Rgba64Row(short[] data, int offset, int width) {
        super(offset, width);
        this.data = data;
    }

    @Override
    public PixelEncoding encoding() {
        return PixelEncoding.RGBA64;
    }

    /**
     * @param x pixel position
     * @param c channel: 0 red, 1 green, 2 blue, 3 alpha
     * @return the channel value, {@code [0, 0xffff]}
     */
    public int getChannel(int x, int c) {
        Objects.checkIndex(x, width());
        return channel(offset + x, Objects.checkIndex(c, 4));
    }

    /**
     * Sets all channels of a pixel at once.
     *
     * @param x pixel position
     * @param r red
     * @param g green
     * @param b blue
     * @param a alpha
     */
    public void setRgba(int x, int r, int g, int b, int a) {
        Objects.checkIndex(x, width());
        store(offset + x, r, g, b, a);
    }

    @Override
    void copyPixels(PixelRow source, int count) {
        if (source instanceof Rgba64Row src) {
            System.arraycopy(src.data, src.offset * 4, data, offset * 4, count * 4);
        } else if (source instanceof Rgba32Row src) {
            for (int x = 0; x < count; x++) {
                int i = src.offset + x;
                store(
                        offset + x,
                        PixelColor.expand8(src.channel(i, 0)),
                        PixelColor.expand8(src.channel(i, 1)),
                        PixelColor.expand8(src.channel(i, 2)),
                        PixelColor.expand8(src.channel(i, 3)));
            }
        } else if (source instanceof RgbaF32Row src) {
            for (int x = 0; x < count; x++) {
                int i = src.offset + x;
                store(
                        offset + x,
                        PixelColor.floatTo16(src.channel(i, 0)),
                        PixelColor.floatTo16(src.channel(i, 1)),
                        PixelColor.floatTo16(src.channel(i, 2)),
                        PixelColor.floatTo16(src.channel(i, 3)));
            }
        } else if (source instanceof Gray16Row src) {
            for (int x = 0; x < count; x++) {
                int y = src.gray16(src.offset + x);
                store(offset + x, y, y, y, PixelColor.MAX);
            }
        } else {
            super.copyPixels(source, count);
        }
    }

    int channel(int index, int c) {
        return data[index * 4 + c] & 0xffff;
    }

    private void store(int index, int r, int g, int b, int a) {
        int o = index * 4;
        data[o] = (short) r;
        data[o + 1] = (short) g;
        data[o + 2] = (short) b;
        data[o + 3] = (short) a;
    }

    @Override
    PixelColor colorAt(int index) {
        return PixelColor.rgba16(channel(index, 0), channel(index, 1), channel(index, 2), channel(index, 3));
    }

    @Override
    void setColor(int index, PixelColor color) {
        store(index, color.r(), color.g(), color.b(), color.a());
    }

    @Override
    PixelRow view(int offset, int width) {
        return new Rgba64Row(data, offset, width);
    }
}
