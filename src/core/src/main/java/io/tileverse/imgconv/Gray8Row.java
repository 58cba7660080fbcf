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

import java.util.Arrays;
import java.util.Objects;

/**
 * A row of 8-bit grayscale pixels, one byte per pixel.
 */
public final class Gray8Row extends PixelRow {

    private final byte[] data;

    Gray8Row(int width) {
        this(new byte[width], 0, width);
    }

    private Gray8Row(byte[] data, int offset, int width) {
        super(offset, width);
        this.data = data;
    }

    @Override
    public PixelEncoding encoding() {
        return PixelEncoding.GRAY8;
    }

    /**
     * @param x pixel position
     * @return the luminance at x, {@code [0, 0xff]}
     */
    public int getGray(int x) {
        Objects.checkIndex(x, width());
        return data[offset + x] & 0xff;
    }

    /**
     * @param x pixel position
     * @param y luminance, truncated to 8 bits
     */
    public void setGray(int x, int y) {
        Objects.checkIndex(x, width());
        data[offset + x] = (byte) y;
    }

    @Override
    public void fill(PixelColor color) {
        Arrays.fill(data, offset, offset + width(), (byte) color.luma8());
    }

    @Override
    void copyPixels(PixelRow source, int count) {
        if (source instanceof Gray8Row src) {
            System.arraycopy(src.data, src.offset, data, offset, count);
        } else if (source instanceof Gray16Row src) {
            for (int x = 0; x < count; x++) {
                data[offset + x] = (byte) (src.gray16(src.offset + x) >> 8);
            }
        } else if (source instanceof GrayF32Row src) {
            for (int x = 0; x < count; x++) {
                data[offset + x] = (byte) PixelColor.floatTo8(src.channel(src.offset + x, 0));
            }
        } else if (source instanceof Rgba32Row src) {
            for (int x = 0; x < count; x++) {
                int i = src.offset + x;
                data[offset + x] = (byte) PixelColor.luma(src.channel(i, 0), src.channel(i, 1), src.channel(i, 2));
            }
        } else {
            super.copyPixels(source, count);
        }
    }

    @Override
    PixelColor colorAt(int index) {
        return PixelColor.gray8(data[index] & 0xff);
    }

    @Override
    void setColor(int index, PixelColor color) {
        data[index] = (byte) color.luma8();
    }

    @Override
    PixelRow view(int offset, int width) {
        return new Gray8Row(data, offset, width);
    }
}
