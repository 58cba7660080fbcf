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
 * A row of 16-bit grayscale pixels.
 * <p>
 * Values are stored in a {@code short[]} and treated as unsigned.
 */
public final class Gray16Row extends PixelRow {

    private final short[] data;

    Gray16Row(int width) {
        this(new short[width], 0, width);
    }

    private Gray16Row(short[] data, int offset, int width) {
        super(offset, width);
        this.data = data;
    }

    @Override
    public PixelEncoding encoding() {
        return PixelEncoding.GRAY16;
    }

    /**
     * @param x pixel position
     * @return the luminance at x, {@code [0, 0xffff]}
     */
    public int getGray(int x) {
        Objects.checkIndex(x, width());
        return gray16(offset + x);
    }

    /**
     * @param x pixel position
     * @param y luminance, truncated to 16 bits
     */
    public void setGray(int x, int y) {
        Objects.checkIndex(x, width());
        data[offset + x] = (short) y;
    }

    @Override
    public void fill(PixelColor color) {
        Arrays.fill(data, offset, offset + width(), (short) color.luma16());
    }

    @Override
    void copyPixels(PixelRow source, int count) {
        if (source instanceof Gray16Row src) {
            System.arraycopy(src.data, src.offset, data, offset, count);
        } else if (source instanceof Gray8Row src) {
            for (int x = 0; x < count; x++) {
                data[offset + x] = (short) PixelColor.expand8(src.getGray(x));
            }
        } else if (source instanceof GrayF32Row src) {
            for (int x = 0; x < count; x++) {
                data[offset + x] = (short) PixelColor.floatTo16(src.channel(src.offset + x, 0));
            }
        } else if (source instanceof Rgba64Row src) {
            for (int x = 0; x < count; x++) {
                int i = src.offset + x;
                data[offset + x] = (short) PixelColor.luma(src.channel(i, 0), src.channel(i, 1), src.channel(i, 2));
            }
        } else {
            super.copyPixels(source, count);
        }
    }

    int gray16(int index) {
        return data[index] & 0xffff;
    }

    @Override
    PixelColor colorAt(int index) {
        return PixelColor.gray16(gray16(index));
    }

    @Override
    void setColor(int index, PixelColor color) {
        data[index] = (short) color.luma16();
    }

    @Override
    PixelRow view(int offset, int width) {
        return new Gray16Row(data, offset, width);
    }
}
