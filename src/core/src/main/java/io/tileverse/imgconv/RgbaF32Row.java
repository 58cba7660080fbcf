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
 * Floating point R-G-B-A row, four consecutive floats per pixel.
 */
public final class RgbaF32Row extends FloatPixelRow {

    RgbaF32Row(int width) {
        this(new float[width * 4], 0, width);
    }

    private RgbaF32Row(float[] data, int offset, int width) {
        super(data, offset, width, 4);
    }

    @Override
    public PixelEncoding encoding() {
        return PixelEncoding.RGBA_F32;
    }

    @Override
    void copyPixels(PixelRow source, int count) {
        if (source instanceof Rgba32Row src) {
            for (int x = 0; x < count; x++) {
                int d = (offset + x) * 4;
                int i = src.offset + x;
                for (int c = 0; c < 4; c++) {
                    data[d + c] = src.channel(i, c) / 255f;
                }
            }
        } else if (source instanceof Rgba64Row src) {
            for (int x = 0; x < count; x++) {
                int d = (offset + x) * 4;
                int i = src.offset + x;
                for (int c = 0; c < 4; c++) {
                    data[d + c] = src.channel(i, c) / 65535f;
                }
            }
        } else {
            super.copyPixels(source, count);
        }
    }

    @Override
    PixelColor colorAt(int index) {
        int o = index * 4;
        return PixelColor.rgbaFloat(data[o], data[o + 1], data[o + 2], data[o + 3]);
    }

    @Override
    void setColor(int index, PixelColor color) {
        int o = index * 4;
        data[o] = color.r() / 65535f;
        data[o + 1] = color.g() / 65535f;
        data[o + 2] = color.b() / 65535f;
        data[o + 3] = color.a() / 65535f;
    }

    @Override
    PixelRow view(int offset, int width) {
        return new RgbaF32Row(data, offset, width);
    }
}
