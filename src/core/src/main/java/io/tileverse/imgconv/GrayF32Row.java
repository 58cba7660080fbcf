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
 * Floating point grayscale row.
 */
public final class GrayF32Row extends FloatPixelRow {

    GrayF32Row(int width) {
        this(new float[width], 0, width);
    }

    private GrayF32Row(float[] data, int offset, int width) {
        super(data, offset, width, 1);
    }

    @Override
    public PixelEncoding encoding() {
        return PixelEncoding.GRAY_F32;
    }

    @Override
    void copyPixels(PixelRow source, int count) {
        if (source instanceof Gray8Row src) {
            for (int x = 0; x < count; x++) {
                data[offset + x] = src.getGray(x) / 255f;
            }
        } else if (source instanceof Gray16Row src) {
            for (int x = 0; x < count; x++) {
                data[offset + x] = src.gray16(src.offset + x) / 65535f;
            }
        } else {
            super.copyPixels(source, count);
        }
    }

    @Override
    PixelColor colorAt(int index) {
        return PixelColor.gray16(PixelColor.floatTo16(data[index]));
    }

    @Override
    void setColor(int index, PixelColor color) {
        data[index] = color.luma16() / 65535f;
    }

    @Override
    PixelRow view(int offset, int width) {
        return new GrayF32Row(data, offset, width);
    }
}
