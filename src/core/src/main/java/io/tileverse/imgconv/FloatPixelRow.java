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
 * Base class of the floating point rows used to accumulate weighted pixel sums
 * while resampling.
 * <p>
 * Every channel is a {@code float} nominally in {@code [0.0, 1.0]}. Values may
 * leave that range temporarily while accumulating; they are clamped when
 * converted back to an integer encoding.
 */
public abstract sealed class FloatPixelRow extends PixelRow permits GrayF32Row, RgbaF32Row {

    final float[] data;

    private final int channels;

    FloatPixelRow(float[] data, int offset, int width, int channels) {
        super(offset, width);
        this.data = data;
        this.channels = channels;
    }

    /**
     * @param x pixel position
     * @param c channel index, {@code [0, encoding().channels())}
     * @return the channel value
     */
    public float getChannel(int x, int c) {
        Objects.checkIndex(x, width());
        return channel(offset + x, Objects.checkIndex(c, channels));
    }

    /**
     * @param x pixel position
     * @param c channel index, {@code [0, encoding().channels())}
     * @param value the new channel value
     */
    public void setChannel(int x, int c, float value) {
        Objects.checkIndex(x, width());
        data[(offset + x) * channels + Objects.checkIndex(c, channels)] = value;
    }

    /**
     * Sets every channel of every pixel to zero.
     */
    public void clear() {
        Arrays.fill(data, offset * channels, (offset + width()) * channels, 0f);
    }

    /**
     * Adds {@code source[sourceX] * weight} to the pixel at {@code x}.
     *
     * @param x destination pixel
     * @param source row to read from, of the same encoding
     * @param sourceX source pixel
     * @param weight contribution weight
     */
    public void accumulate(int x, FloatPixelRow source, int sourceX, float weight) {
        checkSameEncoding(source);
        Objects.checkIndex(x, width());
        Objects.checkIndex(sourceX, source.width());
        final int d = (offset + x) * channels;
        final int s = (source.offset + sourceX) * channels;
        for (int c = 0; c < channels; c++) {
            data[d + c] += source.data[s + c] * weight;
        }
    }

    /**
     * Adds {@code source * weight} to this row, pixel by pixel.
     *
     * @param source row to read from, of the same encoding
     * @param weight contribution weight
     */
    public void addScaled(FloatPixelRow source, float weight) {
        checkSameEncoding(source);
        final int n = Math.min(width(), source.width()) * channels;
        final int d = offset * channels;
        final int s = source.offset * channels;
        for (int i = 0; i < n; i++) {
            data[d + i] += source.data[s + i] * weight;
        }
    }

    private void checkSameEncoding(FloatPixelRow source) {
        if (source.encoding() != encoding()) {
            throw new IllegalArgumentException(
                    "Cannot accumulate " + source.encoding() + " pixels into a " + encoding() + " row");
        }
    }

    @Override
    void copyPixels(PixelRow source, int count) {
        if (source.encoding() == encoding()) {
            FloatPixelRow src = (FloatPixelRow) source;
            System.arraycopy(src.data, src.offset * channels, data, offset * channels, count * channels);
        } else {
            super.copyPixels(source, count);
        }
    }

    float channel(int index, int c) {
        return data[index * channels + c];
    }
}
