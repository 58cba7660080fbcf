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
package io.tileverse.imgconv.filter;

import static java.util.Objects.requireNonNull;

import io.tileverse.imgconv.AbstractRowSource;
import io.tileverse.imgconv.PixelColor;
import io.tileverse.imgconv.PixelRow;
import io.tileverse.imgconv.Rgba32Row;
import io.tileverse.imgconv.Rgba64Row;
import io.tileverse.imgconv.RgbaF32Row;
import io.tileverse.imgconv.RowSource;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link RowSource} filter that removes the color information of an RGBA
 * source, replacing red, green and blue with the pixel's luma and keeping alpha.
 * <p>
 * The output keeps the RGBA encoding of the source. Gray sources are returned
 * unchanged by {@link #create(RowSource)}.
 */
@Slf4j
public final class GrayscaleFilter extends AbstractRowSource {

    private static final float RED = 0.299f;
    private static final float GREEN = 0.587f;
    private static final float BLUE = 0.114f;

    private final RowSource source;

    private GrayscaleFilter(RowSource source) {
        super(source.encoding(), source.size());
        this.source = source;
    }

    /**
     * @param source the upstream source, closed when the returned source is closed
     * @return a grayscale filter, or {@code source} itself if it is already gray
     */
    public static RowSource create(RowSource source) {
        requireNonNull(source, "source cannot be null");
        if (source.encoding().isGray()) {
            log.debug("GrayscaleFilter: {} source, passing through", source.encoding());
            return source;
        }
        return new GrayscaleFilter(source);
    }

    @Override
    protected int readRow(PixelRow row) throws IOException {
        final int n = source.next(row);
        if (n > 0) {
            toGray(row, n);
        }
        return n;
    }

    static void toGray(PixelRow row, int count) {
        if (row instanceof Rgba32Row rgba) {
            for (int x = 0; x < count; x++) {
                int y = PixelColor.luma(rgba.getChannel(x, 0), rgba.getChannel(x, 1), rgba.getChannel(x, 2));
                rgba.setRgba(x, y, y, y, rgba.getChannel(x, 3));
            }
        } else if (row instanceof Rgba64Row rgba) {
            for (int x = 0; x < count; x++) {
                int y = PixelColor.luma(rgba.getChannel(x, 0), rgba.getChannel(x, 1), rgba.getChannel(x, 2));
                rgba.setRgba(x, y, y, y, rgba.getChannel(x, 3));
            }
        } else if (row instanceof RgbaF32Row rgba) {
            for (int x = 0; x < count; x++) {
                float y = rgba.getChannel(x, 0) * RED + rgba.getChannel(x, 1) * GREEN + rgba.getChannel(x, 2) * BLUE;
                rgba.setChannel(x, 0, y);
                rgba.setChannel(x, 1, y);
                rgba.setChannel(x, 2, y);
            }
        }
        // gray rows carry no color
    }

    @Override
    protected void doClose() throws IOException {
        source.close();
    }
}
