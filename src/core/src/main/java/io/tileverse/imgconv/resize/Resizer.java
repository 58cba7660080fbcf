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
package io.tileverse.imgconv.resize;

import static java.util.Objects.requireNonNull;

import io.tileverse.imgconv.AbstractRowSource;
import io.tileverse.imgconv.ImageRect;
import io.tileverse.imgconv.ImageSize;
import io.tileverse.imgconv.PixelColor;
import io.tileverse.imgconv.PixelRow;
import io.tileverse.imgconv.RowSource;
import io.tileverse.imgconv.UnexpectedEndOfStreamException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link RowSource} filter that crops and pads its upstream source to an
 * arbitrary rectangle, expressed in source coordinates.
 * <p>
 * The output has the size of the rectangle. Output pixels that fall outside
 * the source image are filled with the encoding's {@link PixelColor#WHITE
 * white point}. Output rows that don't overlap the source at all are
 * synthesized without consuming source rows; source rows above the rectangle
 * are skipped on the first overlapping read, and source rows below it are
 * never read.
 * <p>
 * For example, {@code new ImageRect(-10, -10, w + 10, h + 10)} adds a 10 pixel
 * white border around a {@code w x h} image, and {@code new ImageRect(0, 0,
 * w / 2, h / 2)} keeps its upper-left quarter.
 */
@Slf4j
public final class Resizer extends AbstractRowSource {

    private final RowSource source;
    private final ImageRect rect;

    /** overlap of the rectangle with the source bounds, in source coordinates */
    private final ImageRect overlap;

    /** full-width source row */
    private final PixelRow sourceRow;

    private final PixelColor fill;

    private int skip;

    private Resizer(RowSource source, ImageRect rect) {
        super(source.encoding(), rect.size());
        this.source = source;
        this.rect = rect;
        this.overlap = rect.intersect(source.size().bounds());
        this.sourceRow = source.newRow();
        this.fill = source.encoding().white();
        this.skip = Math.max(0, rect.minY());
    }

    /**
     * Creates a resizer.
     *
     * @param source the upstream source, closed when the returned source is closed
     * @param rect the output rectangle, in source coordinates
     * @return a resizing source, or {@code source} itself if {@code rect} equals the source bounds
     * @throws IllegalArgumentException if the rectangle is empty
     */
    public static RowSource create(RowSource source, ImageRect rect) {
        requireNonNull(source, "source cannot be null");
        requireNonNull(rect, "rect cannot be null");
        if (rect.isEmpty()) {
            throw new IllegalArgumentException("Cannot resize to an empty rectangle: " + rect);
        }
        if (rect.equals(source.size().bounds())) {
            log.debug("Resizer: {} equals the source bounds, passing source through", rect);
            return source;
        }
        log.debug("Resizer: {} -> {}", source.size(), rect);
        return new Resizer(source, rect);
    }

    /**
     * @return the output rectangle, in source coordinates
     */
    public ImageRect rect() {
        return rect;
    }

    @Override
    protected int readRow(PixelRow row) throws IOException {
        final int width = Math.min(size().width(), row.width());
        final PixelRow out = row.slice(0, width);
        final int sourceY = rowsRead() + rect.minY();

        if (overlap.isEmpty() || sourceY < overlap.minY() || sourceY >= overlap.maxY()) {
            out.fill(fill);
            return width;
        }

        while (skip > 0) {
            readSource();
            skip--;
        }
        readSource();

        // output x of the first and last overlapping pixels, clipped to the row
        final int lo = Math.min(width, overlap.minX() - rect.minX());
        final int hi = Math.min(width, overlap.maxX() - rect.minX());
        out.slice(0, lo).fill(fill);
        if (lo < hi) {
            out.slice(lo, hi).copyFrom(sourceRow.slice(overlap.minX(), overlap.minX() + hi - lo));
        }
        out.slice(hi, width).fill(fill);
        return width;
    }

    private void readSource() throws IOException {
        if (source.next(sourceRow) == END_OF_STREAM) {
            throw new UnexpectedEndOfStreamException("Source ended before row " + (rowsRead() + rect.minY()));
        }
    }

    @Override
    protected void doClose() throws IOException {
        source.close();
    }
}
