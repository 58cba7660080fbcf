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
package io.tileverse.imgconv.scale;

import static java.util.Objects.requireNonNull;

import io.tileverse.imgconv.AbstractRowSource;
import io.tileverse.imgconv.FloatPixelRow;
import io.tileverse.imgconv.ImageSize;
import io.tileverse.imgconv.PixelRow;
import io.tileverse.imgconv.RowSource;
import io.tileverse.imgconv.UnexpectedEndOfStreamException;
import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link RowSource} filter that resamples its upstream source to new
 * dimensions with linear interpolation (upscale) or area averaging (downscale).
 * <p>
 * The scaler is separable. Each source row is first resampled horizontally into
 * a floating point row of the destination width and stored in a small ring of
 * recently read rows. Each output row is then the weighted sum of the ring rows
 * its vertical coefficients refer to. The ring holds
 * {@link ScaleCoefficients#historyDepth(List) historyDepth(vertical)} + 1 rows,
 * which is the most the vertical coefficients ever look back, so the source is
 * read exactly once, top to bottom.
 * <p>
 * All arithmetic is performed in the floating point encoding of the source's
 * family; output rows have the same encoding as the source. An upstream source
 * that ends before its declared height fails the scaler with an
 * {@link UnexpectedEndOfStreamException}, which is sticky like any other error.
 */
@Slf4j
public final class Scaler extends AbstractRowSource {

    private final RowSource source;

    private final List<ScaleCoefficient> horizontal;
    private final List<ScaleCoefficient> vertical;

    private final FloatPixelRow importRow;
    private final FloatPixelRow[] history;
    private final FloatPixelRow accumulator;

    /** index of the next vertical coefficient to apply */
    private int verticalPos;

    /** number of source rows pulled and resampled so far */
    private int sourceRows;

    private Scaler(RowSource source, ImageSize size, CoefficientCache cache) {
        super(source.encoding(), size);
        this.source = source;
        final ImageSize sourceSize = source.size();
        this.horizontal = cache.get(sourceSize.width(), size.width());
        this.vertical = cache.get(sourceSize.height(), size.height());

        final var accumulation = source.encoding().accumulationEncoding();
        this.importRow = (FloatPixelRow) PixelRow.create(accumulation, sourceSize.width());
        this.accumulator = (FloatPixelRow) PixelRow.create(accumulation, size.width());
        this.history = new FloatPixelRow[ScaleCoefficients.historyDepth(vertical) + 1];
        for (int i = 0; i < history.length; i++) {
            history[i] = (FloatPixelRow) PixelRow.create(accumulation, size.width());
        }
    }

    /**
     * Creates a scaler using the {@link CoefficientCache#getDefault() default coefficient cache}.
     *
     * @param source the upstream source, closed when the returned source is closed
     * @param width destination width
     * @param height destination height
     * @return a scaling source, or {@code source} itself if the dimensions are unchanged
     * @throws IllegalArgumentException if a destination dimension is not positive or the source is empty
     * @see #create(RowSource, int, int, CoefficientCache)
     */
    public static RowSource create(RowSource source, int width, int height) {
        return create(source, width, height, CoefficientCache.getDefault());
    }

    /**
     * Creates a scaler.
     *
     * @param source the upstream source, closed when the returned source is closed
     * @param width destination width
     * @param height destination height
     * @param cache where to look coefficients up
     * @return a scaling source, or {@code source} itself if the dimensions are unchanged
     * @throws IllegalArgumentException if a destination dimension is not positive or the source is empty
     */
    public static RowSource create(RowSource source, int width, int height, CoefficientCache cache) {
        requireNonNull(source, "source cannot be null");
        requireNonNull(cache, "coefficient cache cannot be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid scale target dimensions: " + width + "x" + height);
        }
        final ImageSize sourceSize = source.size();
        if (sourceSize.isEmpty()) {
            throw new IllegalArgumentException("Cannot scale an empty image: " + sourceSize);
        }
        final ImageSize size = new ImageSize(width, height);
        if (sourceSize.equals(size)) {
            log.debug("Scaler: {} unchanged, passing source through", size);
            return source;
        }
        log.debug("Scaler: {} -> {} ({})", sourceSize, size, source.encoding());
        return new Scaler(source, size, cache);
    }

    @Override
    protected int readRow(PixelRow row) throws IOException {
        final int dest = vertical.get(verticalPos).destIndex();
        accumulator.clear();
        while (verticalPos < vertical.size() && vertical.get(verticalPos).destIndex() == dest) {
            ScaleCoefficient c = vertical.get(verticalPos++);
            accumulator.addScaled(historyRow(c.sourceIndex()), c.weight());
        }
        return row.copyFrom(accumulator);
    }

    /**
     * Returns the horizontally resampled source row, pulling rows from upstream until it is available.
     */
    private FloatPixelRow historyRow(int sourceIndex) throws IOException {
        while (sourceRows <= sourceIndex) {
            pull();
        }
        assert sourceIndex > sourceRows - 1 - history.length;
        return history[sourceIndex % history.length];
    }

    private void pull() throws IOException {
        if (source.next(importRow) == END_OF_STREAM) {
            throw UnexpectedEndOfStreamException.truncated(
                    sourceRows, source.size().height());
        }
        FloatPixelRow target = history[sourceRows % history.length];
        target.clear();
        for (ScaleCoefficient c : horizontal) {
            target.accumulate(c.destIndex(), importRow, c.sourceIndex(), c.weight());
        }
        sourceRows++;
    }

    @Override
    protected void doClose() throws IOException {
        source.close();
    }
}
