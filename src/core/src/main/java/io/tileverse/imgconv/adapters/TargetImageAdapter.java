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
package io.tileverse.imgconv.adapters;

import static java.util.Objects.requireNonNull;

import io.tileverse.imgconv.ImageSize;
import io.tileverse.imgconv.PixelColor;
import io.tileverse.imgconv.PixelEncoding;
import io.tileverse.imgconv.PixelRow;
import io.tileverse.imgconv.RowSink;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Exposes a {@link RowSink} as a {@link WritableRandomAccessImage}, buffering a
 * window of rows that can still be modified.
 * <p>
 * The window starts at row 0 and covers {@code window} consecutive rows, all
 * initialized to the encoding's {@link PixelEncoding#transparent() transparent}
 * color. Setting a pixel below the window slides it down: the rows that leave
 * it at the top are written to the sink, in order, and can no longer change.
 * Pixels set above the window or outside the image are ignored.
 * {@link #flush()} writes every remaining row through the image height and
 * closes the sink.
 * <p>
 * {@link #get(int, int)} returns the buffered value of pixels within the window
 * and the transparent color anywhere else.
 * <p>
 * A failure of the sink is recorded, stops any further writes, and is rethrown
 * by {@link #flush()}.
 */
@Slf4j
public class TargetImageAdapter implements WritableRandomAccessImage {

    /** Default number of buffered rows. */
    public static final int DEFAULT_WINDOW = SourceImageAdapter.DEFAULT_WINDOW;

    private final RowSink sink;

    private final PixelRow[] rows;

    private final PixelColor background;

    /** y of the first row of the window; every row above it has been written */
    private int baseY;

    private IOException error;

    private boolean flushed;

    /**
     * Creates an adapter with the {@link #DEFAULT_WINDOW default window}.
     *
     * @param sink the row sink; closed by {@link #flush()}
     */
    public TargetImageAdapter(RowSink sink) {
        this(sink, DEFAULT_WINDOW);
    }

    /**
     * @param sink the row sink; closed by {@link #flush()}
     * @param window number of buffered rows
     * @throws IllegalArgumentException if window is not positive
     */
    public TargetImageAdapter(RowSink sink, int window) {
        this.sink = requireNonNull(sink, "sink cannot be null");
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.background = sink.encoding().transparent();
        this.rows = new PixelRow[window];
        for (int i = 0; i < window; i++) {
            rows[i] = PixelRow.create(sink.encoding(), sink.size().width());
            rows[i].fill(background);
        }
    }

    @Override
    public PixelEncoding encoding() {
        return sink.encoding();
    }

    @Override
    public ImageSize size() {
        return sink.size();
    }

    /**
     * @return the number of buffered rows
     */
    public int window() {
        return rows.length;
    }

    @Override
    public PixelColor get(int x, int y) {
        if (inBounds(x, y) && y >= baseY && y < baseY + rows.length) {
            return rows[y % rows.length].get(x);
        }
        return background;
    }

    @Override
    public void set(int x, int y, PixelColor color) {
        requireNonNull(color, "color cannot be null");
        if (!inBounds(x, y) || y < baseY || error != null || flushed) {
            return;
        }
        if (y >= baseY + rows.length) {
            advance(y - rows.length + 1);
            if (error != null) {
                return;
            }
        }
        rows[y % rows.length].set(x, color);
    }

    /**
     * Writes all rows not written yet, up to the image height, and closes the
     * sink. Subsequent calls have no effect.
     *
     * @throws IOException the error that made the sink fail, if any
     */
    @Override
    public void flush() throws IOException {
        if (flushed) {
            return;
        }
        flushed = true;
        try {
            advance(size().height());
        } finally {
            sink.close();
        }
        if (error != null) {
            throw error;
        }
    }

    /**
     * @return the error that made the sink fail, if any
     */
    public Optional<IOException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Writes rows until {@code newBaseY} (or the image height) becomes the first row of the window.
     */
    private void advance(int newBaseY) {
        final int limit = Math.min(newBaseY, size().height());
        while (error == null && baseY < limit) {
            final PixelRow row = rows[baseY % rows.length];
            try {
                sink.write(row);
            } catch (IOException e) {
                log.warn("Writing row {} failed, discarding the rest of the image", baseY, e);
                error = e;
                return;
            }
            row.fill(background);
            baseY++;
        }
    }

    private boolean inBounds(int x, int y) {
        final ImageSize size = size();
        return x >= 0 && x < size.width() && y >= 0 && y < size.height();
    }

    @Override
    public String toString() {
        return "TargetImageAdapter[window=%d, baseY=%d, sink=%s]".formatted(rows.length, baseY, sink);
    }
}
