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
import io.tileverse.imgconv.RowSource;
import io.tileverse.imgconv.UnexpectedEndOfStreamException;
import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Exposes a {@link RowSource} as a {@link RandomAccessImage}, keeping only the
 * most recently read rows in memory.
 * <p>
 * The adapter retains a window of the last {@code window} rows read from the
 * source. Lookups are served as follows:
 * <ul>
 * <li>a row within the window is served from memory;</li>
 * <li>a row below the window is reached by reading forward from the source,
 * sliding the window down;</li>
 * <li>anything else (a row that already left the window, a position outside
 * the image, a source that failed or ended early) yields the encoding's
 * {@link PixelEncoding#transparent() transparent} color.</li>
 * </ul>
 * Algorithms that scan the image top to bottom and look back at most
 * {@code window - 1} rows therefore see the exact image. Other access patterns
 * silently get the transparent color for the positions they miss.
 * <p>
 * The first read error is kept and exposed through {@link #error()}; no further
 * rows are read after it.
 */
@Slf4j
public class SourceImageAdapter implements RandomAccessImage, Closeable {

    /** Default number of retained rows. */
    public static final int DEFAULT_WINDOW = 8;

    private final RowSource source;

    private final int window;

    /** rows[0] is the most recent row, rows[window] is the read buffer */
    private final PixelRow[] rows;

    /** y of rows[0], -1 before the first read */
    private int latestY = -1;

    private IOException error;

    /**
     * Creates an adapter with the {@link #DEFAULT_WINDOW default window}.
     *
     * @param source the row source; closed by {@link #close()}
     */
    public SourceImageAdapter(RowSource source) {
        this(source, DEFAULT_WINDOW);
    }

    /**
     * @param source the row source; closed by {@link #close()}
     * @param window number of retained rows
     * @throws IllegalArgumentException if window is not positive
     */
    public SourceImageAdapter(RowSource source, int window) {
        this.source = requireNonNull(source, "source cannot be null");
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.window = window;
        this.rows = new PixelRow[window + 1];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = source.newRow();
        }
    }

    @Override
    public PixelEncoding encoding() {
        return source.encoding();
    }

    @Override
    public ImageSize size() {
        return source.size();
    }

    /**
     * @return the number of retained rows
     */
    public int window() {
        return window;
    }

    @Override
    public PixelColor get(int x, int y) {
        final ImageSize size = size();
        if (x < 0 || x >= size.width() || y < 0 || y >= size.height()) {
            return encoding().transparent();
        }
        final int off = latestY - y;
        if (off >= 0 && off < window) {
            return rows[off].get(x);
        }
        seek(y);
        if (latestY == y) {
            return rows[0].get(x);
        }
        return encoding().transparent();
    }

    private void seek(int y) {
        while (error == null && latestY < y) {
            final PixelRow row = rows[window];
            try {
                if (source.next(row) == RowSource.END_OF_STREAM) {
                    throw new UnexpectedEndOfStreamException("Source ended before row " + (latestY + 1));
                }
            } catch (IOException e) {
                log.warn("Reading row {} failed, further lookups return the default color", latestY + 1, e);
                error = e;
                return;
            }
            System.arraycopy(rows, 0, rows, 1, window);
            rows[0] = row;
            latestY++;
        }
    }

    /**
     * @return the first error encountered while reading the source, if any
     */
    public Optional<IOException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Closes the underlying source.
     */
    @Override
    public void close() throws IOException {
        source.close();
    }

    @Override
    public String toString() {
        return "SourceImageAdapter[window=%d, latestY=%d, source=%s]".formatted(window, latestY, source);
    }
}
