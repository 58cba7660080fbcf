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
package io.tileverse.imgconv.io;

import static java.util.Objects.requireNonNull;

import io.tileverse.imgconv.PixelEncoding;
import io.tileverse.imgconv.PixelRow;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe pool of {@link PixelRow} instances of a single encoding and
 * width, used to avoid allocating a row per transferred scanline.
 * <p>
 * The pool keeps at most {@code maxRows} idle rows; rows returned beyond that
 * limit, or rows of a different encoding or width, are discarded. Borrowed rows
 * are not cleared: their content is whatever was last written to them.
 * <p>
 * After {@link #release(PixelRow) releasing} a row the caller must not use it
 * anymore, as it may be handed out to another thread.
 *
 * <pre>{@code
 * PixelRowPool pool = new PixelRowPool(PixelEncoding.RGBA32, width, 8);
 * PixelRow row = pool.borrow();
 * try {
 *     source.next(row);
 *     // process row...
 * } finally {
 *     pool.release(row);
 * }
 * }</pre>
 */
public class PixelRowPool {

    private static final Logger logger = LoggerFactory.getLogger(PixelRowPool.class);

    private final PixelEncoding encoding;
    private final int width;
    private final int maxRows;

    private final ConcurrentLinkedQueue<PixelRow> rows = new ConcurrentLinkedQueue<>();

    /** Current count of pooled rows. */
    private final AtomicInteger rowCount = new AtomicInteger(0);

    private final AtomicLong rowsCreated = new AtomicLong(0);
    private final AtomicLong rowsReused = new AtomicLong(0);
    private final AtomicLong rowsReturned = new AtomicLong(0);
    private final AtomicLong rowsDiscarded = new AtomicLong(0);

    /**
     * @param encoding encoding of the pooled rows
     * @param width width of the pooled rows
     * @param maxRows maximum number of idle rows to keep
     * @throws IllegalArgumentException if width is negative or maxRows is not positive
     */
    public PixelRowPool(PixelEncoding encoding, int width, int maxRows) {
        this.encoding = requireNonNull(encoding, "encoding cannot be null");
        if (width < 0) {
            throw new IllegalArgumentException("width cannot be negative: " + width);
        }
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive: " + maxRows);
        }
        this.width = width;
        this.maxRows = maxRows;
        logger.debug("Created PixelRowPool: encoding={}, width={}, maxRows={}", encoding, width, maxRows);
    }

    /**
     * Borrows a row, reusing an idle one if available.
     *
     * @return a row of this pool's encoding and width
     */
    public PixelRow borrow() {
        PixelRow row = rows.poll();
        if (row != null) {
            rowCount.decrementAndGet();
            rowsReused.incrementAndGet();
            logger.trace("Reused pooled row: {}", row);
            return row;
        }
        rowsCreated.incrementAndGet();
        logger.trace("Created new row: encoding={}, width={}", encoding, width);
        return PixelRow.create(encoding, width);
    }

    /**
     * Returns a row to the pool.
     *
     * @param row the row to return, may be {@code null} in which case this is a no-op
     */
    public void release(PixelRow row) {
        if (row == null) {
            return;
        }
        if (row.encoding() != encoding || row.width() != width) {
            rowsDiscarded.incrementAndGet();
            logger.trace("Discarded foreign row: {}", row);
            return;
        }
        if (rowCount.get() < maxRows) {
            rows.offer(row);
            rowCount.incrementAndGet();
            rowsReturned.incrementAndGet();
        } else {
            rowsDiscarded.incrementAndGet();
            logger.trace("Discarded row (pool full): {}", row);
        }
    }

    /**
     * Drops all idle rows.
     */
    public void clear() {
        int cleared = 0;
        while (rows.poll() != null) {
            cleared++;
        }
        rowCount.set(0);
        logger.debug("Cleared pool: {} rows", cleared);
    }

    /**
     * @return the encoding of the pooled rows
     */
    public PixelEncoding encoding() {
        return encoding;
    }

    /**
     * @return the width of the pooled rows
     */
    public int width() {
        return width;
    }

    /**
     * Gets statistics about pool usage.
     *
     * @return pool statistics
     */
    public PoolStatistics getStatistics() {
        return new PoolStatistics(
                rowCount.get(),
                maxRows,
                rowsCreated.get(),
                rowsReused.get(),
                rowsReturned.get(),
                rowsDiscarded.get());
    }

    @Override
    public String toString() {
        PoolStatistics stats = getStatistics();
        return String.format(
                "PixelRowPool[%s x %d, rows=%d/%d, created=%d, reused=%d, returned=%d, discarded=%d]",
                encoding,
                width,
                stats.currentRows(),
                stats.maxRows(),
                stats.rowsCreated(),
                stats.rowsReused(),
                stats.rowsReturned(),
                stats.rowsDiscarded());
    }

    /**
     * Pool usage statistics.
     *
     * @param currentRows idle rows currently pooled
     * @param maxRows maximum number of idle rows
     * @param rowsCreated rows allocated by {@link #borrow()}
     * @param rowsReused rows served from the pool
     * @param rowsReturned rows accepted back into the pool
     * @param rowsDiscarded rows dropped on release
     */
    public record PoolStatistics(
            int currentRows, int maxRows, long rowsCreated, long rowsReused, long rowsReturned, long rowsDiscarded) {

        /**
         * @return the fraction of borrows served from the pool, 0.0 if nothing was borrowed
         */
        public double reuseRate() {
            long total = rowsCreated + rowsReused;
            return total == 0 ? 0.0 : (double) rowsReused / total;
        }
    }
}
