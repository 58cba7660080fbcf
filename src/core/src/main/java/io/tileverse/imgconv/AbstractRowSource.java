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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Abstract base class implementing the {@link RowSource} contract.
 * <p>
 * {@link #next(PixelRow)} handles the concerns shared by every source (closed
 * state, sticky errors and height bookkeeping) and delegates the actual reading
 * to {@link #readRow(PixelRow)}, which is only called while rows remain.
 * Resources are released in {@link #doClose()}, which runs at most once.
 */
public abstract class AbstractRowSource implements RowSource {

    private final PixelEncoding encoding;
    private final ImageSize size;

    /** Whether the source is open. */
    protected final AtomicBoolean open = new AtomicBoolean(true);

    private int rowsRead;
    private IOException error;

    /**
     * @param encoding encoding of the produced rows
     * @param size image dimensions
     */
    protected AbstractRowSource(PixelEncoding encoding, ImageSize size) {
        this.encoding = requireNonNull(encoding, "encoding cannot be null");
        this.size = requireNonNull(size, "size cannot be null");
    }

    @Override
    public final PixelEncoding encoding() {
        return encoding;
    }

    @Override
    public final ImageSize size() {
        return size;
    }

    @Override
    public final int next(PixelRow row) throws IOException {
        ensureOpen();
        requireNonNull(row, "row cannot be null");
        if (error != null) {
            throw error;
        }
        if (rowsRead >= size.height()) {
            return END_OF_STREAM;
        }
        final int count;
        try {
            count = readRow(row);
        } catch (IOException e) {
            error = e;
            throw e;
        }
        if (count == END_OF_STREAM) {
            error = UnexpectedEndOfStreamException.truncated(rowsRead, size.height());
            throw error;
        }
        rowsRead++;
        return count;
    }

    /**
     * Reads row number {@link #rowsRead()} into {@code row}.
     * <p>
     * Returning {@link #END_OF_STREAM} means the underlying data ended early and
     * is reported to the caller as an {@link UnexpectedEndOfStreamException}.
     * Any exception thrown becomes the sticky error of this source.
     *
     * @param row the row to fill, of any encoding
     * @return the number of pixels written, or {@link #END_OF_STREAM}
     * @throws IOException if the row cannot be read
     */
    protected abstract int readRow(PixelRow row) throws IOException;

    /**
     * @return the number of rows successfully read so far
     */
    protected final int rowsRead() {
        return rowsRead;
    }

    @Override
    public final void close() throws IOException {
        if (open.compareAndSet(true, false)) {
            doClose();
        }
    }

    /**
     * Releases the resources of this source. Filters close their upstream source here.
     *
     * @throws IOException if an I/O error occurs
     */
    protected void doClose() throws IOException {
        // nothing to release by default
    }

    /**
     * @throws ClosedChannelException if this source has been closed
     */
    protected void ensureOpen() throws ClosedChannelException {
        if (!open.get()) {
            throw new ClosedChannelException();
        }
    }

    @Override
    public String toString() {
        if (!open.get()) {
            return getClass().getSimpleName() + "[closed]";
        }
        return "%s[%s %s, rows=%d]".formatted(getClass().getSimpleName(), encoding, size, rowsRead);
    }
}
