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
 * Abstract base class implementing the {@link RowSink} contract.
 * <p>
 * {@link #write(PixelRow)} ignores rows beyond the declared height, rethrows
 * the sticky error and otherwise delegates to {@link #writeRow(PixelRow)}.
 * {@link #close()} calls {@link #doClose()} exactly once; implementations use
 * {@link #rowsWritten()} there to pad or finalize the output.
 */
public abstract class AbstractRowSink implements RowSink {

    private final PixelEncoding encoding;
    private final ImageSize size;

    /** Whether the sink is open. */
    protected final AtomicBoolean open = new AtomicBoolean(true);

    private int rowsWritten;
    private IOException error;

    /**
     * @param encoding encoding of the consumed rows
     * @param size image dimensions
     */
    protected AbstractRowSink(PixelEncoding encoding, ImageSize size) {
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
    public final void write(PixelRow row) throws IOException {
        ensureOpen();
        requireNonNull(row, "row cannot be null");
        if (error != null) {
            throw error;
        }
        if (rowsWritten >= size.height()) {
            return;
        }
        try {
            writeRow(row);
        } catch (IOException e) {
            error = e;
            throw e;
        }
        rowsWritten++;
    }

    /**
     * Writes row number {@link #rowsWritten()}.
     *
     * @param row the row, of any encoding
     * @throws IOException if the row cannot be written; it becomes the sticky error of this sink
     */
    protected abstract void writeRow(PixelRow row) throws IOException;

    /**
     * @return the number of rows successfully written so far
     */
    protected final int rowsWritten() {
        return rowsWritten;
    }

    /**
     * @return {@code true} if a previous write failed
     */
    protected final boolean hasFailed() {
        return error != null;
    }

    @Override
    public final void close() throws IOException {
        if (open.compareAndSet(true, false)) {
            doClose();
        }
    }

    /**
     * Flushes and finalizes the output.
     *
     * @throws IOException if an I/O error occurs
     */
    protected abstract void doClose() throws IOException;

    /**
     * @throws ClosedChannelException if this sink has been closed
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
        return "%s[%s %s, rows=%d]".formatted(getClass().getSimpleName(), encoding, size, rowsWritten);
    }
}
