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
package io.tileverse.imgconv.loopback;

import static java.util.Objects.requireNonNull;

import io.tileverse.imgconv.ImageSize;
import io.tileverse.imgconv.PixelEncoding;
import io.tileverse.imgconv.PixelRow;
import io.tileverse.imgconv.RowSink;
import io.tileverse.imgconv.RowSource;
import io.tileverse.imgconv.UnexpectedEndOfStreamException;
import io.tileverse.imgconv.io.PixelRowPool;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * A bounded in-memory pipe connecting a {@link RowSink} to a {@link RowSource},
 * used to hand rows from one thread to another.
 * <p>
 * Rows written to the {@link #sink() sink} are copied into a queue of at most
 * {@code capacity} rows, from which the {@link #source() source} reads them.
 * The writer blocks while the queue is full and the reader blocks while it is
 * empty.
 * <p>
 * Sink side:
 * <ul>
 * <li>at most {@code height} rows are accepted, further writes are ignored;</li>
 * <li>writes after the sink or the source has been closed are ignored.</li>
 * </ul>
 * Source side:
 * <ul>
 * <li>at most {@code height} rows are returned, then
 * {@link RowSource#END_OF_STREAM};</li>
 * <li>if the sink is closed after fewer than {@code height} rows, the source
 * returns the rows that were written, then throws an
 * {@link UnexpectedEndOfStreamException} once, then returns
 * {@link RowSource#END_OF_STREAM};</li>
 * <li>closing the source discards the queued rows and releases a writer blocked
 * on a full queue.</li>
 * </ul>
 * A thread interrupted while blocked gets an {@link InterruptedIOException},
 * with its interrupt status restored.
 */
@Slf4j
public final class Loopback {

    /** Default queue capacity, in rows. */
    public static final int DEFAULT_CAPACITY = 8;

    private final PixelEncoding encoding;
    private final ImageSize size;
    private final int capacity;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    // guarded by lock
    private final ArrayDeque<PixelRow> queue;
    private boolean sinkClosed;
    private boolean sourceClosed;

    private final PixelRowPool pool;

    private final Sink sink = new Sink();
    private final Source source = new Source();

    private Loopback(PixelEncoding encoding, ImageSize size, int capacity) {
        this.encoding = encoding;
        this.size = size;
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
        this.pool = new PixelRowPool(encoding, size.width(), capacity + 1);
    }

    /**
     * Creates a loopback with the {@link #DEFAULT_CAPACITY default capacity}.
     *
     * @param width row width
     * @param height number of rows transferred
     * @param encoding row encoding
     * @return the loopback
     */
    public static Loopback create(int width, int height, PixelEncoding encoding) {
        return create(width, height, encoding, DEFAULT_CAPACITY);
    }

    /**
     * Creates a loopback.
     *
     * @param width row width
     * @param height number of rows transferred
     * @param encoding row encoding
     * @param capacity maximum number of queued rows
     * @return the loopback
     * @throws IllegalArgumentException if a dimension is negative or capacity is not positive
     */
    public static Loopback create(int width, int height, PixelEncoding encoding, int capacity) {
        requireNonNull(encoding, "encoding cannot be null");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        return new Loopback(encoding, new ImageSize(width, height), capacity);
    }

    /**
     * @return the writing end
     */
    public RowSink sink() {
        return sink;
    }

    /**
     * @return the reading end
     */
    public RowSource source() {
        return source;
    }

    /**
     * @return the maximum number of queued rows
     */
    public int capacity() {
        return capacity;
    }

    private final class Sink implements RowSink {

        private int written;

        @Override
        public PixelEncoding encoding() {
            return encoding;
        }

        @Override
        public ImageSize size() {
            return size;
        }

        @Override
        public void write(PixelRow row) throws IOException {
            requireNonNull(row, "row cannot be null");
            lock.lock();
            try {
                while (!sinkClosed && !sourceClosed && written < size.height() && queue.size() >= capacity) {
                    await(notFull);
                }
                if (sinkClosed || sourceClosed || written >= size.height()) {
                    return;
                }
                PixelRow copy = pool.borrow();
                copy.copyFrom(row);
                queue.addLast(copy);
                written++;
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            lock.lock();
            try {
                if (!sinkClosed) {
                    sinkClosed = true;
                    if (written < size.height()) {
                        log.debug("Loopback sink closed after {} of {} rows", written, size.height());
                    }
                    notEmpty.signalAll();
                    notFull.signalAll();
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public String toString() {
            return "Loopback.Sink[%s %s, rows=%d]".formatted(encoding, size, written);
        }
    }

    private final class Source implements RowSource {

        private int read;

        private boolean truncationReported;

        @Override
        public PixelEncoding encoding() {
            return encoding;
        }

        @Override
        public ImageSize size() {
            return size;
        }

        @Override
        public int next(PixelRow row) throws IOException {
            requireNonNull(row, "row cannot be null");
            PixelRow next;
            lock.lock();
            try {
                if (sourceClosed) {
                    throw new ClosedChannelException();
                }
                if (read >= size.height()) {
                    return END_OF_STREAM;
                }
                while (queue.isEmpty() && !sinkClosed) {
                    await(notEmpty);
                }
                next = queue.pollFirst();
                if (next == null) {
                    if (truncationReported) {
                        return END_OF_STREAM;
                    }
                    truncationReported = true;
                    throw UnexpectedEndOfStreamException.truncated(read, size.height());
                }
                read++;
                notFull.signal();
            } finally {
                lock.unlock();
            }
            final int count = row.copyFrom(next);
            pool.release(next);
            return count;
        }

        @Override
        public void close() {
            lock.lock();
            try {
                if (!sourceClosed) {
                    sourceClosed = true;
                    int discarded = queue.size();
                    queue.clear();
                    if (discarded > 0) {
                        log.debug("Loopback source closed, discarded {} queued rows", discarded);
                    }
                    notFull.signalAll();
                    notEmpty.signalAll();
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public String toString() {
            return "Loopback.Source[%s %s, rows=%d]".formatted(encoding, size, read);
        }
    }

    /**
     * Waits on the condition, translating an interrupt into an {@link InterruptedIOException}.
     */
    private static void await(Condition condition) throws InterruptedIOException {
        try {
            condition.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ioe = new InterruptedIOException("Interrupted while waiting on the loopback queue");
            ioe.initCause(e);
            throw ioe;
        }
    }
}
