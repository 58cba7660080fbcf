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
package io.tileverse.imgconv.transform;

import static java.util.Objects.requireNonNull;

import io.tileverse.imgconv.AbstractRowSource;
import io.tileverse.imgconv.ImageSize;
import io.tileverse.imgconv.PixelEncoding;
import io.tileverse.imgconv.PixelRow;
import io.tileverse.imgconv.RowSink;
import io.tileverse.imgconv.RowSource;
import io.tileverse.imgconv.adapters.SourceImageAdapter;
import io.tileverse.imgconv.adapters.TargetImageAdapter;
import io.tileverse.imgconv.loopback.Loopback;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link RowSource} that runs an {@link ImageTransform} over its upstream
 * source.
 * <p>
 * Creating a transformer starts one worker thread. The worker wraps the
 * upstream source in a {@link SourceImageAdapter}, and the sink side of a
 * {@link Loopback} in a {@link TargetImageAdapter}, runs the transform, and
 * flushes the target. The transformer reads its rows from the loopback's
 * source side, so {@link #next(PixelRow)} blocks until the worker has produced
 * the row, and the worker blocks when it gets too far ahead.
 * <p>
 * Both adapters are created by the worker itself, which owns them for its
 * whole life. The target is flushed even when the transform does not complete
 * normally, so a reader is never left waiting for rows that will not come.
 * <p>
 * If the upstream source fails, or the transform throws (an {@link Error}
 * included), the error is recorded and every following
 * {@link #next(PixelRow)} throws it.
 * <p>
 * {@link #close()} closes the loopback first, so that a worker blocked on a
 * full queue can complete, waits for the worker to terminate and only then
 * closes the upstream source, which is never closed while the worker may still
 * be reading it.
 */
@Slf4j
public final class Transformer extends AbstractRowSource {

    private static final AtomicInteger THREAD_COUNT = new AtomicInteger();

    private final RowSource upstream;

    private final RowSource output;

    private final AtomicReference<IOException> error = new AtomicReference<>();

    private final Thread worker;

    private Transformer(
            RowSource upstream,
            ImageSize size,
            PixelEncoding encoding,
            ImageTransform transform,
            int window,
            int queueCapacity) {
        super(encoding, size);
        this.upstream = upstream;
        final Loopback loopback = Loopback.create(size.width(), size.height(), encoding, queueCapacity);
        this.output = loopback.source();
        final RowSink sink = loopback.sink();
        this.worker = new Thread(
                () -> run(transform, upstream, sink, window), "imgconv-transformer-" + THREAD_COUNT.incrementAndGet());
        this.worker.setDaemon(true);
    }

    /**
     * Creates a transformer with the default adapter window and queue capacity.
     *
     * @param source the upstream source, closed when the returned source is closed
     * @param width output width
     * @param height output height
     * @param encoding output encoding
     * @param transform the transform to run
     * @return the transformer, with its worker thread started
     */
    public static Transformer create(
            RowSource source, int width, int height, PixelEncoding encoding, ImageTransform transform) {
        return create(
                source,
                width,
                height,
                encoding,
                transform,
                SourceImageAdapter.DEFAULT_WINDOW,
                Loopback.DEFAULT_CAPACITY);
    }

    /**
     * Creates a transformer.
     *
     * @param source the upstream source, closed when the returned source is closed
     * @param width output width
     * @param height output height
     * @param encoding output encoding
     * @param transform the transform to run
     * @param window number of rows retained by the source and target adapters
     * @param queueCapacity number of rows the worker may produce ahead of the reader
     * @return the transformer, with its worker thread started
     * @throws IllegalArgumentException if a dimension, the window or the queue capacity is not valid
     */
    public static Transformer create(
            RowSource source,
            int width,
            int height,
            PixelEncoding encoding,
            ImageTransform transform,
            int window,
            int queueCapacity) {
        requireNonNull(source, "source cannot be null");
        requireNonNull(encoding, "encoding cannot be null");
        requireNonNull(transform, "transform cannot be null");
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        Transformer transformer =
                new Transformer(source, new ImageSize(width, height), encoding, transform, window, queueCapacity);
        log.debug("Transformer: {} {} -> {} {}", source.size(), source.encoding(), width + "x" + height, encoding);
        transformer.worker.start();
        return transformer;
    }

    private void run(ImageTransform transform, RowSource upstream, RowSink sink, int window) {
        final SourceImageAdapter source;
        final TargetImageAdapter target;
        try {
            source = new SourceImageAdapter(upstream, window);
            target = new TargetImageAdapter(sink, window);
        } catch (RuntimeException | Error e) {
            fail(e);
            closeQuietly(sink);
            throw e;
        }
        try {
            transform.transform(target, source);
        } catch (RuntimeException | Error e) {
            fail(e);
            if (e instanceof VirtualMachineError) {
                throw e;
            }
        } finally {
            source.error().ifPresent(e -> error.compareAndSet(null, e));
            try {
                target.flush();
            } catch (IOException e) {
                log.warn("Flushing the transformed image failed", e);
                error.compareAndSet(null, e);
            }
        }
    }

    private void fail(Throwable e) {
        log.warn("Image transform failed", e);
        error.compareAndSet(null, new IOException("Image transform failed: " + e.getMessage(), e));
    }

    private void closeQuietly(RowSink sink) {
        try {
            sink.close();
        } catch (IOException e) {
            log.warn("Closing the transformer output failed", e);
        }
    }

    @Override
    protected int readRow(PixelRow row) throws IOException {
        final int count = output.next(row);
        final IOException e = error.get();
        if (e != null) {
            throw e;
        }
        return count;
    }

    @Override
    protected void doClose() throws IOException {
        output.close();
        try {
            worker.join();
        } catch (InterruptedException e) {
            // the worker may still be reading, so the upstream source is left open
            Thread.currentThread().interrupt();
            InterruptedIOException ioe = new InterruptedIOException("Interrupted waiting for " + worker.getName());
            ioe.initCause(e);
            throw ioe;
        }
        upstream.close();
    }
}
