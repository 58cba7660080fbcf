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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Row sources and sinks for tests.
 */
public final class TestImages {

    private TestImages() {}

    /** Computes the color of pixel {@code (x, y)}. */
    @FunctionalInterface
    public interface PixelFunction {
        PixelColor apply(int x, int y);
    }

    /**
     * A source whose pixels are computed by a function.
     */
    public static class FunctionSource extends AbstractRowSource {

        private final PixelFunction function;

        /** number of times {@link #doClose()} ran */
        public final AtomicInteger closeCount = new AtomicInteger();

        public FunctionSource(PixelEncoding encoding, int width, int height, PixelFunction function) {
            super(encoding, new ImageSize(width, height));
            this.function = function;
        }

        @Override
        protected int readRow(PixelRow row) throws IOException {
            final int y = rowsRead();
            final int count = Math.min(row.width(), size().width());
            for (int x = 0; x < count; x++) {
                row.set(x, function.apply(x, y));
            }
            return count;
        }

        @Override
        protected void doClose() {
            closeCount.incrementAndGet();
        }

        public boolean isClosed() {
            return !open.get();
        }
    }

    /**
     * A source that delivers {@code limit} rows and then fails.
     */
    public static class FailingSource extends FunctionSource {

        private final int limit;
        private final IOException error;

        public FailingSource(
                PixelEncoding encoding, int width, int height, PixelFunction function, int limit, IOException error) {
            super(encoding, width, height, function);
            this.limit = limit;
            this.error = error;
        }

        @Override
        protected int readRow(PixelRow row) throws IOException {
            if (rowsRead() >= limit) {
                if (error == null) {
                    return END_OF_STREAM;
                }
                throw error;
            }
            return super.readRow(row);
        }
    }

    /**
     * A sink keeping a copy of every written row.
     */
    public static class CollectingSink extends AbstractRowSink {

        public final List<PixelRow> rows = new ArrayList<>();

        public final AtomicInteger closeCount = new AtomicInteger();

        public CollectingSink(PixelEncoding encoding, int width, int height) {
            super(encoding, new ImageSize(width, height));
        }

        @Override
        protected void writeRow(PixelRow row) throws IOException {
            PixelRow copy = PixelRow.create(encoding(), size().width());
            copy.copyFrom(row);
            rows.add(copy);
        }

        @Override
        protected void doClose() {
            closeCount.incrementAndGet();
        }

        public boolean isClosed() {
            return !open.get();
        }
    }

    public static FunctionSource uniform(PixelEncoding encoding, int width, int height, PixelColor color) {
        return new FunctionSource(encoding, width, height, (x, y) -> color);
    }

    /**
     * A gray image in which pixel {@code (x, y)} has the 8-bit value {@code 10 * y + x + 1}.
     */
    public static FunctionSource numbered(int width, int height) {
        return new FunctionSource(
                PixelEncoding.GRAY8, width, height, (x, y) -> PixelColor.gray8((10 * y + x + 1) & 0xff));
    }

    /**
     * A gray image in which every pixel of row {@code y} has the 8-bit value {@code y}.
     */
    public static FunctionSource rowNumbers(PixelEncoding encoding, int width, int height) {
        return new FunctionSource(encoding, width, height, (x, y) -> PixelColor.gray8(y & 0xff));
    }

    public static FailingSource failing(int width, int height, int limit, IOException error) {
        return new FailingSource(
                PixelEncoding.GRAY8, width, height, (x, y) -> PixelColor.gray8(y & 0xff), limit, error);
    }

    public static FailingSource truncated(PixelEncoding encoding, int width, int height, int limit) {
        return new FailingSource(encoding, width, height, (x, y) -> PixelColor.WHITE, limit, null);
    }

    /**
     * Reads all rows of a source, in its own encoding.
     */
    public static List<PixelRow> collect(RowSource source) throws IOException {
        List<PixelRow> rows = new ArrayList<>();
        PixelRow row = source.newRow();
        while (source.next(row) != RowSource.END_OF_STREAM) {
            PixelRow copy = source.newRow();
            copy.copyFrom(row);
            rows.add(copy);
        }
        return rows;
    }

    /**
     * Returns the 8-bit gray values of a row.
     */
    public static int[] gray8(PixelRow row) {
        int[] values = new int[row.width()];
        for (int x = 0; x < values.length; x++) {
            values[x] = row.get(x).luma8();
        }
        return values;
    }
}
