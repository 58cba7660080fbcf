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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.tileverse.imgconv.Gray8Row;
import io.tileverse.imgconv.PixelColor;
import io.tileverse.imgconv.PixelEncoding;
import io.tileverse.imgconv.PixelRow;
import io.tileverse.imgconv.RowSink;
import io.tileverse.imgconv.RowSource;
import io.tileverse.imgconv.TestImages;
import io.tileverse.imgconv.UnexpectedEndOfStreamException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class LoopbackTest {

    @Test
    void create_nonPositiveCapacity_throwsException() {
        assertThatThrownBy(() -> Loopback.create(4, 4, PixelEncoding.GRAY8, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity must be positive");
    }

    @Test
    void create_defaults() {
        Loopback loopback = Loopback.create(3, 2, PixelEncoding.RGBA64);
        assertThat(loopback.capacity()).isEqualTo(Loopback.DEFAULT_CAPACITY);
        assertThat(loopback.sink().size()).isEqualTo(loopback.source().size());
        assertThat(loopback.source().encoding()).isEqualTo(PixelEncoding.RGBA64);
        assertThat(loopback.sink().encoding()).isEqualTo(PixelEncoding.RGBA64);
    }

    @Test
    void rowsAreDeliveredInOrder() throws IOException {
        Loopback loopback = Loopback.create(2, 3, PixelEncoding.GRAY8, 4);
        RowSink sink = loopback.sink();
        for (int y = 0; y < 3; y++) {
            sink.write(row(y));
        }

        List<PixelRow> rows = TestImages.collect(loopback.source());

        assertThat(rows).extracting(r -> TestImages.gray8(r)[0]).containsExactly(0, 1, 2);
    }

    @Test
    void writtenRowsAreCopied() throws IOException {
        Loopback loopback = Loopback.create(1, 1, PixelEncoding.GRAY8, 1);
        Gray8Row row = row(7);
        loopback.sink().write(row);
        row.setGray(0, 99);

        PixelRow read = loopback.source().newRow();
        loopback.source().next(read);

        assertThat(TestImages.gray8(read)).containsExactly(7);
    }

    @Test
    void sinkClosedEarly_reportsTruncationOnceThenEnd() throws IOException {
        Loopback loopback = Loopback.create(2, 4, PixelEncoding.GRAY8, 4);
        loopback.sink().write(row(0));
        loopback.sink().write(row(1));
        loopback.sink().close();

        RowSource source = loopback.source();
        PixelRow row = source.newRow();
        assertThat(source.next(row)).isEqualTo(2);
        assertThat(source.next(row)).isEqualTo(2);
        assertThatThrownBy(() -> source.next(row))
                .isInstanceOf(UnexpectedEndOfStreamException.class)
                .hasMessage("Stream ended after 2 of 4 rows");
        assertThat(source.next(row)).isEqualTo(RowSource.END_OF_STREAM);
    }

    @Test
    void write_afterSinkClose_isIgnored() throws IOException {
        Loopback loopback = Loopback.create(1, 2, PixelEncoding.GRAY8, 2);
        loopback.sink().close();
        loopback.sink().close();
        loopback.sink().write(row(1));

        RowSource source = loopback.source();
        assertThatThrownBy(() -> source.next(source.newRow())).isInstanceOf(UnexpectedEndOfStreamException.class);
    }

    @Test
    void write_beyondHeight_isIgnored() throws IOException {
        Loopback loopback = Loopback.create(1, 1, PixelEncoding.GRAY8, 2);
        loopback.sink().write(row(1));
        loopback.sink().write(row(2));

        RowSource source = loopback.source();
        PixelRow row = source.newRow();
        assertThat(source.next(row)).isEqualTo(1);
        assertThat(TestImages.gray8(row)).containsExactly(1);
        assertThat(source.next(row)).isEqualTo(RowSource.END_OF_STREAM);
    }

    @Test
    void next_afterSourceClose_throwsClosedChannelException() throws IOException {
        Loopback loopback = Loopback.create(1, 2, PixelEncoding.GRAY8, 2);
        loopback.sink().write(row(0));
        loopback.source().close();

        assertThatThrownBy(() -> loopback.source().next(row(0))).isInstanceOf(ClosedChannelException.class);
        // the sink keeps accepting rows and drops them
        loopback.sink().write(row(1));
    }

    @Test
    @Timeout(10)
    void sourceClose_releasesBlockedWriter() throws Exception {
        Loopback loopback = Loopback.create(1, 10, PixelEncoding.GRAY8, 1);
        AtomicInteger written = new AtomicInteger();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread producer = new Thread(() -> {
            try {
                for (int y = 0; y < 10; y++) {
                    loopback.sink().write(row(y));
                    written.incrementAndGet();
                }
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        producer.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> written.get() >= 1);
        assertThat(producer.isAlive()).isTrue();

        loopback.source().close();
        producer.join();

        assertThat(failure.get()).isNull();
        assertThat(written).hasValue(10);
    }

    @Test
    @Timeout(10)
    void sinkClose_releasesBlockedReader() throws Exception {
        Loopback loopback = Loopback.create(1, 3, PixelEncoding.GRAY8, 2);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicBoolean started = new AtomicBoolean();
        Thread consumer = new Thread(() -> {
            started.set(true);
            try {
                loopback.source().next(row(0));
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        consumer.start();

        await().atMost(Duration.ofSeconds(5)).until(started::get);
        await().atMost(Duration.ofSeconds(5)).until(() -> consumer.getState() == Thread.State.WAITING);

        loopback.sink().close();
        consumer.join();

        assertThat(failure.get()).isInstanceOf(UnexpectedEndOfStreamException.class);
    }

    @Test
    @Timeout(20)
    void producerAndConsumerThreads_preserveOrder() throws Exception {
        final int height = 500;
        Loopback loopback = Loopback.create(3, height, PixelEncoding.GRAY8, 3);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread producer = new Thread(() -> {
            try (RowSink sink = loopback.sink()) {
                for (int y = 0; y < height; y++) {
                    sink.write(row(y & 0xff));
                }
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        producer.start();

        List<Integer> values = new ArrayList<>();
        try (RowSource source = loopback.source()) {
            for (PixelRow row : TestImages.collect(source)) {
                values.add(TestImages.gray8(row)[0]);
            }
        }
        producer.join();

        assertThat(failure.get()).isNull();
        assertThat(values).hasSize(height);
        for (int y = 0; y < height; y++) {
            assertThat(values.get(y)).isEqualTo(y & 0xff);
        }
    }

    @Test
    void interruptedReader_throwsInterruptedIOException() {
        Loopback loopback = Loopback.create(1, 1, PixelEncoding.GRAY8, 1);
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> loopback.source().next(row(0)))
                    .isInstanceOf(InterruptedIOException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void toString_showsProgress() throws IOException {
        Loopback loopback = Loopback.create(2, 2, PixelEncoding.GRAY8, 2);
        loopback.sink().write(row(0));
        assertThat(loopback.sink()).hasToString("Loopback.Sink[GRAY8 2x2, rows=1]");
        assertThat(loopback.source()).hasToString("Loopback.Source[GRAY8 2x2, rows=0]");
    }

    private static Gray8Row row(int value) {
        Gray8Row row = (Gray8Row) PixelRow.create(PixelEncoding.GRAY8, 2);
        row.fill(PixelColor.gray8(value));
        return row;
    }
}
