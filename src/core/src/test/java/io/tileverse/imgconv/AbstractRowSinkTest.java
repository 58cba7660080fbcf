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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tileverse.imgconv.TestImages.CollectingSink;
import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AbstractRowSinkTest {

    @Test
    void write_convertsIntoSinkEncoding() throws IOException {
        CollectingSink sink = new CollectingSink(PixelEncoding.GRAY8, 2, 1);
        Rgba32Row row = (Rgba32Row) PixelRow.create(PixelEncoding.RGBA32, 2);
        row.setRgba(0, 255, 0, 0, 255);
        row.setRgba(1, 255, 255, 255, 255);

        sink.write(row);

        assertThat(sink.rows).hasSize(1);
        assertThat(TestImages.gray8(sink.rows.get(0))).containsExactly(76, 255);
    }

    @Test
    void write_beyondDeclaredHeight_isIgnored() throws IOException {
        CollectingSink sink = new CollectingSink(PixelEncoding.GRAY8, 2, 2);
        PixelRow row = PixelRow.create(PixelEncoding.GRAY8, 2);
        for (int i = 0; i < 5; i++) {
            sink.write(row);
        }
        assertThat(sink.rows).hasSize(2);
    }

    @Test
    void write_afterClose_throwsClosedChannelException() throws IOException {
        CollectingSink sink = new CollectingSink(PixelEncoding.GRAY8, 2, 2);
        sink.close();
        assertThatThrownBy(() -> sink.write(PixelRow.create(PixelEncoding.GRAY8, 2)))
                .isInstanceOf(ClosedChannelException.class);
    }

    @Test
    void write_errorIsSticky() throws IOException {
        IOException failure = new IOException("no space left");
        AtomicInteger attempts = new AtomicInteger();
        AbstractRowSink sink = new AbstractRowSink(PixelEncoding.GRAY8, new ImageSize(1, 3)) {
            @Override
            protected void writeRow(PixelRow row) throws IOException {
                attempts.incrementAndGet();
                throw failure;
            }

            @Override
            protected void doClose() {
                assertThat(hasFailed()).isTrue();
            }
        };
        PixelRow row = PixelRow.create(PixelEncoding.GRAY8, 1);

        assertThatThrownBy(() -> sink.write(row)).isSameAs(failure);
        assertThatThrownBy(() -> sink.write(row)).isSameAs(failure);
        assertThat(attempts).hasValue(1);
        sink.close();
    }

    @Test
    void close_isIdempotent() throws IOException {
        CollectingSink sink = new CollectingSink(PixelEncoding.RGBA64, 1, 1);
        sink.close();
        sink.close();
        assertThat(sink.closeCount).hasValue(1);
        assertThat(sink.isClosed()).isTrue();
    }
}
