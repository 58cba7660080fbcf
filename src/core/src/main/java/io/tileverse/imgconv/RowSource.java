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

import java.io.Closeable;
import java.io.IOException;

/**
 * A pull-based stream of pixel rows, read top to bottom.
 * <p>
 * A source is the input side of every pipeline stage: codecs decode into one,
 * and filters such as the {@link io.tileverse.imgconv.scale.Scaler} wrap an
 * upstream source and expose another one. A source delivers exactly
 * {@code size().height()} rows and then reports {@link #END_OF_STREAM}.
 * <p>
 * Implementations follow these rules:
 * <ul>
 * <li>Errors are sticky: once {@link #next(PixelRow)} fails, every later call
 * throws the same exception instance.</li>
 * <li>Closing a filter closes its upstream source. {@link #close()} is
 * idempotent.</li>
 * <li>Reading past the declared height is not an error, it returns
 * {@link #END_OF_STREAM}.</li>
 * <li>Reading from a closed source throws
 * {@link java.nio.channels.ClosedChannelException}.</li>
 * <li>A source that runs out of data before its declared height throws
 * {@link UnexpectedEndOfStreamException}.</li>
 * </ul>
 * Sources are single-consumer and not thread-safe unless stated otherwise.
 *
 * @see AbstractRowSource
 * @see RowSink
 */
public interface RowSource extends Closeable {

    /** Value returned by {@link #next(PixelRow)} once all rows have been read. */
    int END_OF_STREAM = -1;

    /**
     * @return the encoding of the rows this source produces
     */
    PixelEncoding encoding();

    /**
     * @return the image dimensions; {@code height} is the number of rows delivered
     */
    ImageSize size();

    /**
     * Allocates a row matching this source's encoding and width.
     *
     * @return a new row
     */
    default PixelRow newRow() {
        return PixelRow.create(encoding(), size().width());
    }

    /**
     * Reads the next row into {@code row}, converting it into the row's encoding
     * if it differs from {@link #encoding()}.
     *
     * @param row the row to fill
     * @return the number of pixels written, or {@link #END_OF_STREAM}
     * @throws IOException if the row cannot be read
     */
    int next(PixelRow row) throws IOException;

    /**
     * Releases the resources held by this source, including its upstream source if it is a filter.
     *
     * @throws IOException if an I/O error occurs
     */
    @Override
    void close() throws IOException;
}
