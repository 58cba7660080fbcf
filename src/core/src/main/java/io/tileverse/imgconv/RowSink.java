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
 * A push-based consumer of pixel rows, written top to bottom.
 * <p>
 * Sinks accept at most {@code size().height()} rows; excess rows are ignored.
 * {@link #close()} flushes and finalizes the output, padding rows that were
 * never written with the encoding's white point where the output format needs a
 * complete image. Errors are sticky and writing to a closed sink throws
 * {@link java.nio.channels.ClosedChannelException}.
 *
 * @see AbstractRowSink
 */
public interface RowSink extends Closeable {

    /**
     * @return the encoding rows are converted into
     */
    PixelEncoding encoding();

    /**
     * @return the image dimensions; {@code height} is the number of rows accepted
     */
    ImageSize size();

    /**
     * Writes the next row. The row is consumed before this method returns, the
     * caller may reuse it immediately.
     *
     * @param row the row to write, of any encoding
     * @throws IOException if the row cannot be written
     */
    void write(PixelRow row) throws IOException;

    /**
     * Flushes and finalizes the output.
     *
     * @throws IOException if an I/O error occurs
     */
    @Override
    void close() throws IOException;
}
