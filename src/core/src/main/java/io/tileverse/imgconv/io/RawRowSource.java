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

import io.tileverse.imgconv.AbstractRowSource;
import io.tileverse.imgconv.ImageSize;
import io.tileverse.imgconv.PixelRow;
import io.tileverse.imgconv.UnexpectedEndOfStreamException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;

/**
 * Reads a raw, headerless image from a {@link ReadableByteChannel}: {@code height}
 * consecutive lines of {@code width} pixels in a {@link RawRowFormat}.
 * <p>
 * A channel that ends in the middle of the image fails the source with an
 * {@link UnexpectedEndOfStreamException}. Closing the source closes the channel.
 */
public class RawRowSource extends AbstractRowSource {

    private final ReadableByteChannel channel;
    private final RawRowFormat format;
    private final ByteBuffer line;

    /**
     * @param channel the channel to read from
     * @param format the line format
     * @param size image dimensions
     */
    public RawRowSource(ReadableByteChannel channel, RawRowFormat format, ImageSize size) {
        super(requireNonNull(format, "format cannot be null").encoding(), size);
        this.channel = requireNonNull(channel, "channel cannot be null");
        this.format = format;
        this.line = ByteBuffer.allocate(format.lineLength(size.width()));
    }

    /**
     * @return the line format
     */
    public RawRowFormat format() {
        return format;
    }

    @Override
    protected int readRow(PixelRow row) throws IOException {
        line.clear();
        while (line.hasRemaining()) {
            if (channel.read(line) < 0) {
                if (line.position() == 0) {
                    return END_OF_STREAM;
                }
                throw new UnexpectedEndOfStreamException("Channel ended in the middle of row " + rowsRead());
            }
        }
        line.flip();
        return format.unpack(line, row);
    }

    @Override
    protected void doClose() throws IOException {
        channel.close();
    }
}
