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

import io.tileverse.imgconv.AbstractRowSink;
import io.tileverse.imgconv.ImageSize;
import io.tileverse.imgconv.PixelColor;
import io.tileverse.imgconv.PixelRow;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a raw, headerless image to a {@link WritableByteChannel}: {@code height}
 * consecutive lines of {@code width} pixels in a {@link RawRowFormat}.
 * <p>
 * The output always has the declared size. Rows narrower than the image are
 * padded with white, rows beyond the image height are ignored, and on
 * {@link #close()} every row that was never written is emitted as a white line
 * before the channel is closed.
 */
@Slf4j
public class RawRowSink extends AbstractRowSink {

    private final WritableByteChannel channel;
    private final RawRowFormat format;
    private final ByteBuffer line;

    private ByteBuffer whiteLine;

    /**
     * @param channel the channel to write to
     * @param format the line format
     * @param size image dimensions
     */
    public RawRowSink(WritableByteChannel channel, RawRowFormat format, ImageSize size) {
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
    protected void writeRow(PixelRow row) throws IOException {
        line.clear();
        format.pack(row, line);
        if (line.hasRemaining()) {
            line.put(whiteLine().position(line.position()));
        }
        line.flip();
        writeFully(line);
    }

    @Override
    protected void doClose() throws IOException {
        try {
            if (!hasFailed()) {
                final int missing = size().height() - rowsWritten();
                if (missing > 0) {
                    log.debug("Padding {} missing rows with white", missing);
                }
                for (int i = 0; i < missing; i++) {
                    writeFully(whiteLine());
                }
            }
        } finally {
            channel.close();
        }
    }

    private ByteBuffer whiteLine() {
        if (whiteLine == null) {
            PixelRow white = PixelRow.create(encoding(), size().width());
            white.fill(PixelColor.WHITE);
            whiteLine = ByteBuffer.allocate(line.capacity());
            format.pack(white, whiteLine);
        }
        return whiteLine.clear();
    }

    private void writeFully(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}
