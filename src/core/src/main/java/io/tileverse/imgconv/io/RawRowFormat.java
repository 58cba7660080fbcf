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

import io.tileverse.imgconv.FloatPixelRow;
import io.tileverse.imgconv.Gray16Row;
import io.tileverse.imgconv.Gray8Row;
import io.tileverse.imgconv.GrayF32Row;
import io.tileverse.imgconv.PixelColor;
import io.tileverse.imgconv.PixelEncoding;
import io.tileverse.imgconv.PixelRow;
import io.tileverse.imgconv.Rgba32Row;
import io.tileverse.imgconv.Rgba64Row;
import io.tileverse.imgconv.RgbaF32Row;
import java.nio.ByteBuffer;

/**
 * Byte layouts of a raw, headerless image line, as produced by scanners and
 * consumed by printers.
 * <p>
 * {@link #unpack(ByteBuffer, PixelRow)} and {@link #pack(PixelRow, ByteBuffer)}
 * convert between a line and a {@link PixelRow} of any encoding. Rows of the
 * format's {@link #encoding() natural encoding}, and the floating point rows of
 * the same family, are converted directly; other rows go through
 * {@link PixelColor}. Formats without alpha unpack to opaque pixels and drop
 * alpha when packing. Multi-byte samples are big-endian.
 */
public enum RawRowFormat {

    /** One byte of luminance per pixel. */
    GRAY8(1, PixelEncoding.GRAY8) {
        @Override
        void unpack(ByteBuffer src, PixelRow row, int count) {
            if (row instanceof Gray8Row gray) {
                for (int x = 0; x < count; x++) {
                    gray.setGray(x, src.get() & 0xff);
                }
            } else if (row instanceof GrayF32Row gray) {
                for (int x = 0; x < count; x++) {
                    gray.setChannel(x, 0, (src.get() & 0xff) / 255f);
                }
            } else {
                for (int x = 0; x < count; x++) {
                    row.set(x, PixelColor.gray8(src.get() & 0xff));
                }
            }
        }

        @Override
        void pack(PixelRow row, ByteBuffer dst, int count) {
            if (row instanceof Gray8Row gray) {
                for (int x = 0; x < count; x++) {
                    dst.put((byte) gray.getGray(x));
                }
            } else if (row instanceof GrayF32Row gray) {
                for (int x = 0; x < count; x++) {
                    dst.put((byte) PixelColor.floatTo8(gray.getChannel(x, 0)));
                }
            } else {
                for (int x = 0; x < count; x++) {
                    dst.put((byte) row.get(x).luma8());
                }
            }
        }
    },

    /** Two bytes of luminance per pixel, big-endian. */
    GRAY16_BE(2, PixelEncoding.GRAY16) {
        @Override
        void unpack(ByteBuffer src, PixelRow row, int count) {
            if (row instanceof Gray16Row gray) {
                for (int x = 0; x < count; x++) {
                    gray.setGray(x, src.getShort() & 0xffff);
                }
            } else if (row instanceof GrayF32Row gray) {
                for (int x = 0; x < count; x++) {
                    gray.setChannel(x, 0, (src.getShort() & 0xffff) / 65535f);
                }
            } else {
                for (int x = 0; x < count; x++) {
                    row.set(x, PixelColor.gray16(src.getShort() & 0xffff));
                }
            }
        }

        @Override
        void pack(PixelRow row, ByteBuffer dst, int count) {
            if (row instanceof Gray16Row gray) {
                for (int x = 0; x < count; x++) {
                    dst.putShort((short) gray.getGray(x));
                }
            } else if (row instanceof GrayF32Row gray) {
                for (int x = 0; x < count; x++) {
                    dst.putShort((short) PixelColor.floatTo16(gray.getChannel(x, 0)));
                }
            } else {
                for (int x = 0; x < count; x++) {
                    dst.putShort((short) row.get(x).luma16());
                }
            }
        }
    },

    /** Red, green and blue, one byte each. */
    RGB8(3, PixelEncoding.RGBA32) {
        @Override
        void unpack(ByteBuffer src, PixelRow row, int count) {
            unpack8(src, row, count, false);
        }

        @Override
        void pack(PixelRow row, ByteBuffer dst, int count) {
            pack8(row, dst, count, false);
        }
    },

    /** Red, green and blue, two bytes each, big-endian. */
    RGB16_BE(6, PixelEncoding.RGBA64) {
        @Override
        void unpack(ByteBuffer src, PixelRow row, int count) {
            unpack16(src, row, count, false);
        }

        @Override
        void pack(PixelRow row, ByteBuffer dst, int count) {
            pack16(row, dst, count, false);
        }
    },

    /** Red, green, blue and alpha, one byte each. */
    RGBA8(4, PixelEncoding.RGBA32) {
        @Override
        void unpack(ByteBuffer src, PixelRow row, int count) {
            unpack8(src, row, count, true);
        }

        @Override
        void pack(PixelRow row, ByteBuffer dst, int count) {
            pack8(row, dst, count, true);
        }
    },

    /** Red, green, blue and alpha, two bytes each, big-endian. */
    RGBA16_BE(8, PixelEncoding.RGBA64) {
        @Override
        void unpack(ByteBuffer src, PixelRow row, int count) {
            unpack16(src, row, count, true);
        }

        @Override
        void pack(PixelRow row, ByteBuffer dst, int count) {
            pack16(row, dst, count, true);
        }
    };

    private final int bytesPerPixel;
    private final PixelEncoding encoding;

    RawRowFormat(int bytesPerPixel, PixelEncoding encoding) {
        this.bytesPerPixel = bytesPerPixel;
        this.encoding = encoding;
    }

    /**
     * @return the size of a pixel, in bytes
     */
    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    /**
     * @param width line width, in pixels
     * @return the size of a line, in bytes
     */
    public int lineLength(int width) {
        return Math.multiplyExact(width, bytesPerPixel);
    }

    /**
     * @return the row encoding that represents this format without loss
     */
    public PixelEncoding encoding() {
        return encoding;
    }

    /**
     * Decodes pixels from {@code src} into {@code row}, starting at the buffer's
     * position, which is advanced past the consumed bytes.
     *
     * @param src the raw bytes
     * @param row the row to fill
     * @return the number of decoded pixels, {@code min(row.width(), src.remaining() / bytesPerPixel())}
     */
    public int unpack(ByteBuffer src, PixelRow row) {
        final int count = Math.min(row.width(), src.remaining() / bytesPerPixel);
        unpack(src, row, count);
        return count;
    }

    /**
     * Encodes pixels of {@code row} into {@code dst}, starting at the buffer's
     * position, which is advanced past the written bytes.
     *
     * @param row the row to encode
     * @param dst the destination buffer
     * @return the number of encoded pixels, {@code min(row.width(), dst.remaining() / bytesPerPixel())}
     */
    public int pack(PixelRow row, ByteBuffer dst) {
        final int count = Math.min(row.width(), dst.remaining() / bytesPerPixel);
        pack(row, dst, count);
        return count;
    }

    abstract void unpack(ByteBuffer src, PixelRow row, int count);

    abstract void pack(PixelRow row, ByteBuffer dst, int count);

    private static void unpack8(ByteBuffer src, PixelRow row, int count, boolean alpha) {
        for (int x = 0; x < count; x++) {
            int r = src.get() & 0xff;
            int g = src.get() & 0xff;
            int b = src.get() & 0xff;
            int a = alpha ? src.get() & 0xff : 0xff;
            if (row instanceof Rgba32Row rgba) {
                rgba.setRgba(x, r, g, b, a);
            } else if (row instanceof RgbaF32Row rgba) {
                setFloat(rgba, x, r / 255f, g / 255f, b / 255f, a / 255f);
            } else {
                row.set(x, PixelColor.rgba8(r, g, b, a));
            }
        }
    }

    private static void unpack16(ByteBuffer src, PixelRow row, int count, boolean alpha) {
        for (int x = 0; x < count; x++) {
            int r = src.getShort() & 0xffff;
            int g = src.getShort() & 0xffff;
            int b = src.getShort() & 0xffff;
            int a = alpha ? src.getShort() & 0xffff : PixelColor.MAX;
            if (row instanceof Rgba64Row rgba) {
                rgba.setRgba(x, r, g, b, a);
            } else if (row instanceof RgbaF32Row rgba) {
                setFloat(rgba, x, r / 65535f, g / 65535f, b / 65535f, a / 65535f);
            } else {
                row.set(x, PixelColor.rgba16(r, g, b, a));
            }
        }
    }

    private static void pack8(PixelRow row, ByteBuffer dst, int count, boolean alpha) {
        final int channels = alpha ? 4 : 3;
        if (row instanceof Rgba32Row rgba) {
            for (int x = 0; x < count; x++) {
                for (int c = 0; c < channels; c++) {
                    dst.put((byte) rgba.getChannel(x, c));
                }
            }
        } else if (row instanceof RgbaF32Row rgba) {
            for (int x = 0; x < count; x++) {
                for (int c = 0; c < channels; c++) {
                    dst.put((byte) PixelColor.floatTo8(rgba.getChannel(x, c)));
                }
            }
        } else {
            for (int x = 0; x < count; x++) {
                PixelColor color = row.get(x);
                dst.put((byte) color.r8()).put((byte) color.g8()).put((byte) color.b8());
                if (alpha) {
                    dst.put((byte) color.a8());
                }
            }
        }
    }

    private static void pack16(PixelRow row, ByteBuffer dst, int count, boolean alpha) {
        final int channels = alpha ? 4 : 3;
        if (row instanceof Rgba64Row rgba) {
            for (int x = 0; x < count; x++) {
                for (int c = 0; c < channels; c++) {
                    dst.putShort((short) rgba.getChannel(x, c));
                }
            }
        } else if (row instanceof RgbaF32Row rgba) {
            for (int x = 0; x < count; x++) {
                for (int c = 0; c < channels; c++) {
                    dst.putShort((short) PixelColor.floatTo16(rgba.getChannel(x, c)));
                }
            }
        } else {
            for (int x = 0; x < count; x++) {
                PixelColor color = row.get(x);
                dst.putShort((short) color.r()).putShort((short) color.g()).putShort((short) color.b());
                if (alpha) {
                    dst.putShort((short) color.a());
                }
            }
        }
    }

    private static void setFloat(FloatPixelRow row, int x, float r, float g, float b, float a) {
        row.setChannel(x, 0, r);
        row.setChannel(x, 1, g);
        row.setChannel(x, 2, b);
        row.setChannel(x, 3, a);
    }
}
