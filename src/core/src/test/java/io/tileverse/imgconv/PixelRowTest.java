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
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PixelRowTest {

    @ParameterizedTest
    @EnumSource(PixelEncoding.class)
    void create_returnsRowOfRequestedEncodingAndWidth(PixelEncoding encoding) {
        PixelRow row = PixelRow.create(encoding, 7);
        assertThat(row.encoding()).isEqualTo(encoding);
        assertThat(row.width()).isEqualTo(7);
    }

    @ParameterizedTest
    @EnumSource(PixelEncoding.class)
    void setAndGet_whiteAndBlack_areExact(PixelEncoding encoding) {
        PixelRow row = PixelRow.create(encoding, 2);
        row.set(0, PixelColor.WHITE);
        row.set(1, PixelColor.BLACK);
        assertThat(row.get(0)).isEqualTo(PixelColor.WHITE);
        assertThat(row.get(1)).isEqualTo(PixelColor.BLACK);
    }

    @Test
    void create_withNegativeWidth_throwsException() {
        assertThatThrownBy(() -> PixelRow.create(PixelEncoding.GRAY8, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be negative");
    }

    @Test
    void get_outOfBounds_throwsIndexOutOfBounds() {
        PixelRow row = PixelRow.create(PixelEncoding.RGBA32, 3);
        assertThatThrownBy(() -> row.get(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> row.get(-1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> row.set(3, PixelColor.WHITE)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void slice_sharesStorageWithParent() {
        Gray8Row row = (Gray8Row) PixelRow.create(PixelEncoding.GRAY8, 6);
        PixelRow slice = row.slice(2, 4);
        assertThat(slice.width()).isEqualTo(2);

        slice.set(0, PixelColor.WHITE);
        slice.set(1, PixelColor.gray8(0x40));

        assertThat(row.getGray(1)).isZero();
        assertThat(row.getGray(2)).isEqualTo(0xff);
        assertThat(row.getGray(3)).isEqualTo(0x40);
        assertThat(row.getGray(4)).isZero();
    }

    @Test
    void slice_isBoundsCheckedAgainstItsOwnWidth() {
        PixelRow slice = PixelRow.create(PixelEncoding.RGBA64, 10).slice(3, 5);
        assertThatThrownBy(() -> slice.get(2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> slice.slice(0, 3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void fill_setsEveryPixelOfASliceOnly() {
        PixelRow row = PixelRow.create(PixelEncoding.RGBA32, 4);
        row.slice(1, 3).fill(PixelColor.WHITE);
        assertThat(row.get(0)).isEqualTo(PixelColor.TRANSPARENT);
        assertThat(row.get(1)).isEqualTo(PixelColor.WHITE);
        assertThat(row.get(2)).isEqualTo(PixelColor.WHITE);
        assertThat(row.get(3)).isEqualTo(PixelColor.TRANSPARENT);
    }

    @Test
    void copyFrom_returnsMinimumWidth() {
        PixelRow wide = PixelRow.create(PixelEncoding.GRAY8, 10);
        PixelRow narrow = PixelRow.create(PixelEncoding.GRAY8, 4);
        assertThat(narrow.copyFrom(wide)).isEqualTo(4);
        assertThat(wide.copyFrom(narrow)).isEqualTo(4);
        assertThat(wide.copyFrom(PixelRow.create(PixelEncoding.RGBA32, 0))).isZero();
    }

    @Test
    void copyFrom_gray8ToGray16_replicatesBits() {
        Gray8Row src = (Gray8Row) PixelRow.create(PixelEncoding.GRAY8, 2);
        src.setGray(0, 0xab);
        src.setGray(1, 0x01);
        Gray16Row dst = (Gray16Row) PixelRow.create(PixelEncoding.GRAY16, 2);
        dst.copyFrom(src);
        assertThat(dst.getGray(0)).isEqualTo(0xabab);
        assertThat(dst.getGray(1)).isEqualTo(0x0101);
    }

    @Test
    void copyFrom_gray16ToGray8_truncates() {
        Gray16Row src = (Gray16Row) PixelRow.create(PixelEncoding.GRAY16, 1);
        src.setGray(0, 0x12ff);
        Gray8Row dst = (Gray8Row) PixelRow.create(PixelEncoding.GRAY8, 1);
        dst.copyFrom(src);
        assertThat(dst.getGray(0)).isEqualTo(0x12);
    }

    @Test
    void copyFrom_grayToRgba_replicatesChannelsAndIsOpaque() {
        Gray8Row src = (Gray8Row) PixelRow.create(PixelEncoding.GRAY8, 1);
        src.setGray(0, 0x40);
        Rgba32Row dst = (Rgba32Row) PixelRow.create(PixelEncoding.RGBA32, 1);
        dst.copyFrom(src);
        assertThat(dst.get(0)).isEqualTo(PixelColor.rgba8(0x40, 0x40, 0x40, 0xff));

        Rgba64Row dst64 = (Rgba64Row) PixelRow.create(PixelEncoding.RGBA64, 1);
        dst64.copyFrom(src);
        assertThat(dst64.getChannel(0, 0)).isEqualTo(0x4040);
        assertThat(dst64.getChannel(0, 3)).isEqualTo(0xffff);
    }

    @Test
    void copyFrom_rgbaToGray_usesLuma() {
        Rgba32Row src = (Rgba32Row) PixelRow.create(PixelEncoding.RGBA32, 3);
        src.setRgba(0, 255, 0, 0, 255);
        src.setRgba(1, 0, 255, 0, 255);
        src.setRgba(2, 0, 0, 255, 255);
        Gray8Row dst = (Gray8Row) PixelRow.create(PixelEncoding.GRAY8, 3);
        dst.copyFrom(src);
        assertThat(dst.getGray(0)).isEqualTo(76);
        assertThat(dst.getGray(1)).isEqualTo(150);
        assertThat(dst.getGray(2)).isEqualTo(29);
    }

    @Test
    void copyFrom_rgba32ToRgba64_expandsAndBack() {
        Rgba32Row src = (Rgba32Row) PixelRow.create(PixelEncoding.RGBA32, 1);
        src.setRgba(0, 0x12, 0x34, 0x56, 0x78);
        Rgba64Row wide = (Rgba64Row) PixelRow.create(PixelEncoding.RGBA64, 1);
        wide.copyFrom(src);
        assertThat(wide.getChannel(0, 0)).isEqualTo(0x1212);
        assertThat(wide.getChannel(0, 3)).isEqualTo(0x7878);

        Rgba32Row back = (Rgba32Row) PixelRow.create(PixelEncoding.RGBA32, 1);
        back.copyFrom(wide);
        assertThat(back.get(0)).isEqualTo(src.get(0));
    }

    @Test
    void copyFrom_integerToFloat_dividesByChannelMaximum() {
        Gray8Row src = (Gray8Row) PixelRow.create(PixelEncoding.GRAY8, 2);
        src.setGray(0, 255);
        src.setGray(1, 51);
        GrayF32Row dst = (GrayF32Row) PixelRow.create(PixelEncoding.GRAY_F32, 2);
        dst.copyFrom(src);
        assertThat(dst.getChannel(0, 0)).isEqualTo(1f);
        assertThat(dst.getChannel(1, 0)).isCloseTo(0.2f, within(1e-6f));
    }

    @Test
    void copyFrom_floatToInteger_clampsAndRounds() {
        RgbaF32Row src = (RgbaF32Row) PixelRow.create(PixelEncoding.RGBA_F32, 1);
        src.setChannel(0, 0, 1.5f);
        src.setChannel(0, 1, -0.25f);
        src.setChannel(0, 2, 0.5f);
        src.setChannel(0, 3, Float.NaN);
        Rgba32Row dst = (Rgba32Row) PixelRow.create(PixelEncoding.RGBA32, 1);
        dst.copyFrom(src);
        assertThat(dst.getChannel(0, 0)).isEqualTo(255);
        assertThat(dst.getChannel(0, 1)).isZero();
        assertThat(dst.getChannel(0, 2)).isEqualTo(128);
        assertThat(dst.getChannel(0, 3)).isZero();
    }

    @Test
    void copyFrom_rgbaToGrayFloat_usesGenericPath() {
        Rgba64Row src = (Rgba64Row) PixelRow.create(PixelEncoding.RGBA64, 1);
        src.setRgba(0, 0xffff, 0xffff, 0xffff, 0x1234);
        GrayF32Row dst = (GrayF32Row) PixelRow.create(PixelEncoding.GRAY_F32, 1);
        dst.copyFrom(src);
        assertThat(dst.getChannel(0, 0)).isEqualTo(1f);
    }

    @Test
    void accumulate_addsWeightedPixels() {
        RgbaF32Row src = (RgbaF32Row) PixelRow.create(PixelEncoding.RGBA_F32, 2);
        src.set(0, PixelColor.WHITE);
        RgbaF32Row acc = (RgbaF32Row) PixelRow.create(PixelEncoding.RGBA_F32, 1);
        acc.accumulate(0, src, 0, 0.25f);
        acc.accumulate(0, src, 0, 0.5f);
        assertThat(acc.getChannel(0, 0)).isEqualTo(0.75f);
        assertThat(acc.getChannel(0, 3)).isEqualTo(0.75f);

        acc.clear();
        assertThat(acc.getChannel(0, 0)).isZero();
    }

    @Test
    void accumulate_withDifferentEncoding_throwsException() {
        FloatPixelRow gray = (FloatPixelRow) PixelRow.create(PixelEncoding.GRAY_F32, 1);
        FloatPixelRow rgba = (FloatPixelRow) PixelRow.create(PixelEncoding.RGBA_F32, 1);
        assertThatThrownBy(() -> gray.addScaled(rgba, 1f)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pixelColor_outOfRangeChannel_throwsException() {
        assertThatThrownBy(() -> new PixelColor(0, 0, 0x10000, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PixelColor(-1, 0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void encoding_transparentDefault_dependsOnAlpha() {
        assertThat(PixelEncoding.GRAY8.transparent()).isEqualTo(PixelColor.BLACK);
        assertThat(PixelEncoding.RGBA32.transparent()).isEqualTo(PixelColor.TRANSPARENT);
        assertThat(PixelEncoding.RGBA64.accumulationEncoding()).isEqualTo(PixelEncoding.RGBA_F32);
        assertThat(PixelEncoding.GRAY16.accumulationEncoding()).isEqualTo(PixelEncoding.GRAY_F32);
    }
}
