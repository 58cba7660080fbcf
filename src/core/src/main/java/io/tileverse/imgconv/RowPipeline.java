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

import io.tileverse.imgconv.filter.GrayscaleFilter;
import io.tileverse.imgconv.resize.Resizer;
import io.tileverse.imgconv.scale.CoefficientCache;
import io.tileverse.imgconv.scale.Scaler;
import io.tileverse.imgconv.spi.PipelineConfig;
import io.tileverse.imgconv.transform.ImageTransform;
import io.tileverse.imgconv.transform.Transformer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fluent construction of a chain of row filters over a source.
 * <p>
 * Stages are applied in the order they are added, each one wrapping the
 * previous:
 *
 * <pre>{@code
 * try (RowSource source = RowPipeline.from(decoder)
 *         .resize(new ImageRect(0, 0, 2480, 3508))
 *         .scale(1240, 1754)
 *         .grayscale()
 *         .build()) {
 *     RowPipeline.drain(source, encoder);
 * }
 * }</pre>
 *
 * Closing the built source closes every stage and, last, the original source.
 */
@Slf4j
public final class RowPipeline {

    private RowPipeline() {
        // use from(RowSource)
    }

    /**
     * @param source the first source of the chain
     * @return a builder with no stages
     */
    public static Builder from(@NonNull RowSource source) {
        return new Builder(source);
    }

    /**
     * Reads every row of {@code source} and writes it to {@code sink}. Neither is closed.
     *
     * @param source the source to read
     * @param sink the sink to write to
     * @return the number of transferred rows
     * @throws IOException if reading or writing fails
     */
    public static int drain(@NonNull RowSource source, @NonNull RowSink sink) throws IOException {
        final PixelRow row = source.newRow();
        int rows = 0;
        while (source.next(row) != RowSource.END_OF_STREAM) {
            sink.write(row);
            rows++;
        }
        return rows;
    }

    /**
     * Builder of a filter chain.
     */
    public static class Builder {

        private final RowSource source;

        private final List<UnaryOperator<RowSource>> stages = new ArrayList<>();

        private PipelineConfig config = new PipelineConfig();

        private CoefficientCache coefficientCache;

        private Builder(RowSource source) {
            this.source = source;
        }

        /**
         * @param config tuning parameters for the stages
         * @return this builder
         */
        public Builder config(@NonNull PipelineConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Uses the given cache for scaling stages instead of one sized after
         * {@link PipelineConfig#COEFFICIENT_CACHE_SIZE}.
         *
         * @param cache the coefficient cache
         * @return this builder
         */
        public Builder coefficientCache(@NonNull CoefficientCache cache) {
            this.coefficientCache = cache;
            return this;
        }

        /**
         * Adds a {@link Scaler} stage.
         *
         * @param width target width
         * @param height target height
         * @return this builder
         */
        public Builder scale(int width, int height) {
            stages.add(s -> Scaler.create(s, width, height, coefficientCache()));
            return this;
        }

        /**
         * Adds a {@link Resizer} stage.
         *
         * @param rect the output rectangle, in the coordinates of the previous stage
         * @return this builder
         */
        public Builder resize(@NonNull ImageRect rect) {
            stages.add(s -> Resizer.create(s, rect));
            return this;
        }

        /**
         * Adds a {@link GrayscaleFilter} stage.
         *
         * @return this builder
         */
        public Builder grayscale() {
            stages.add(GrayscaleFilter::create);
            return this;
        }

        /**
         * Adds a {@link Transformer} stage producing an image of the given size and encoding.
         *
         * @param width output width
         * @param height output height
         * @param encoding output encoding
         * @param transform the transform
         * @return this builder
         */
        public Builder transform(
                int width, int height, @NonNull PixelEncoding encoding, @NonNull ImageTransform transform) {
            stages.add(s -> Transformer.create(
                    s, width, height, encoding, transform, config.adapterWindow(), config.loopbackCapacity()));
            return this;
        }

        /**
         * Adds a {@link Transformer} stage keeping the size and encoding of the previous stage.
         *
         * @param transform the transform
         * @return this builder
         */
        public Builder transform(@NonNull ImageTransform transform) {
            stages.add(s -> Transformer.create(
                    s,
                    s.size().width(),
                    s.size().height(),
                    s.encoding(),
                    transform,
                    config.adapterWindow(),
                    config.loopbackCapacity()));
            return this;
        }

        /**
         * Applies the stages.
         * <p>
         * If a stage cannot be created, the stages built so far and the original
         * source are closed before the exception is rethrown.
         *
         * @return the last source of the chain
         */
        public RowSource build() {
            RowSource current = source;
            for (UnaryOperator<RowSource> stage : stages) {
                try {
                    current = stage.apply(current);
                } catch (RuntimeException e) {
                    try {
                        current.close();
                    } catch (IOException closeError) {
                        e.addSuppressed(closeError);
                    }
                    throw e;
                }
            }
            log.debug(
                    "Built pipeline: {} {} -> {} {}",
                    source.size(),
                    source.encoding(),
                    current.size(),
                    current.encoding());
            return current;
        }

        /**
         * Builds the chain, drains it into {@code sink} and closes both.
         *
         * @param sink the terminal sink
         * @return the number of transferred rows
         * @throws IOException if reading, writing or closing fails
         */
        public int writeTo(@NonNull RowSink sink) throws IOException {
            try (sink;
                    RowSource built = build()) {
                return drain(built, sink);
            }
        }

        private CoefficientCache coefficientCache() {
            if (coefficientCache == null) {
                int size = config.coefficientCacheSize();
                coefficientCache = size == CoefficientCache.DEFAULT_MAXIMUM_SIZE
                        ? CoefficientCache.getDefault()
                        : new CoefficientCache(size);
            }
            return coefficientCache;
        }
    }
}
