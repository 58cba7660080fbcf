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
package io.tileverse.imgconv.spi;

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.List;

/**
 * Describes a tunable value of the image pipeline: the key it is looked up
 * with, the component group it applies to, its type and the value used when
 * it is not configured.
 *
 * @param <T> the type of the parameter's value
 * @param key the unique key identifying the parameter, also its property name
 * @param group the component the parameter applies to (e.g., "adapter", "scale")
 * @param description a human-readable description of the parameter
 * @param type the {@link Class} of the parameter's value
 * @param defaultValue the value used when the parameter is not set
 * @param sampleValues suggested values, for documentation and tooling
 */
public record PipelineParameter<T>(
        String key, String group, String description, Class<T> type, T defaultValue, List<T> sampleValues) {

    /**
     * Validates the parameter definition.
     *
     * @param key unique identifier for this parameter
     * @param group component grouping
     * @param description what this parameter does
     * @param type the Java type of values this parameter accepts
     * @param defaultValue the value used when the parameter is not set
     * @param sampleValues example values
     */
    public PipelineParameter {
        requireNonNull(key, "Parameter key cannot be null");
        requireNonNull(group, "Parameter group cannot be null");
        requireNonNull(description, "Parameter description cannot be null");
        requireNonNull(type, "Parameter type cannot be null");
        requireNonNull(defaultValue, "Parameter default value cannot be null");
        if (!type.isInstance(defaultValue)) {
            throw new IllegalArgumentException("Default value of " + key + " is not a " + type.getSimpleName());
        }
        sampleValues = List.copyOf(requireNonNull(sampleValues, "Parameter sample values list cannot be null"));
    }

    /**
     * Defines an integer parameter.
     *
     * @param key the parameter key
     * @param group the parameter group
     * @param description the parameter description
     * @param defaultValue the default value
     * @param sampleValues suggested values
     * @return the parameter
     */
    public static PipelineParameter<Integer> ofInt(
            String key, String group, String description, int defaultValue, int... sampleValues) {
        List<Integer> samples = Arrays.stream(sampleValues).boxed().toList();
        return new PipelineParameter<>(key, group, description, Integer.class, defaultValue, samples);
    }
}
