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

import io.tileverse.imgconv.adapters.SourceImageAdapter;
import io.tileverse.imgconv.loopback.Loopback;
import io.tileverse.imgconv.scale.CoefficientCache;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Tuning parameters of an image pipeline.
 * <p>
 * Values are looked up by {@link PipelineParameter}; a parameter that was not
 * set resolves to its default value. Configurations round-trip through
 * {@link Properties}, so they can be loaded from a file or system properties:
 *
 * <pre>{@code
 * PipelineConfig config = PipelineConfig.fromProperties(System.getProperties());
 * int window = config.getInt(PipelineConfig.ADAPTER_WINDOW);
 * }</pre>
 */
public class PipelineConfig {

    /** Parameter group of the windowed random-access adapters. */
    public static final String GROUP_ADAPTER = "adapter";

    /** Parameter group of the loopback pipe. */
    public static final String GROUP_LOOPBACK = "loopback";

    /** Parameter group of the scaler. */
    public static final String GROUP_SCALE = "scale";

    /** Number of rows retained by the source and target image adapters. */
    public static final PipelineParameter<Integer> ADAPTER_WINDOW = PipelineParameter.ofInt(
            "io.tileverse.imgconv.adapter.window",
            GROUP_ADAPTER,
            "Number of recent rows a transform can look up, and of rows it can still modify",
            SourceImageAdapter.DEFAULT_WINDOW,
            4, 8, 16, 32);

    /** Number of rows a transformer's worker may produce ahead of its reader. */
    public static final PipelineParameter<Integer> LOOPBACK_CAPACITY = PipelineParameter.ofInt(
            "io.tileverse.imgconv.loopback.capacity",
            GROUP_LOOPBACK,
            "Maximum number of rows queued between a producer and a consumer thread",
            Loopback.DEFAULT_CAPACITY,
            2, 8, 32);

    /** Maximum number of cached coefficient lists. */
    public static final PipelineParameter<Integer> COEFFICIENT_CACHE_SIZE = PipelineParameter.ofInt(
            "io.tileverse.imgconv.scale.coefficient-cache-size",
            GROUP_SCALE,
            "Maximum number of (source length, destination length) coefficient lists kept in memory",
            CoefficientCache.DEFAULT_MAXIMUM_SIZE,
            16, 64, 256);

    private final Map<String, Object> parameterValues = new HashMap<>();

    /**
     * Creates an empty configuration, in which every parameter resolves to its default.
     */
    public PipelineConfig() {
        // Default constructor
    }

    /**
     * @return all known pipeline parameters
     */
    public static List<PipelineParameter<?>> parameters() {
        return List.of(ADAPTER_WINDOW, LOOPBACK_CAPACITY, COEFFICIENT_CACHE_SIZE);
    }

    /**
     * Sets a parameter value by key. The value is not validated.
     *
     * @param key the parameter key
     * @param value the value, {@code null} to unset it
     * @return this configuration
     */
    public PipelineConfig setParameter(String key, Object value) {
        requireNonNull(key, "key");
        if (value == null) {
            parameterValues.remove(key);
        } else {
            parameterValues.put(key, value);
        }
        return this;
    }

    /**
     * @param <T> the type of the parameter value
     * @param param the parameter
     * @param value the value, {@code null} to unset it
     * @return this configuration
     */
    public <T> PipelineConfig setParameter(PipelineParameter<T> param, T value) {
        return setParameter(param.key(), value);
    }

    /**
     * @param <T> the type of the parameter value
     * @param param the parameter
     * @return the explicitly set value, converted to the parameter type
     */
    public <T> Optional<T> getParameter(PipelineParameter<T> param) {
        return getParameter(param.key(), param.type());
    }

    /**
     * @param <T> the target type
     * @param key the parameter key
     * @param type the target type
     * @return the explicitly set value, converted to {@code type}
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public <T> Optional<T> getParameter(String key, Class<T> type) {
        Object value = parameterValues.get(requireNonNull(key, "key"));
        requireNonNull(type, "type");
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(convert(value, type));
    }

    /**
     * Resolves a positive integer parameter.
     *
     * @param param the parameter
     * @return the set value, or the parameter default
     * @throws IllegalArgumentException if the value is not a positive integer
     */
    public int getInt(PipelineParameter<Integer> param) {
        int value = getParameter(param).orElse(param.defaultValue());
        if (value <= 0) {
            throw new IllegalArgumentException(param.key() + " must be positive: " + value);
        }
        return value;
    }

    /**
     * @return the {@link #ADAPTER_WINDOW} value
     */
    public int adapterWindow() {
        return getInt(ADAPTER_WINDOW);
    }

    /**
     * @return the {@link #LOOPBACK_CAPACITY} value
     */
    public int loopbackCapacity() {
        return getInt(LOOPBACK_CAPACITY);
    }

    /**
     * @return the {@link #COEFFICIENT_CACHE_SIZE} value
     */
    public int coefficientCacheSize() {
        return getInt(COEFFICIENT_CACHE_SIZE);
    }

    /**
     * Converts a value to the given type. Supports {@code String}, {@code Boolean} and {@code Integer}.
     *
     * @param <T> the target type
     * @param value the value
     * @param type the target type
     * @return the converted value
     * @throws IllegalArgumentException if the conversion is not supported or fails
     */
    static <T> T convert(Object value, Class<T> type) {
        if (type.isInstance(value)) return type.cast(value);

        Object converted;
        if (type.equals(String.class)) {
            converted = String.valueOf(value);
        } else if (type.equals(Boolean.class)) {
            converted = Boolean.valueOf(String.valueOf(value));
        } else if (type.equals(Integer.class)) {
            converted = Integer.parseInt(String.valueOf(value).trim());
        } else {
            throw new IllegalArgumentException("Unsupported conversion %s to %s"
                    .formatted(value.getClass().getCanonicalName(), type.getCanonicalName()));
        }
        return type.cast(converted);
    }

    /**
     * @return the explicitly set parameters, as strings
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        parameterValues.forEach((name, v) -> properties.setProperty(name, String.valueOf(v)));
        return properties;
    }

    /**
     * Creates a configuration from the pipeline parameters found in {@code properties}.
     * Unrelated properties are ignored.
     *
     * @param properties the properties
     * @return a new configuration
     */
    public static PipelineConfig fromProperties(Properties properties) {
        requireNonNull(properties);
        PipelineConfig config = new PipelineConfig();
        for (PipelineParameter<?> param : parameters()) {
            Object value = properties.get(param.key());
            if (value != null) {
                config.setParameter(param.key(), value);
            }
        }
        return config;
    }

    /**
     * @param parameters the parameters whose defaults to set
     * @return a configuration with the default value of every parameter set explicitly
     */
    public static PipelineConfig withDefaults(List<PipelineParameter<?>> parameters) {
        PipelineConfig config = new PipelineConfig();
        parameters.forEach(p -> config.setParameter(p.key(), p.defaultValue()));
        return config;
    }

    @Override
    public String toString() {
        return "PipelineConfig" + parameterValues;
    }
}
