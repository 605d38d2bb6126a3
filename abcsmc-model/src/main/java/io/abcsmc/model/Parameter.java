package io.abcsmc.model;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable, ordered mapping from parameter name to real value (θ).
///
/// Insertion order is preserved and is significant for [#toArray(List)]
/// conversions used by the perturbation kernels.
///
/// ```java
/// Parameter theta = Parameter.of("rate", 0.3, "shape", 2.0);
/// theta.get("rate");   // 0.3
/// theta.names();       // [rate, shape]
/// ```
public final class Parameter {

    private final Map<String, Double> values;

    private Parameter(LinkedHashMap<String, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /// Creates a parameter from a map, preserving the map's iteration order.
    ///
    /// @param values name to value mapping
    /// @return a new parameter
    /// @throws IllegalArgumentException if any value is NaN
    public static Parameter of(Map<String, ? extends Number> values) {
        Objects.requireNonNull(values, "values");
        Builder builder = builder();
        values.forEach((name, value) -> builder.put(name, value.doubleValue()));
        return builder.build();
    }

    public static Parameter of(String name, double value) {
        return builder().put(name, value).build();
    }

    public static Parameter of(String name1, double value1, String name2, double value2) {
        return builder().put(name1, value1).put(name2, value2).build();
    }

    /// Creates a parameter from parallel name and value arrays.
    ///
    /// @param names parameter names, in order
    /// @param values values, same length as names
    /// @return a new parameter
    public static Parameter fromArray(List<String> names, double[] values) {
        if (names.size() != values.length) {
            throw new IllegalArgumentException(
                "Expected " + names.size() + " values but got " + values.length);
        }
        Builder builder = builder();
        for (int i = 0; i < values.length; i++) {
            builder.put(names.get(i), values[i]);
        }
        return builder.build();
    }

    public static Parameter empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @param name parameter name
    /// @return the value
    /// @throws IllegalArgumentException if the parameter has no such name
    public double get(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No parameter named '" + name + "', known: " + values.keySet());
        }
        return value;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /// Projects this parameter onto the given name order.
    ///
    /// @param order names in the desired order
    /// @return values in that order
    public double[] toArray(List<String> order) {
        double[] result = new double[order.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = get(order.get(i));
        }
        return result;
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameter)) return false;
        Parameter that = (Parameter) o;
        return values.equals(that.values) && names().equals(that.names());
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /// Builder preserving insertion order.
    public static final class Builder {
        private final LinkedHashMap<String, Double> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, double value) {
            Objects.requireNonNull(name, "name");
            if (Double.isNaN(value)) {
                throw new IllegalArgumentException("Parameter '" + name + "' is NaN");
            }
            values.put(name, value);
            return this;
        }

        public Parameter build() {
            return new Parameter(new LinkedHashMap<>(values));
        }
    }
}
