package io.abcsmc.model.scalar;

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

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Flat prior on a closed interval. Every value between the bounds has the
 * density {@code 1 / width}; anything outside has density 0.
 */
@ModelType(UniformScalarModel.MODEL_TYPE)
public class UniformScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "uniform";

    @SerializedName("lower")
    private final double lower;

    @SerializedName("upper")
    private final double upper;

    /**
     * @param lower smallest value with positive density
     * @param upper largest value with positive density, greater than lower
     */
    public UniformScalarModel(double lower, double upper) {
        if (!(lower < upper)) {
            throw new IllegalArgumentException("Uniform prior needs lower < upper, got [" + lower + ", " + upper + "]");
        }
        this.lower = lower;
        this.upper = upper;
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public boolean contains(double x) {
        return x >= lower && x <= upper;
    }

    @Override
    public double pdf(double x) {
        return contains(x) ? 1.0 / (upper - lower) : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UniformScalarModel)) {
            return false;
        }
        UniformScalarModel other = (UniformScalarModel) o;
        return Double.compare(lower, other.lower) == 0 && Double.compare(upper, other.upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(MODEL_TYPE, lower, upper);
    }

    @Override
    public String toString() {
        return "U[" + lower + ", " + upper + "]";
    }
}
